package com.phillippitts.videoconverter.service.queue;

import com.phillippitts.videoconverter.domain.ConversionJob;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Unbounded FIFO of jobs ready for a worker. Stability gates and the retry scheduler
 * produce, workers consume.
 */
public class JobQueue {

    private final BlockingQueue<ConversionJob> queue = new LinkedBlockingQueue<>();

    public void enqueue(ConversionJob job) {
        queue.add(job);
    }

    /**
     * Waits up to {@code timeout} for the next job.
     *
     * @return the job, or null if none arrived in time
     */
    public ConversionJob poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public int size() {
        return queue.size();
    }

    /** Removes and returns everything still waiting. */
    public List<ConversionJob> drain() {
        List<ConversionJob> drained = new ArrayList<>();
        queue.drainTo(drained);
        return drained;
    }
}
