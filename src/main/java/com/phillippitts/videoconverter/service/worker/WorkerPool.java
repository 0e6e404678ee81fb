package com.phillippitts.videoconverter.service.worker;

import com.phillippitts.videoconverter.domain.ConversionJob;
import com.phillippitts.videoconverter.domain.EncoderProfile;
import com.phillippitts.videoconverter.domain.ErrorKind;
import com.phillippitts.videoconverter.domain.JobStatus;
import com.phillippitts.videoconverter.domain.TranscodeOutcome;
import com.phillippitts.videoconverter.service.events.ConverterEvent;
import com.phillippitts.videoconverter.service.events.EventSink;
import com.phillippitts.videoconverter.service.queue.JobQueue;
import com.phillippitts.videoconverter.service.retry.RetryManager;
import com.phillippitts.videoconverter.service.transcode.TranscodeExecutor;
import com.phillippitts.videoconverter.util.ProcessTimeouts;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Files;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Fixed set of worker loops that take jobs off the {@link JobQueue} and convert them.
 *
 * <p>Exactly {@code workers} loops are started, so at most that many conversions run at
 * once. Each loop blocks on the conversion; the retry decision is delegated to
 * {@link RetryManager}. While a job runs, {@code jobId} and {@code source} are in the
 * Log4j2 ThreadContext.
 *
 * <p>Shutdown stops dequeuing, lets in-flight conversions finish within the grace period,
 * then kills the remaining subprocesses. Jobs killed that way and jobs still queued end
 * ABANDONED.
 */
public class WorkerPool {

    private static final Logger LOG = LogManager.getLogger(WorkerPool.class);
    private static final String COMPONENT = "worker";

    private final int workers;
    private final Executor executor;
    private final JobQueue queue;
    private final TranscodeExecutor transcoder;
    private final RetryManager retryManager;
    private final Supplier<EncoderProfile> profile;
    private final EventSink events;

    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger liveLoops = new AtomicInteger();
    private final Object idle = new Object();

    private volatile boolean accepting;
    private volatile boolean forcedStop;

    public WorkerPool(int workers, Executor executor, JobQueue queue, TranscodeExecutor transcoder,
                      RetryManager retryManager, Supplier<EncoderProfile> profile, EventSink events) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1");
        }
        this.workers = workers;
        this.executor = Objects.requireNonNull(executor, "executor");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.transcoder = Objects.requireNonNull(transcoder, "transcoder");
        this.retryManager = Objects.requireNonNull(retryManager, "retryManager");
        this.profile = Objects.requireNonNull(profile, "profile");
        this.events = Objects.requireNonNull(events, "events");
    }

    public synchronized void start() {
        if (accepting) {
            return;
        }
        accepting = true;
        forcedStop = false;
        for (int i = 0; i < workers; i++) {
            liveLoops.incrementAndGet();
            try {
                executor.execute(this::workerLoop);
            } catch (RuntimeException e) {
                loopExited();
                throw e;
            }
        }
        LOG.info("Started {} conversion workers", workers);
    }

    /** Conversions currently in progress. */
    public int runningCount() {
        return running.get();
    }

    /** Worker loops that have not exited yet. */
    public int liveWorkers() {
        return liveLoops.get();
    }

    public boolean isAccepting() {
        return accepting;
    }

    /**
     * Stops the pool. Blocks for at most {@code grace} plus the subprocess kill timeouts.
     *
     * @return number of jobs abandoned (killed in flight or still queued)
     */
    public int shutdown(Duration grace) {
        accepting = false;
        int abandoned = 0;

        if (!awaitIdle(grace)) {
            forcedStop = true;
            int killed = transcoder.terminateAll();
            LOG.warn("Shutdown grace period of {}s elapsed; terminated {} running conversions",
                    grace.toSeconds(), killed);
            awaitIdle(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.plus(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT)
                    .plus(ProcessTimeouts.QUEUE_POLL_TIMEOUT));
        }

        List<ConversionJob> queued = queue.drain();
        for (ConversionJob job : queued) {
            if (retryManager.abandon(job, "shutdown while queued")) {
                abandoned++;
            }
        }
        return abandoned;
    }

    /** Waits for every loop to exit; a loop exits after its current job or one empty poll. */
    private boolean awaitIdle(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idle) {
            while (liveLoops.get() > 0) {
                long remainingMs = (deadline - System.nanoTime()) / 1_000_000L;
                if (remainingMs <= 0) {
                    return false;
                }
                try {
                    idle.wait(remainingMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return liveLoops.get() == 0;
                }
            }
            return true;
        }
    }

    private void workerLoop() {
        try {
            while (accepting) {
                ConversionJob job;
                try {
                    job = queue.poll(ProcessTimeouts.QUEUE_POLL_TIMEOUT);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
                if (job == null) {
                    continue;
                }
                if (!accepting) {
                    retryManager.abandon(job, "shutdown while queued");
                    break;
                }
                process(job);
            }
        } finally {
            loopExited();
            LOG.debug("Worker loop exited");
        }
    }

    private void process(ConversionJob job) {
        if (job.getStatus() != JobStatus.QUEUED) {
            return;
        }
        if (!Files.exists(job.getSourcePath())) {
            retryManager.abandon(job, "source vanished before conversion");
            return;
        }
        running.incrementAndGet();
        if (!job.startAttempt()) {
            finished();
            return;
        }
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext
                .put("jobId", job.getId())
                .put("source", job.getSourcePath().toString())) {
            EncoderProfile selected = profile.get();
            events.emit(ConverterEvent.of(COMPONENT, Level.INFO, "Conversion started")
                    .with("jobId", job.getId())
                    .with("source", job.getSourcePath())
                    .with("destination", job.getDestinationPath())
                    .with("attempt", job.getAttemptCount())
                    .with("encoder", selected.name()));

            TranscodeOutcome outcome;
            try {
                outcome = transcoder.execute(job, selected);
            } catch (RuntimeException e) {
                LOG.error("Unexpected error converting {}", job.getSourcePath(), e);
                outcome = TranscodeOutcome.failure(-1, "", ErrorKind.RETRYABLE,
                        "unexpected error: " + e.getMessage(), false, 0L);
            }

            if (forcedStop && !outcome.succeeded()) {
                retryManager.abandon(job, "terminated by shutdown");
            } else {
                retryManager.handle(job, outcome);
            }
        } finally {
            finished();
        }
    }

    private void finished() {
        running.decrementAndGet();
    }

    private void loopExited() {
        liveLoops.decrementAndGet();
        synchronized (idle) {
            idle.notifyAll();
        }
    }
}
