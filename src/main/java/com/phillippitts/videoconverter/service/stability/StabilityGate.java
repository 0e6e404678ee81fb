package com.phillippitts.videoconverter.service.stability;

import com.phillippitts.videoconverter.config.ConverterSettings;
import com.phillippitts.videoconverter.domain.StabilityResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Decides when a discovered file has finished being written.
 *
 * <p>The size is sampled every {@code interval}; the file is stable once {@code samples}
 * consecutive readings agree. A file that keeps changing for longer than {@code timeout}
 * is reported as {@link StabilityResult#STILL_WRITING}. The call blocks, so callers run it
 * on the stability executor.
 */
public class StabilityGate {

    private static final Logger LOG = LogManager.getLogger(StabilityGate.class);

    private final Duration interval;
    private final int samples;
    private final Duration timeout;

    public StabilityGate(ConverterSettings settings) {
        this(settings.stabilityInterval(), settings.stabilitySamples(), settings.stabilityTimeout());
    }

    public StabilityGate(Duration interval, int samples, Duration timeout) {
        if (samples < 2) {
            throw new IllegalArgumentException("samples must be >= 2");
        }
        this.interval = interval;
        this.samples = samples;
        this.timeout = timeout;
    }

    /**
     * Blocks until the file is stable, vanishes, times out or the thread is interrupted.
     */
    public StabilityResult awaitStable(Path file) {
        long deadline = System.nanoTime() + timeout.toNanos();
        long previous = -1L;
        int equalRuns = 0;

        while (true) {
            long size;
            try {
                size = Files.size(file);
            } catch (NoSuchFileException e) {
                LOG.debug("File vanished while waiting for stability: {}", file);
                return StabilityResult.VANISHED;
            } catch (IOException e) {
                if (!Files.exists(file)) {
                    LOG.debug("File vanished while waiting for stability: {}", file);
                    return StabilityResult.VANISHED;
                }
                // Transient read error, e.g. a lock held by the writer; counts as a change
                LOG.debug("Cannot read size of {}: {}", file, e.toString());
                size = -1L;
            }

            if (size >= 0 && size == previous) {
                equalRuns++;
            } else {
                equalRuns = 1;
            }
            previous = size;
            if (size >= 0 && equalRuns >= samples) {
                LOG.debug("File stable at {} bytes: {}", size, file);
                return StabilityResult.STABLE;
            }

            if (System.nanoTime() - deadline >= 0) {
                return StabilityResult.STILL_WRITING;
            }
            try {
                Thread.sleep(interval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return StabilityResult.ABORTED;
            }
        }
    }
}
