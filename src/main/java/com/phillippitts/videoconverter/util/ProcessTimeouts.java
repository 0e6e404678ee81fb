package com.phillippitts.videoconverter.util;

import java.time.Duration;

/**
 * Standard timeout values for subprocess and thread management.
 *
 * <p><b>Usage:</b> Used by {@link com.phillippitts.videoconverter.service.process.ProcessRunner}
 * for ffmpeg and encoder-probe lifecycle management, and by the worker pool during shutdown.
 *
 * @see com.phillippitts.videoconverter.service.process.ProcessRunner
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Timeout for the output gobbler thread to flush after the process exits.
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for graceful process shutdown via {@link Process#destroy()}.
     *
     * <p>ffmpeg finalizes the container trailer on SIGTERM, which can take a moment
     * on large outputs.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofSeconds(2);

    /**
     * Timeout for forceful process termination via {@link Process#destroyForcibly()}.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /**
     * How long an idle worker blocks on the queue before re-checking for shutdown.
     */
    public static final Duration QUEUE_POLL_TIMEOUT = Duration.ofSeconds(1);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
