package com.phillippitts.videoconverter.domain;

/**
 * Result of one transcode attempt.
 *
 * @param exitCode process exit code, -1 when the process never produced one
 * @param output captured (and capped) combined stdout/stderr
 * @param errorKind null on success, otherwise FATAL or RETRYABLE
 * @param reason short human-readable cause, null on success
 * @param timedOut whether the attempt was cut off by the conversion timeout
 * @param durationMs wall-clock duration of the attempt
 */
public record TranscodeOutcome(
        int exitCode,
        String output,
        ErrorKind errorKind,
        String reason,
        boolean timedOut,
        long durationMs
) {

    public static TranscodeOutcome success(String output, long durationMs) {
        return new TranscodeOutcome(0, output, null, null, false, durationMs);
    }

    public static TranscodeOutcome failure(int exitCode, String output, ErrorKind kind, String reason,
                                           boolean timedOut, long durationMs) {
        return new TranscodeOutcome(exitCode, output, kind, reason, timedOut, durationMs);
    }

    public boolean succeeded() {
        return errorKind == null;
    }
}
