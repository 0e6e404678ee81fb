package com.phillippitts.videoconverter.service.process;

/**
 * Outcome of running an external command through {@link ProcessRunner}.
 *
 * @param exitCode process exit code; -1 if the process did not start, timed out or was interrupted
 * @param output merged stdout/stderr, capped
 * @param timedOut the process exceeded its timeout and was terminated
 * @param interrupted the waiting thread was interrupted and the process terminated
 * @param startFailure message of the start failure, null if the process started
 * @param durationMs wall-clock duration
 */
public record ProcessResult(
        int exitCode,
        String output,
        boolean timedOut,
        boolean interrupted,
        String startFailure,
        long durationMs
) {

    static ProcessResult notStarted(String reason, long durationMs) {
        return new ProcessResult(-1, "", false, false, reason, durationMs);
    }

    public boolean started() {
        return startFailure == null;
    }

    public boolean succeeded() {
        return started() && !timedOut && !interrupted && exitCode == 0;
    }
}
