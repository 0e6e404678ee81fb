package com.phillippitts.videoconverter.domain;

/**
 * Lifecycle states of a {@link ConversionJob}.
 *
 * <p>Normal path: PENDING → STABILIZING → QUEUED → RUNNING → SUCCEEDED. A retryable
 * failure moves RUNNING back to QUEUED; FAILED and ABANDONED end the job.
 */
public enum JobStatus {
    PENDING,
    STABILIZING,
    QUEUED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    ABANDONED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == ABANDONED;
    }
}
