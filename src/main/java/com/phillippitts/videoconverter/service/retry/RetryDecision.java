package com.phillippitts.videoconverter.service.retry;

import com.phillippitts.videoconverter.domain.JobStatus;

import java.time.Duration;

/**
 * What {@link RetryManager} did with a finished attempt.
 *
 * @param status the job's status after handling
 * @param retryDelay delay before the job is queued again, null unless a retry was scheduled
 */
public record RetryDecision(JobStatus status, Duration retryDelay) {

    static RetryDecision finished(JobStatus status) {
        return new RetryDecision(status, null);
    }

    static RetryDecision retryAfter(Duration delay) {
        return new RetryDecision(JobStatus.QUEUED, delay);
    }

    public boolean willRetry() {
        return retryDelay != null;
    }
}
