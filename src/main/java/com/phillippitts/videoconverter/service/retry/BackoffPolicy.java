package com.phillippitts.videoconverter.service.retry;

import com.phillippitts.videoconverter.util.TimeUtils;

import java.time.Duration;

/**
 * How the delay between retries grows.
 */
public enum BackoffPolicy {
    /** Same delay before every retry. */
    FIXED {
        @Override
        public Duration delayBeforeRetry(int retryNumber, Duration base, Duration cap) {
            return base;
        }
    },
    /** {@code base * 2^(retryNumber-1)}, capped. */
    EXPONENTIAL {
        @Override
        public Duration delayBeforeRetry(int retryNumber, Duration base, Duration cap) {
            return TimeUtils.doubled(base, retryNumber - 1, cap);
        }
    };

    /**
     * @param retryNumber 1 for the first retry, 2 for the second, ...
     * @param base configured retry delay
     * @param cap configured maximum delay
     */
    public abstract Duration delayBeforeRetry(int retryNumber, Duration base, Duration cap);
}
