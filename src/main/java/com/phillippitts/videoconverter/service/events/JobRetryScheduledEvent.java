package com.phillippitts.videoconverter.service.events;

import com.phillippitts.videoconverter.domain.ErrorKind;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Published when a failed attempt is scheduled for another try.
 *
 * @param jobId job identifier
 * @param source source file
 * @param failedAttempt number of the attempt that just failed
 * @param errorKind always RETRYABLE today, kept for listeners that group by kind
 * @param delay time until the job is queued again
 */
public record JobRetryScheduledEvent(String jobId, Path source, int failedAttempt, ErrorKind errorKind,
                                     Duration delay) {
}
