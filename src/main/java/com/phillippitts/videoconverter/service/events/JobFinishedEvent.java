package com.phillippitts.videoconverter.service.events;

import com.phillippitts.videoconverter.domain.ErrorKind;
import com.phillippitts.videoconverter.domain.JobStatus;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Published through Spring's event bus when a job reaches a terminal status.
 *
 * @param jobId job identifier
 * @param source source file
 * @param status SUCCEEDED, FAILED or ABANDONED
 * @param attempts executions performed
 * @param errorKind last error classification, null on success
 * @param durationMs duration of the final attempt (0 if none ran)
 * @param at when the job finished
 */
public record JobFinishedEvent(
        String jobId,
        Path source,
        JobStatus status,
        int attempts,
        ErrorKind errorKind,
        long durationMs,
        Instant at
) {
    public JobFinishedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
