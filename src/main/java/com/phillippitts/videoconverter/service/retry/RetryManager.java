package com.phillippitts.videoconverter.service.retry;

import com.phillippitts.videoconverter.config.ConverterSettings;
import com.phillippitts.videoconverter.domain.ConversionJob;
import com.phillippitts.videoconverter.domain.ErrorKind;
import com.phillippitts.videoconverter.domain.JobStatus;
import com.phillippitts.videoconverter.domain.TranscodeOutcome;
import com.phillippitts.videoconverter.service.events.ConverterEvent;
import com.phillippitts.videoconverter.service.events.EventSink;
import com.phillippitts.videoconverter.service.events.JobFinishedEvent;
import com.phillippitts.videoconverter.service.events.JobRetryScheduledEvent;
import com.phillippitts.videoconverter.service.queue.JobQueue;
import com.phillippitts.videoconverter.util.LogSanitizer;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.PosixFilePermission;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;

/**
 * Decides what happens after each transcode attempt and owns every terminal transition.
 *
 * <p>Rules:
 * <ul>
 *   <li>success: SUCCEEDED, after carrying permissions and mtime over and removing the source</li>
 *   <li>fatal: FAILED on the first attempt, never retried</li>
 *   <li>retryable: queued again after the backoff delay while
 *       {@code attemptCount - 1 < maxRetries}, FAILED once the budget is spent</li>
 * </ul>
 * Every terminal transition publishes exactly one {@link JobFinishedEvent}.
 */
public class RetryManager {

    private static final Logger LOG = LogManager.getLogger(RetryManager.class);
    private static final String COMPONENT = "worker";
    private static final int ERROR_SNIPPET_CHARS = 300;

    private final ConverterSettings settings;
    private final JobQueue queue;
    private final TaskScheduler scheduler;
    private final ApplicationEventPublisher publisher;
    private final EventSink events;
    private final Clock clock;

    private final Map<String, PendingRetry> pending = new ConcurrentHashMap<>();

    private record PendingRetry(ConversionJob job, ScheduledFuture<?> future) {}

    public RetryManager(ConverterSettings settings, JobQueue queue, TaskScheduler scheduler,
                        ApplicationEventPublisher publisher, EventSink events, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.events = Objects.requireNonNull(events, "events");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public RetryDecision handle(ConversionJob job, TranscodeOutcome outcome) {
        if (outcome.succeeded()) {
            return succeed(job, outcome);
        }
        String message = LogSanitizer.singleLine(outcome.reason());
        job.recordError(outcome.errorKind(), message);

        if (outcome.errorKind() == ErrorKind.FATAL) {
            return fail(job, outcome, "Conversion failed permanently");
        }

        int attempts = job.getAttemptCount();
        if (attempts - 1 < settings.maxRetries()) {
            Duration delay = settings.backoff().delayBeforeRetry(attempts, settings.retryDelay(),
                    settings.maxRetryDelay());
            if (!job.transitionTo(JobStatus.QUEUED)) {
                return RetryDecision.finished(job.getStatus());
            }
            if (!scheduleRetry(job, delay)) {
                abandon(job, "shutdown before retry");
                return RetryDecision.finished(job.getStatus());
            }
            events.emit(ConverterEvent.of(COMPONENT, Level.WARN, "Conversion failed; retry scheduled")
                    .with("jobId", job.getId())
                    .with("source", job.getSourcePath())
                    .with("attempt", attempts)
                    .with("maxRetries", settings.maxRetries())
                    .with("delaySeconds", delay.toSeconds())
                    .with("timedOut", outcome.timedOut())
                    .with("reason", message)
                    .with("output", LogSanitizer.singleLine(LogSanitizer.tail(outcome.output(), ERROR_SNIPPET_CHARS))));
            publisher.publishEvent(new JobRetryScheduledEvent(job.getId(), job.getSourcePath(), attempts,
                    outcome.errorKind(), delay));
            return RetryDecision.retryAfter(delay);
        }
        return fail(job, outcome, "Conversion failed; retries exhausted");
    }

    /**
     * Moves a non-terminal job to ABANDONED (shutdown, source gone before it ran).
     *
     * @return false if the job had already finished
     */
    public boolean abandon(ConversionJob job, String reason) {
        if (!job.transitionTo(JobStatus.ABANDONED)) {
            return false;
        }
        events.emit(ConverterEvent.of(COMPONENT, Level.INFO, "Job abandoned")
                .with("jobId", job.getId())
                .with("source", job.getSourcePath())
                .with("reason", reason));
        publish(job, 0L);
        return true;
    }

    /**
     * Cancels every scheduled retry; the jobs become ABANDONED.
     *
     * @return number of retries cancelled
     */
    public int cancelPending() {
        int cancelled = 0;
        for (String id : List.copyOf(pending.keySet())) {
            PendingRetry retry = pending.remove(id);
            if (retry == null) {
                continue;
            }
            retry.future().cancel(false);
            if (abandon(retry.job(), "shutdown before retry")) {
                cancelled++;
            }
        }
        return cancelled;
    }

    public int pendingCount() {
        return pending.size();
    }

    /** @return false if the scheduler no longer accepts tasks (context closing) */
    private boolean scheduleRetry(ConversionJob job, Duration delay) {
        // Holding the monitor keeps a zero-delay requeue from running before the put
        synchronized (pending) {
            try {
                ScheduledFuture<?> future = scheduler.schedule(() -> requeue(job.getId()),
                        scheduler.getClock().instant().plus(delay));
                pending.put(job.getId(), new PendingRetry(job, future));
                return true;
            } catch (RejectedExecutionException e) {
                LOG.debug("Retry scheduler rejected {}: {}", job.getSourcePath(), e.toString());
                return false;
            }
        }
    }

    private void requeue(String jobId) {
        PendingRetry retry;
        synchronized (pending) {
            retry = pending.remove(jobId);
        }
        if (retry == null) {
            return;
        }
        ConversionJob job = retry.job();
        if (job.getStatus() == JobStatus.QUEUED) {
            queue.enqueue(job);
            LOG.debug("Re-queued {} for attempt {}", job.getSourcePath(), job.getAttemptCount() + 1);
        }
    }

    private RetryDecision succeed(ConversionJob job, TranscodeOutcome outcome) {
        Path source = job.getSourcePath();
        Path destination = job.getDestinationPath();
        copyAttributes(source, destination);
        if (settings.deleteOriginal()) {
            try {
                Files.deleteIfExists(source);
            } catch (IOException e) {
                LOG.warn("Converted {} but could not delete the original: {}", source, e.toString());
            }
        }
        if (!job.transitionTo(JobStatus.SUCCEEDED)) {
            return RetryDecision.finished(job.getStatus());
        }
        events.emit(ConverterEvent.of(COMPONENT, Level.INFO, "Conversion succeeded")
                .with("jobId", job.getId())
                .with("source", source)
                .with("destination", destination)
                .with("attempt", job.getAttemptCount())
                .with("durationMs", outcome.durationMs()));
        publish(job, outcome.durationMs());
        return RetryDecision.finished(JobStatus.SUCCEEDED);
    }

    private RetryDecision fail(ConversionJob job, TranscodeOutcome outcome, String message) {
        if (!job.transitionTo(JobStatus.FAILED)) {
            return RetryDecision.finished(job.getStatus());
        }
        events.emit(ConverterEvent.of(COMPONENT, Level.ERROR, message)
                .with("jobId", job.getId())
                .with("source", job.getSourcePath())
                .with("attempt", job.getAttemptCount())
                .with("errorKind", outcome.errorKind())
                .with("exitCode", outcome.exitCode())
                .with("reason", job.getLastErrorMessage())
                .with("output", LogSanitizer.singleLine(LogSanitizer.tail(outcome.output(), ERROR_SNIPPET_CHARS))));
        publish(job, outcome.durationMs());
        return RetryDecision.finished(JobStatus.FAILED);
    }

    private void copyAttributes(Path source, Path destination) {
        if (settings.preservePermissions()) {
            try {
                Set<PosixFilePermission> perms = Files.getPosixFilePermissions(source);
                Files.setPosixFilePermissions(destination, perms);
            } catch (UnsupportedOperationException | IOException e) {
                LOG.warn("Could not copy permissions from {} to {}: {}", source, destination, e.toString());
            }
        }
        if (settings.preserveTimestamps()) {
            try {
                FileTime modified = Files.getLastModifiedTime(source);
                Files.setLastModifiedTime(destination, modified);
            } catch (IOException e) {
                LOG.warn("Could not copy modification time from {} to {}: {}", source, destination, e.toString());
            }
        }
    }

    private void publish(ConversionJob job, long durationMs) {
        publisher.publishEvent(new JobFinishedEvent(job.getId(), job.getSourcePath(), job.getStatus(),
                job.getAttemptCount(), job.getLastErrorKind(), durationMs, clock.instant()));
    }
}
