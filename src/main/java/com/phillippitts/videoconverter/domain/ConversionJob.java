package com.phillippitts.videoconverter.domain;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One source file's conversion, tracked from discovery to a terminal status.
 *
 * <p>Thread-safety: the watcher, stability gates, workers and the retry scheduler all
 * touch the same job, so every mutable field is guarded by the job's monitor.
 * Identity fields are final.
 */
public final class ConversionJob {

    private final String id;
    private final Path sourcePath;
    private final Path destinationPath;
    private final WatchedPath watchedPath;
    private final Instant createdAt;
    private final Clock clock;

    private JobStatus status = JobStatus.PENDING;
    private int attemptCount;
    private ErrorKind lastErrorKind;
    private String lastErrorMessage;
    private Instant updatedAt;

    public ConversionJob(Path sourcePath, Path destinationPath, WatchedPath watchedPath, Clock clock) {
        this.id = UUID.randomUUID().toString();
        this.sourcePath = Objects.requireNonNull(sourcePath, "sourcePath");
        this.destinationPath = Objects.requireNonNull(destinationPath, "destinationPath");
        this.watchedPath = watchedPath;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.createdAt = clock.instant();
        this.updatedAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public Path getSourcePath() {
        return sourcePath;
    }

    public Path getDestinationPath() {
        return destinationPath;
    }

    public WatchedPath getWatchedPath() {
        return watchedPath;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized JobStatus getStatus() {
        return status;
    }

    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public synchronized ErrorKind getLastErrorKind() {
        return lastErrorKind;
    }

    public synchronized String getLastErrorMessage() {
        return lastErrorMessage;
    }

    public synchronized Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Moves the job to a new status. Terminal jobs never change again.
     *
     * @return false if the job was already terminal
     */
    public synchronized boolean transitionTo(JobStatus next) {
        if (status.isTerminal()) {
            return false;
        }
        status = next;
        updatedAt = clock.instant();
        return true;
    }

    /**
     * Atomically moves QUEUED → RUNNING and counts the attempt.
     *
     * @return false if the job was not QUEUED (already picked up, or abandoned)
     */
    public synchronized boolean startAttempt() {
        if (status != JobStatus.QUEUED) {
            return false;
        }
        status = JobStatus.RUNNING;
        attemptCount++;
        updatedAt = clock.instant();
        return true;
    }

    public synchronized void recordError(ErrorKind kind, String message) {
        this.lastErrorKind = kind;
        this.lastErrorMessage = message;
        this.updatedAt = clock.instant();
    }

    @Override
    public synchronized String toString() {
        return "ConversionJob{id=" + id + ", source=" + sourcePath + ", status=" + status
                + ", attempts=" + attemptCount + ", lastError=" + lastErrorKind + '}';
    }
}
