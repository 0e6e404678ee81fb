package com.phillippitts.videoconverter.service.orchestration;

import com.phillippitts.videoconverter.config.ConverterSettings;
import com.phillippitts.videoconverter.domain.ConversionJob;
import com.phillippitts.videoconverter.domain.DiscoveredFile;
import com.phillippitts.videoconverter.domain.EncoderProfile;
import com.phillippitts.videoconverter.domain.JobStatus;
import com.phillippitts.videoconverter.domain.StabilityResult;
import com.phillippitts.videoconverter.exception.InstanceAlreadyRunningException;
import com.phillippitts.videoconverter.exception.TranscoderNotFoundException;
import com.phillippitts.videoconverter.exception.VideoConverterException;
import com.phillippitts.videoconverter.service.encoder.EncoderDetector;
import com.phillippitts.videoconverter.service.events.ConverterEvent;
import com.phillippitts.videoconverter.service.events.EventSink;
import com.phillippitts.videoconverter.service.lock.InstanceLock;
import com.phillippitts.videoconverter.service.lock.LockAcquisition;
import com.phillippitts.videoconverter.service.queue.JobQueue;
import com.phillippitts.videoconverter.service.queue.JobRegistry;
import com.phillippitts.videoconverter.service.retry.RetryManager;
import com.phillippitts.videoconverter.service.stability.StabilityGate;
import com.phillippitts.videoconverter.service.transcode.TranscodeExecutor;
import com.phillippitts.videoconverter.service.watch.DirectoryWatcher;
import com.phillippitts.videoconverter.service.worker.WorkerPool;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;

/**
 * Wires the watcher, stability gates, queue and workers into a running service.
 *
 * <p>Startup order, any failure aborts startup:
 * <ol>
 *   <li>take the instance lock (exit code 2 if another instance holds it)</li>
 *   <li>check the transcoder binary (exit code 3, lock released)</li>
 *   <li>select the encoder profile</li>
 *   <li>start the workers, then the watcher</li>
 * </ol>
 * Shutdown runs in reverse: discovery stops first, pending retries are cancelled, the
 * workers get the grace period, and the lock is released last.
 */
public class ConversionEngine implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(ConversionEngine.class);
    private static final String COMPONENT = "engine";

    private final ConverterSettings settings;
    private final InstanceLock lock;
    private final TranscodeExecutor transcoder;
    private final EncoderDetector detector;
    private final DirectoryWatcher watcher;
    private final StabilityGate stabilityGate;
    private final JobRegistry registry;
    private final JobQueue queue;
    private final WorkerPool workers;
    private final RetryManager retryManager;
    private final TaskExecutor watcherExecutor;
    private final ThreadPoolTaskExecutor stabilityExecutor;
    private final TaskScheduler scheduler;
    private final EventSink events;
    private final boolean autoStartup;

    private volatile boolean running;
    private ScheduledFuture<?> heartbeat;

    public ConversionEngine(ConverterSettings settings, InstanceLock lock, TranscodeExecutor transcoder,
                            EncoderDetector detector, DirectoryWatcher watcher, StabilityGate stabilityGate,
                            JobRegistry registry, JobQueue queue, WorkerPool workers, RetryManager retryManager,
                            TaskExecutor watcherExecutor, ThreadPoolTaskExecutor stabilityExecutor,
                            TaskScheduler scheduler, EventSink events, boolean autoStartup) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.lock = Objects.requireNonNull(lock, "lock");
        this.transcoder = Objects.requireNonNull(transcoder, "transcoder");
        this.detector = Objects.requireNonNull(detector, "detector");
        this.watcher = Objects.requireNonNull(watcher, "watcher");
        this.stabilityGate = Objects.requireNonNull(stabilityGate, "stabilityGate");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.workers = Objects.requireNonNull(workers, "workers");
        this.retryManager = Objects.requireNonNull(retryManager, "retryManager");
        this.watcherExecutor = Objects.requireNonNull(watcherExecutor, "watcherExecutor");
        this.stabilityExecutor = Objects.requireNonNull(stabilityExecutor, "stabilityExecutor");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.events = Objects.requireNonNull(events, "events");
        this.autoStartup = autoStartup;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        if (lock.acquire() == LockAcquisition.ALREADY_RUNNING) {
            throw new InstanceAlreadyRunningException(lock.getLockFile().toString(), lock.read().orElse(null));
        }
        try {
            transcoder.verifyAvailable();
        } catch (TranscoderNotFoundException e) {
            events.emit(ConverterEvent.of(COMPONENT, Level.ERROR, "Transcoder binary not usable; aborting startup")
                    .with("binary", e.getBinary())
                    .with("reason", e.getMessage()));
            lock.release();
            throw e;
        }

        EncoderProfile profile = detector.detect();
        workers.start();
        try {
            watcher.start(this::onDiscovered, watcherExecutor);
        } catch (IOException e) {
            workers.shutdown(settings.shutdownGracePeriod());
            lock.release();
            throw new VideoConverterException("Cannot start directory watcher", e);
        }
        heartbeat = scheduler.scheduleWithFixedDelay(this::heartbeat, settings.lockHeartbeat());
        running = true;

        events.emit(ConverterEvent.of(COMPONENT, Level.INFO, "Conversion engine started")
                .with("workers", settings.maxWorkers())
                .with("watchedPaths", settings.enabledWatchedPaths().size())
                .with("encoder", profile.name()));
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        LOG.info("Stopping conversion engine");

        watcher.close();
        if (heartbeat != null) {
            heartbeat.cancel(false);
        }
        // Interrupts gates still sampling; their files were never queued
        stabilityExecutor.shutdown();

        int abandoned = retryManager.cancelPending();
        abandoned += workers.shutdown(settings.shutdownGracePeriod());
        abandoned += retryManager.cancelPending();

        lock.release();
        Map<JobStatus, Long> counts = registry.countByStatus();
        events.emit(ConverterEvent.of(COMPONENT, Level.INFO, "Conversion engine stopped")
                .with("succeeded", counts.get(JobStatus.SUCCEEDED))
                .with("failed", counts.get(JobStatus.FAILED))
                .with("abandoned", abandoned));
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    public Optional<EncoderProfile> encoderProfile() {
        return detector.selected();
    }

    public boolean holdsLock() {
        return lock.isHeld();
    }

    public int queueSize() {
        return queue.size();
    }

    public int runningJobs() {
        return workers.runningCount();
    }

    /** Entry point for the watcher; never blocks. */
    void onDiscovered(DiscoveredFile file) {
        Optional<ConversionJob> registered = registry.register(file);
        if (registered.isEmpty()) {
            LOG.debug("Ignoring {}; already has a job", file.path());
            return;
        }
        ConversionJob job = registered.get();
        try {
            stabilityExecutor.execute(() -> stabilize(job));
        } catch (RejectedExecutionException e) {
            LOG.debug("Stability executor shut down; not tracking {}", file.path());
            drop(job);
        }
    }

    private void stabilize(ConversionJob job) {
        if (!job.transitionTo(JobStatus.STABILIZING)) {
            return;
        }
        StabilityResult result = stabilityGate.awaitStable(job.getSourcePath());
        switch (result) {
            case STABLE -> {
                if (job.transitionTo(JobStatus.QUEUED)) {
                    queue.enqueue(job);
                    events.emit(ConverterEvent.of(COMPONENT, Level.INFO, "File queued")
                            .with("jobId", job.getId())
                            .with("source", job.getSourcePath())
                            .with("queueSize", queue.size()));
                }
            }
            case STILL_WRITING -> {
                events.emit(ConverterEvent.of(COMPONENT, Level.WARN, "File still being written; dropped")
                        .with("source", job.getSourcePath())
                        .with("timeoutSeconds", settings.stabilityTimeout().toSeconds()));
                drop(job);
            }
            case VANISHED -> {
                LOG.debug("File vanished before it was stable: {}", job.getSourcePath());
                drop(job);
            }
            case ABORTED -> drop(job);
        }
    }

    private void drop(ConversionJob job) {
        job.transitionTo(JobStatus.ABANDONED);
        registry.release(job.getSourcePath());
        watcher.forget(job.getSourcePath());
    }

    private void heartbeat() {
        lock.refresh();
        if (LOG.isDebugEnabled()) {
            LOG.debug("Status: queued={}, running={}, pendingRetries={}, jobs={}",
                    queue.size(), workers.runningCount(), retryManager.pendingCount(), registry.countByStatus());
        }
    }
}
