package com.phillippitts.videoconverter.service.metrics;

import com.phillippitts.videoconverter.service.events.JobFinishedEvent;
import com.phillippitts.videoconverter.service.events.JobRetryScheduledEvent;
import com.phillippitts.videoconverter.service.queue.JobQueue;
import com.phillippitts.videoconverter.service.worker.WorkerPool;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for the conversion pipeline.
 *
 * <p>Meters:
 * <ul>
 *   <li>{@code videoconverter.jobs.finished}: terminal jobs, tagged by status and error kind</li>
 *   <li>{@code videoconverter.jobs.retried}: retries scheduled</li>
 *   <li>{@code videoconverter.conversion.duration}: duration of the final attempt of finished jobs</li>
 *   <li>{@code videoconverter.queue.size} and {@code videoconverter.jobs.running} gauges</li>
 * </ul>
 */
@Component
public class ConversionMetrics {

    private static final String METRIC_PREFIX = "videoconverter";

    private final MeterRegistry registry;

    public ConversionMetrics(MeterRegistry registry, JobQueue queue, WorkerPool workers) {
        this.registry = registry;
        Gauge.builder(METRIC_PREFIX + ".queue.size", queue, JobQueue::size)
                .description("Jobs waiting for a worker")
                .register(registry);
        Gauge.builder(METRIC_PREFIX + ".jobs.running", workers, WorkerPool::runningCount)
                .description("Conversions currently running")
                .register(registry);
    }

    @EventListener
    public void onJobFinished(JobFinishedEvent event) {
        Counter.builder(METRIC_PREFIX + ".jobs.finished")
                .description("Jobs that reached a terminal status")
                .tag("status", event.status().name().toLowerCase())
                .tag("error", event.errorKind() == null ? "none" : event.errorKind().name().toLowerCase())
                .register(registry)
                .increment();
        if (event.durationMs() > 0) {
            Timer.builder(METRIC_PREFIX + ".conversion.duration")
                    .description("Duration of the final conversion attempt")
                    .tag("status", event.status().name().toLowerCase())
                    .register(registry)
                    .record(event.durationMs(), TimeUnit.MILLISECONDS);
        }
    }

    @EventListener
    public void onRetryScheduled(JobRetryScheduledEvent event) {
        Counter.builder(METRIC_PREFIX + ".jobs.retried")
                .description("Failed attempts scheduled for another try")
                .register(registry)
                .increment();
    }
}
