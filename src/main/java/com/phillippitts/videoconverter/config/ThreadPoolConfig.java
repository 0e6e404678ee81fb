package com.phillippitts.videoconverter.config;

import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;

/**
 * Thread pools of the conversion pipeline.
 *
 * <ul>
 *   <li>{@code watcher-}: one thread consuming file system events</li>
 *   <li>{@code stability-}: size sampling, one task per discovered file</li>
 *   <li>{@code worker-}: exactly {@code max-workers} conversion loops</li>
 *   <li>{@code retry-}: delayed re-queueing and the lock heartbeat</li>
 * </ul>
 *
 * <p>The executors copy the submitting thread's Log4j2 ThreadContext onto the task. The
 * retry scheduler does not; its tasks name the job they act on in their own messages.
 */
@Configuration
public class ThreadPoolConfig {

    /** Upper bound of concurrent stability gates; further files wait in the executor queue. */
    static final int STABILITY_POOL_SIZE = 8;

    @Bean(name = "watcherExecutor")
    public ThreadPoolTaskExecutor watcherExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("watcher-");
        executor.setDaemon(true);
        executor.setTaskDecorator(threadContextDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Gates sleep between samples, so the pool is sized for waiting rather than CPU.
     * The queue is unbounded: a burst of files is never rejected, only delayed.
     */
    @Bean(name = "stabilityExecutor")
    public ThreadPoolTaskExecutor stabilityExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(STABILITY_POOL_SIZE);
        executor.setMaxPoolSize(STABILITY_POOL_SIZE);
        executor.setThreadNamePrefix("stability-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setTaskDecorator(threadContextDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Core and max size are both {@code max-workers}; the pool runs exactly one long-lived
     * loop per thread.
     */
    @Bean(name = "workerExecutor")
    public ThreadPoolTaskExecutor workerExecutor(ConverterSettings settings) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.maxWorkers());
        executor.setMaxPoolSize(settings.maxWorkers());
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) Math.max(1, settings.shutdownGracePeriod().toSeconds()));
        executor.setTaskDecorator(threadContextDecorator());
        executor.initialize();
        return executor;
    }

    @Bean(name = "retryScheduler")
    public ThreadPoolTaskScheduler retryScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("retry-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    static TaskDecorator threadContextDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
