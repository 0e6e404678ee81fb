package com.phillippitts.videoconverter.config;

import com.phillippitts.videoconverter.config.properties.ConverterProperties;
import com.phillippitts.videoconverter.config.properties.ConverterSettingsFactory;
import com.phillippitts.videoconverter.config.properties.EncoderProperties;
import com.phillippitts.videoconverter.config.properties.TranscoderProperties;
import com.phillippitts.videoconverter.service.encoder.EncoderCatalog;
import com.phillippitts.videoconverter.service.encoder.EncoderDetector;
import com.phillippitts.videoconverter.service.events.EventSink;
import com.phillippitts.videoconverter.service.lock.InstanceLock;
import com.phillippitts.videoconverter.service.orchestration.ConversionEngine;
import com.phillippitts.videoconverter.service.process.DefaultProcessFactory;
import com.phillippitts.videoconverter.service.process.ProcessFactory;
import com.phillippitts.videoconverter.service.process.ProcessRunner;
import com.phillippitts.videoconverter.service.queue.JobQueue;
import com.phillippitts.videoconverter.service.queue.JobRegistry;
import com.phillippitts.videoconverter.service.retry.RetryManager;
import com.phillippitts.videoconverter.service.stability.StabilityGate;
import com.phillippitts.videoconverter.service.transcode.DestinationResolver;
import com.phillippitts.videoconverter.service.transcode.FailureClassifier;
import com.phillippitts.videoconverter.service.transcode.FfmpegTranscodeExecutor;
import com.phillippitts.videoconverter.service.transcode.TranscodeCommandBuilder;
import com.phillippitts.videoconverter.service.transcode.TranscodeExecutor;
import com.phillippitts.videoconverter.service.watch.DirectoryWatcher;
import com.phillippitts.videoconverter.service.worker.WorkerPool;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Assembles the conversion pipeline from the bound configuration.
 *
 * <p>Engine classes are plain objects; this is the only place that knows how they fit
 * together. {@link ProcessFactory} and {@link Clock} are {@code @ConditionalOnMissingBean}
 * so tests can replace them.
 */
@Configuration
public class ConverterConfig {

    @Bean
    public ConverterSettings converterSettings(ConverterProperties props) {
        return ConverterSettingsFactory.create(props);
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcessFactory processFactory() {
        return new DefaultProcessFactory();
    }

    @Bean
    public ProcessRunner processRunner(ProcessFactory processFactory) {
        return new ProcessRunner(processFactory);
    }

    @Bean
    public EncoderDetector encoderDetector(ProcessRunner runner, EncoderProperties props, EventSink events) {
        return new EncoderDetector(new EncoderCatalog(props), runner, props, events);
    }

    @Bean
    public TranscodeExecutor transcodeExecutor(ProcessRunner runner, TranscoderProperties props,
                                               ConverterSettings settings) {
        return new FfmpegTranscodeExecutor(runner, new TranscodeCommandBuilder(props), new FailureClassifier(),
                props, settings.conversionTimeout());
    }

    @Bean
    public JobQueue jobQueue() {
        return new JobQueue();
    }

    @Bean
    public JobRegistry jobRegistry(TranscoderProperties props, Clock clock) {
        return new JobRegistry(new DestinationResolver(props), clock);
    }

    @Bean
    public InstanceLock instanceLock(ConverterSettings settings, EventSink events, Clock clock) {
        return new InstanceLock(settings.lockFile(), settings.lockStaleAfter(), events, clock);
    }

    @Bean
    public RetryManager retryManager(ConverterSettings settings, JobQueue queue,
                                     @Qualifier("retryScheduler") ThreadPoolTaskScheduler scheduler,
                                     ApplicationEventPublisher publisher, EventSink events, Clock clock) {
        return new RetryManager(settings, queue, scheduler, publisher, events, clock);
    }

    @Bean
    public WorkerPool workerPool(ConverterSettings settings,
                                 @Qualifier("workerExecutor") ThreadPoolTaskExecutor workerExecutor,
                                 JobQueue queue, TranscodeExecutor transcoder, RetryManager retryManager,
                                 EncoderDetector detector, EventSink events) {
        return new WorkerPool(settings.maxWorkers(), workerExecutor, queue, transcoder, retryManager,
                detector::detect, events);
    }

    @Bean
    public ConversionEngine conversionEngine(ConverterSettings settings, ConverterProperties props,
                                             InstanceLock lock, TranscodeExecutor transcoder,
                                             EncoderDetector detector, JobRegistry registry, JobQueue queue,
                                             WorkerPool workers, RetryManager retryManager,
                                             @Qualifier("watcherExecutor") ThreadPoolTaskExecutor watcherExecutor,
                                             @Qualifier("stabilityExecutor") ThreadPoolTaskExecutor stabilityExecutor,
                                             @Qualifier("retryScheduler") ThreadPoolTaskScheduler scheduler,
                                             EventSink events, Clock clock) {
        return new ConversionEngine(settings, lock, transcoder, detector,
                new DirectoryWatcher(settings, events, clock), new StabilityGate(settings),
                registry, queue, workers, retryManager, watcherExecutor, stabilityExecutor, scheduler, events,
                props.getService().isAutoStart());
    }
}
