package com.phillippitts.videoconverter.service.orchestration;

import com.phillippitts.videoconverter.config.ConverterSettings;
import com.phillippitts.videoconverter.config.ThreadPoolConfig;
import com.phillippitts.videoconverter.config.properties.EncoderProperties;
import com.phillippitts.videoconverter.config.properties.TranscoderProperties;
import com.phillippitts.videoconverter.domain.JobStatus;
import com.phillippitts.videoconverter.exception.InstanceAlreadyRunningException;
import com.phillippitts.videoconverter.exception.TranscoderNotFoundException;
import com.phillippitts.videoconverter.service.encoder.EncoderCatalog;
import com.phillippitts.videoconverter.service.encoder.EncoderDetector;
import com.phillippitts.videoconverter.service.events.JobFinishedEvent;
import com.phillippitts.videoconverter.service.lock.InstanceLock;
import com.phillippitts.videoconverter.service.process.ProcessRunner;
import com.phillippitts.videoconverter.service.queue.JobQueue;
import com.phillippitts.videoconverter.service.queue.JobRegistry;
import com.phillippitts.videoconverter.service.retry.RetryManager;
import com.phillippitts.videoconverter.service.stability.StabilityGate;
import com.phillippitts.videoconverter.service.transcode.DestinationResolver;
import com.phillippitts.videoconverter.service.transcode.FailureClassifier;
import com.phillippitts.videoconverter.service.transcode.FfmpegTranscodeExecutor;
import com.phillippitts.videoconverter.service.transcode.TranscodeCommandBuilder;
import com.phillippitts.videoconverter.service.watch.DirectoryWatcher;
import com.phillippitts.videoconverter.service.worker.WorkerPool;
import com.phillippitts.videoconverter.testutil.CapturingEventSink;
import com.phillippitts.videoconverter.testutil.EventCapturingPublisher;
import com.phillippitts.videoconverter.testutil.ProcessTestDoubles;
import com.phillippitts.videoconverter.testutil.ProcessTestDoubles.ProcessBehavior;
import com.phillippitts.videoconverter.testutil.ProcessTestDoubles.ScriptedProcessFactory;
import com.phillippitts.videoconverter.testutil.TestSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class ConversionEngineTest {

    @TempDir
    Path tmp;

    private final CapturingEventSink events = new CapturingEventSink();
    private final EventCapturingPublisher publisher = new EventCapturingPublisher();
    private final ThreadPoolConfig pools = new ThreadPoolConfig();

    private Path watchDir;
    private Path outputDir;
    private Path lockFile;
    private ThreadPoolTaskExecutor watcherExecutor;
    private ThreadPoolTaskExecutor stabilityExecutor;
    private ThreadPoolTaskExecutor workerExecutor;
    private ThreadPoolTaskScheduler scheduler;
    private ScriptedProcessFactory processes;
    private JobRegistry registry;
    private ConversionEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        watchDir = Files.createDirectories(tmp.resolve("incoming"));
        outputDir = tmp.resolve("converted");
        lockFile = tmp.resolve("run/videoconverter.lock");
    }

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.stop();
        }
        for (ThreadPoolTaskExecutor executor : new ThreadPoolTaskExecutor[] {
                watcherExecutor, stabilityExecutor, workerExecutor}) {
            if (executor != null) {
                executor.shutdown();
            }
        }
        if (scheduler != null) {
            scheduler.shutdown();
        }
    }

    /** ffmpeg answers -version and converts; every hardware probe binary is missing. */
    private static ProcessBehavior workingFfmpeg(List<String> cmd) {
        if (!cmd.get(0).equals("ffmpeg")) {
            return null;
        }
        if (cmd.contains("-version")) {
            return ProcessBehavior.ok("ffmpeg version 6.1.1 Copyright (c) 2000-2023 the FFmpeg developers");
        }
        return ProcessTestDoubles.writeOutput(cmd, "converted-bytes");
    }

    private ConversionEngine engine(Function<List<String>, ProcessBehavior> script) {
        ConverterSettings settings = TestSettings.builder()
                .maxWorkers(2)
                .watch(TestSettings.watched(watchDir, outputDir))
                .lockFile(lockFile)
                .build();
        TranscoderProperties transcoderProps = TranscoderProperties.defaults();
        EncoderProperties encoderProps = new EncoderProperties(null, Duration.ofSeconds(2), null, null, null);

        processes = new ScriptedProcessFactory(script);
        ProcessRunner runner = new ProcessRunner(processes);
        Clock clock = Clock.systemUTC();

        watcherExecutor = pools.watcherExecutor();
        stabilityExecutor = pools.stabilityExecutor();
        workerExecutor = pools.workerExecutor(settings);
        scheduler = pools.retryScheduler();

        JobQueue queue = new JobQueue();
        registry = new JobRegistry(new DestinationResolver(transcoderProps), clock);
        EncoderDetector detector = new EncoderDetector(new EncoderCatalog(encoderProps), runner, encoderProps, events);
        FfmpegTranscodeExecutor transcoder = new FfmpegTranscodeExecutor(runner,
                new TranscodeCommandBuilder(transcoderProps), new FailureClassifier(), transcoderProps,
                settings.conversionTimeout());
        RetryManager retryManager = new RetryManager(settings, queue, scheduler, publisher, events, clock);
        WorkerPool workers = new WorkerPool(settings.maxWorkers(), workerExecutor, queue, transcoder, retryManager,
                detector::detect, events);
        InstanceLock lock = new InstanceLock(lockFile, Duration.ofMinutes(10), events, clock);

        return new ConversionEngine(settings, lock, transcoder, detector,
                new DirectoryWatcher(settings, events, clock), new StabilityGate(settings),
                registry, queue, workers, retryManager, watcherExecutor, stabilityExecutor, scheduler, events, true);
    }

    @Test
    void existingAndNewFilesAreConvertedAndOriginalsRemoved() throws Exception {
        // Arrange
        Path existing = Files.writeString(watchDir.resolve("holiday.mkv"), "matroska-bytes");
        Files.createDirectories(watchDir.resolve("series"));
        Files.writeString(watchDir.resolve("notes.txt"), "not a video");
        engine = engine(ConversionEngineTest::workingFfmpeg);

        // Act
        engine.start();
        Path later = Files.writeString(watchDir.resolve("series/episode01.avi"), "avi-bytes");

        // Assert
        Path existingOut = outputDir.resolve("holiday.mp4");
        Path laterOut = outputDir.resolve("series/episode01.mp4");
        await().atMost(Duration.ofSeconds(20)).untilAsserted(() -> {
            assertThat(existingOut).hasContent("converted-bytes");
            assertThat(laterOut).hasContent("converted-bytes");
            assertThat(registry.count(JobStatus.SUCCEEDED)).isEqualTo(2);
        });
        assertThat(existing).doesNotExist();
        assertThat(later).doesNotExist();
        assertThat(watchDir.resolve("notes.txt")).exists();
        assertThat(publisher.ofType(JobFinishedEvent.class)).hasSize(2);
        assertThat(engine.encoderProfile()).get().extracting(p -> p.name()).isEqualTo(EncoderCatalog.SOFTWARE);
        assertThat(engine.holdsLock()).isTrue();
        assertThat(lockFile).exists();
    }

    @Test
    void stopReleasesLockAndReportsCounts() throws Exception {
        engine = engine(ConversionEngineTest::workingFfmpeg);
        engine.start();
        assertThat(engine.isRunning()).isTrue();

        engine.stop();

        assertThat(engine.isRunning()).isFalse();
        assertThat(engine.holdsLock()).isFalse();
        assertThat(lockFile).doesNotExist();
        assertThat(events.contains("Conversion engine stopped")).isTrue();
    }

    @Test
    void secondInstanceRefusesToStart() {
        InstanceLock other = new InstanceLock(lockFile, Duration.ofMinutes(10), events, Clock.systemUTC());
        other.acquire();
        engine = engine(ConversionEngineTest::workingFfmpeg);

        assertThatThrownBy(() -> engine.start())
                .isInstanceOf(InstanceAlreadyRunningException.class)
                .satisfies(e -> assertThat(((InstanceAlreadyRunningException) e).getExitCode())
                        .isEqualTo(InstanceAlreadyRunningException.EXIT_CODE));

        assertThat(engine.isRunning()).isFalse();
        assertThat(processes.commands()).isEmpty();
        other.release();
    }

    @Test
    void missingTranscoderAbortsStartupAndReleasesLock() {
        engine = engine(cmd -> null);

        assertThatThrownBy(() -> engine.start())
                .isInstanceOf(TranscoderNotFoundException.class)
                .satisfies(e -> assertThat(((TranscoderNotFoundException) e).getExitCode())
                        .isEqualTo(TranscoderNotFoundException.EXIT_CODE));

        assertThat(engine.isRunning()).isFalse();
        assertThat(lockFile).doesNotExist();
        assertThat(events.contains("Transcoder binary not usable; aborting startup")).isTrue();
    }

    @Test
    void fileDiscoveredTwiceIsOnlyConvertedOnce() throws Exception {
        Files.writeString(watchDir.resolve("film.mp4"), "mp4-bytes");
        engine = engine(ConversionEngineTest::workingFfmpeg);
        engine.start();

        await().atMost(Duration.ofSeconds(20))
                .untilAsserted(() -> assertThat(registry.count(JobStatus.SUCCEEDED)).isEqualTo(1));
        Files.writeString(watchDir.resolve("film.mp4"), "mp4-bytes-again");
        Thread.sleep(500);

        assertThat(processes.commands().stream().filter(c -> c.contains("-i")).count()).isEqualTo(1);
    }
}
