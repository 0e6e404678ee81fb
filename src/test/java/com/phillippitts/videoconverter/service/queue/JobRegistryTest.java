package com.phillippitts.videoconverter.service.queue;

import com.phillippitts.videoconverter.domain.ConversionJob;
import com.phillippitts.videoconverter.domain.DiscoveredFile;
import com.phillippitts.videoconverter.domain.JobStatus;
import com.phillippitts.videoconverter.domain.WatchedPath;
import com.phillippitts.videoconverter.service.transcode.DestinationResolver;
import com.phillippitts.videoconverter.testutil.TestSettings;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class JobRegistryTest {

    private final WatchedPath watched = TestSettings.watched(Path.of("/videos/in"), Path.of("/videos/converted"));
    private final JobRegistry registry = new JobRegistry(new DestinationResolver("mp4"), Clock.systemUTC());

    private DiscoveredFile file(String relative) {
        return new DiscoveredFile(Path.of("/videos/in").resolve(relative), 10, Instant.now(), watched);
    }

    @Test
    void newFileGetsPendingJobWithResolvedDestination() {
        Optional<ConversionJob> job = registry.register(file("show/e01.mkv"));

        assertThat(job).isPresent();
        assertThat(job.get().getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(job.get().getDestinationPath()).isEqualTo(Path.of("/videos/converted/show/e01.mp4"));
    }

    @Test
    void samePathIsRegisteredOnce() {
        assertThat(registry.register(file("a.mkv"))).isPresent();
        assertThat(registry.register(file("a.mkv"))).isEmpty();
        assertThat(registry.register(file("./a.mkv"))).isEmpty();
        assertThat(registry.snapshot()).hasSize(1);
    }

    @Test
    void concurrentRegistrationCreatesExactlyOneJob() throws Exception {
        // Arrange: many threads race on the same path
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        ConcurrentLinkedQueue<ConversionJob> created = new ConcurrentLinkedQueue<>();
        for (int i = 0; i < 32; i++) {
            pool.execute(() -> {
                try {
                    go.await();
                    registry.register(file("race.mkv")).ifPresent(created::add);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }

        // Act
        go.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        // Assert
        assertThat(created).hasSize(1);
    }

    @Test
    void releasedPathCanBeRegisteredAgain() {
        registry.register(file("dropped.mkv"));

        registry.release(Path.of("/videos/in/dropped.mkv"));

        assertThat(registry.register(file("dropped.mkv"))).isPresent();
    }

    @Test
    void countsByStatus() {
        ConversionJob a = registry.register(file("a.mkv")).orElseThrow();
        registry.register(file("b.mkv"));
        a.transitionTo(JobStatus.QUEUED);

        assertThat(registry.countByStatus())
                .containsEntry(JobStatus.QUEUED, 1L)
                .containsEntry(JobStatus.PENDING, 1L)
                .containsEntry(JobStatus.FAILED, 0L);
        assertThat(registry.count(JobStatus.QUEUED)).isEqualTo(1);
        assertThat(registry.snapshot()).extracting(ConversionJob::getSourcePath)
                .containsExactlyInAnyOrderElementsOf(List.of(Path.of("/videos/in/a.mkv"), Path.of("/videos/in/b.mkv")));
    }

    @Test
    void sourcesDifferingOnlyInExtensionGetDistinctDestinations() {
        ConversionJob mkv = registry.register(file("movie.mkv")).orElseThrow();
        ConversionJob avi = registry.register(file("movie.avi")).orElseThrow();
        ConversionJob mov = registry.register(file("movie.mov")).orElseThrow();

        assertThat(mkv.getDestinationPath()).isEqualTo(Path.of("/videos/converted/movie.mp4"));
        assertThat(avi.getDestinationPath()).isEqualTo(Path.of("/videos/converted/movie-avi.mp4"));
        assertThat(mov.getDestinationPath()).isEqualTo(Path.of("/videos/converted/movie-mov.mp4"));
    }

    @Test
    void releasingJobFreesItsDestination() {
        registry.register(file("movie.mkv"));
        registry.release(Path.of("/videos/in/movie.mkv"));

        ConversionJob avi = registry.register(file("movie.avi")).orElseThrow();

        assertThat(avi.getDestinationPath()).isEqualTo(Path.of("/videos/converted/movie.mp4"));
    }

    @Test
    void finishedJobKeepsPathDeduplicated() {
        ConversionJob job = registry.register(file("done.mkv")).orElseThrow();
        job.transitionTo(JobStatus.QUEUED);
        job.transitionTo(JobStatus.RUNNING);
        job.transitionTo(JobStatus.SUCCEEDED);

        assertThat(registry.register(file("done.mkv"))).isEmpty();
        assertThat(registry.find(Path.of("/videos/in/done.mkv"))).contains(job);
    }
}
