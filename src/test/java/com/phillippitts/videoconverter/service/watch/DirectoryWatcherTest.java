package com.phillippitts.videoconverter.service.watch;

import com.phillippitts.videoconverter.config.ConverterSettings;
import com.phillippitts.videoconverter.domain.DiscoveredFile;
import com.phillippitts.videoconverter.domain.WatchedPath;
import com.phillippitts.videoconverter.testutil.CapturingEventSink;
import com.phillippitts.videoconverter.testutil.TestSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class DirectoryWatcherTest {

    @TempDir
    Path tmp;

    private final CapturingEventSink events = new CapturingEventSink();
    private final List<DiscoveredFile> discovered = new CopyOnWriteArrayList<>();
    private final ExecutorService loop = Executors.newSingleThreadExecutor();
    private DirectoryWatcher watcher;

    @AfterEach
    void tearDown() {
        if (watcher != null) {
            watcher.close();
        }
        loop.shutdownNow();
    }

    private DirectoryWatcher start(ConverterSettings settings) throws Exception {
        watcher = new DirectoryWatcher(settings, events, Clock.systemUTC());
        watcher.start(discovered::add, loop);
        return watcher;
    }

    private List<Path> paths() {
        return discovered.stream().map(DiscoveredFile::path).toList();
    }

    @Test
    void existingMatchingFilesAreDiscoveredOnStartup() throws Exception {
        // Arrange
        Path in = Files.createDirectories(tmp.resolve("in"));
        Files.createDirectories(in.resolve("nested"));
        Files.writeString(in.resolve("a.mkv"), "a");
        Files.writeString(in.resolve("B.MP4"), "b");
        Files.writeString(in.resolve("nested/c.avi"), "c");
        Files.writeString(in.resolve("notes.txt"), "ignored");

        // Act
        start(TestSettings.builder().watch(TestSettings.watched(in, tmp.resolve("converted"))).build());

        // Assert: discovered synchronously by start()
        assertThat(paths()).containsExactlyInAnyOrder(
                in.resolve("a.mkv").toAbsolutePath().normalize(),
                in.resolve("B.MP4").toAbsolutePath().normalize(),
                in.resolve("nested/c.avi").toAbsolutePath().normalize());
    }

    @Test
    void nonRecursivePathIgnoresSubdirectories() throws Exception {
        Path in = Files.createDirectories(tmp.resolve("in"));
        Files.createDirectories(in.resolve("nested"));
        Files.writeString(in.resolve("top.mkv"), "a");
        Files.writeString(in.resolve("nested/deep.mkv"), "b");
        WatchedPath flat = new WatchedPath(in.toAbsolutePath().normalize(), false, true, List.of("*.mkv"),
                tmp.resolve("converted").toAbsolutePath().normalize());

        start(TestSettings.builder().watch(flat).build());

        assertThat(paths()).containsExactly(in.resolve("top.mkv").toAbsolutePath().normalize());
    }

    @Test
    void liveFileIsDiscoveredOnce() throws Exception {
        Path in = Files.createDirectories(tmp.resolve("in"));
        start(TestSettings.builder().watch(TestSettings.watched(in, tmp.resolve("converted"))).build());

        // CREATE and several MODIFY events for the same path
        Path movie = in.resolve("movie.mkv");
        Files.writeString(movie, "part one");
        Files.writeString(movie, "part one and two");

        await().atMost(15, TimeUnit.SECONDS).until(() -> paths().contains(movie.toAbsolutePath().normalize()));
        Thread.sleep(300);
        assertThat(paths()).containsOnlyOnce(movie.toAbsolutePath().normalize());
        assertThat(events.withMessage("File discovered")).hasSize(1);
    }

    @Test
    void newSubdirectoryIsWatchedWhenRecursive() throws Exception {
        Path in = Files.createDirectories(tmp.resolve("in"));
        start(TestSettings.builder().watch(TestSettings.watched(in, tmp.resolve("converted"))).build());

        Path season = Files.createDirectories(in.resolve("show/season1"));
        Path episode = Files.writeString(season.resolve("e01.mkv"), "x");

        await().atMost(15, TimeUnit.SECONDS).until(() -> paths().contains(episode.toAbsolutePath().normalize()));
    }

    @Test
    void outputDirectoryAndPartialFilesAreIgnored() throws Exception {
        Path in = Files.createDirectories(tmp.resolve("in"));
        Path out = Files.createDirectories(in.resolve("converted"));
        Files.writeString(out.resolve("done.mp4"), "converted");
        Files.writeString(in.resolve("movie.mp4.part"), "partial");

        start(TestSettings.builder().watch(TestSettings.watched(in, out)).build());

        assertThat(paths()).isEmpty();
    }

    @Test
    void missingPathIsReportedAndOthersStillWork() throws Exception {
        Path in = Files.createDirectories(tmp.resolve("in"));
        Files.writeString(in.resolve("a.mkv"), "a");
        Path missing = tmp.resolve("does-not-exist");

        start(TestSettings.builder()
                .watch(TestSettings.watched(missing, tmp.resolve("converted")))
                .watch(TestSettings.watched(in, tmp.resolve("converted")))
                .build());

        assertThat(paths()).containsExactly(in.resolve("a.mkv").toAbsolutePath().normalize());
        assertThat(events.withMessage("Watched path missing or not a directory; skipping"))
                .singleElement()
                .satisfies(e -> assertThat(e.context()).containsEntry("errorKind", "PATH_LEVEL"));
    }

    @Test
    void forgottenPathIsDiscoveredAgain() throws Exception {
        Path in = Files.createDirectories(tmp.resolve("in"));
        Path movie = Files.writeString(in.resolve("movie.mkv"), "a");
        start(TestSettings.builder().watch(TestSettings.watched(in, tmp.resolve("converted"))).build());
        assertThat(paths()).hasSize(1);

        watcher.forget(movie);
        Files.writeString(movie, "rewritten");

        await().atMost(15, TimeUnit.SECONDS).until(() -> discovered.size() == 2);
    }

    @Test
    void closeStopsTheWatcher() throws Exception {
        Path in = Files.createDirectories(tmp.resolve("in"));
        start(TestSettings.builder().watch(TestSettings.watched(in, tmp.resolve("converted"))).build());

        watcher.close();

        assertThat(watcher.isRunning()).isFalse();
        assertThat(watcher.watchedDirectoryCount()).isZero();
    }
}
