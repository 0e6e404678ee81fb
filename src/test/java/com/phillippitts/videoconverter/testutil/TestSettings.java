package com.phillippitts.videoconverter.testutil;

import com.phillippitts.videoconverter.config.ConverterSettings;
import com.phillippitts.videoconverter.domain.WatchedPath;
import com.phillippitts.videoconverter.service.retry.BackoffPolicy;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Builder for {@link ConverterSettings} with timings short enough for tests.
 */
public final class TestSettings {

    private int maxWorkers = 2;
    private Duration conversionTimeout = Duration.ofSeconds(30);
    private Duration stabilityInterval = Duration.ofMillis(50);
    private int stabilitySamples = 2;
    private Duration stabilityTimeout = Duration.ofSeconds(5);
    private int maxRetries = 3;
    private Duration retryDelay = Duration.ofMillis(50);
    private BackoffPolicy backoff = BackoffPolicy.FIXED;
    private Duration maxRetryDelay = Duration.ofSeconds(5);
    private final List<WatchedPath> watchedPaths = new ArrayList<>();
    private boolean deleteOriginal = true;
    private boolean preservePermissions = true;
    private boolean preserveTimestamps = true;
    private Path lockFile = Path.of(System.getProperty("java.io.tmpdir"), "videoconverter-test.lock");
    private Duration lockStaleAfter = Duration.ofMinutes(10);
    private Duration lockHeartbeat = Duration.ofSeconds(60);
    private Duration shutdownGracePeriod = Duration.ofSeconds(2);

    private TestSettings() {}

    public static TestSettings builder() {
        return new TestSettings();
    }

    /** Recursive watched path for {@code *.mkv, *.mp4, *.avi} with output under {@code output}. */
    public static WatchedPath watched(Path root, Path output) {
        return new WatchedPath(root.toAbsolutePath().normalize(), true, true,
                List.of("*.mkv", "*.mp4", "*.avi"), output.toAbsolutePath().normalize());
    }

    public TestSettings maxWorkers(int value) {
        this.maxWorkers = value;
        return this;
    }

    public TestSettings conversionTimeout(Duration value) {
        this.conversionTimeout = value;
        return this;
    }

    public TestSettings stability(Duration interval, Duration timeout) {
        this.stabilityInterval = interval;
        this.stabilityTimeout = timeout;
        return this;
    }

    public TestSettings maxRetries(int value) {
        this.maxRetries = value;
        return this;
    }

    public TestSettings retryDelay(Duration value) {
        this.retryDelay = value;
        return this;
    }

    public TestSettings backoff(BackoffPolicy value, Duration cap) {
        this.backoff = value;
        this.maxRetryDelay = cap;
        return this;
    }

    public TestSettings watch(WatchedPath path) {
        this.watchedPaths.add(path);
        return this;
    }

    public TestSettings deleteOriginal(boolean value) {
        this.deleteOriginal = value;
        return this;
    }

    public TestSettings lockFile(Path value) {
        this.lockFile = value;
        return this;
    }

    public TestSettings shutdownGracePeriod(Duration value) {
        this.shutdownGracePeriod = value;
        return this;
    }

    public ConverterSettings build() {
        return new ConverterSettings(maxWorkers, conversionTimeout, stabilityInterval, stabilitySamples,
                stabilityTimeout, maxRetries, retryDelay, backoff, maxRetryDelay, watchedPaths, deleteOriginal,
                preservePermissions, preserveTimestamps, lockFile, lockStaleAfter, lockHeartbeat,
                shutdownGracePeriod);
    }
}
