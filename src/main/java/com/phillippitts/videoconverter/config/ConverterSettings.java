package com.phillippitts.videoconverter.config;

import com.phillippitts.videoconverter.domain.WatchedPath;
import com.phillippitts.videoconverter.service.retry.BackoffPolicy;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * The canonical, already-validated configuration the engine runs on.
 *
 * <p>Built once by {@link com.phillippitts.videoconverter.config.properties.ConverterSettingsFactory}.
 * Engine components depend on this record only, never on the raw property classes.
 *
 * @param maxWorkers exact number of concurrent conversion workers
 * @param conversionTimeout per-job ffmpeg timeout
 * @param stabilityInterval delay between size samples
 * @param stabilitySamples consecutive equal samples required
 * @param stabilityTimeout overall time a file may keep changing before it is dropped
 * @param maxRetries retries allowed after the first attempt for retryable failures
 * @param retryDelay delay before a retry (base delay for exponential backoff)
 * @param backoff FIXED or EXPONENTIAL
 * @param maxRetryDelay upper bound for exponential backoff
 * @param watchedPaths normalized watch entries, disabled ones included
 * @param deleteOriginal delete the source after a successful conversion
 * @param preservePermissions copy source POSIX permissions to the output
 * @param preserveTimestamps copy the source modification time to the output
 * @param lockFile location of the instance lock record
 * @param lockStaleAfter age after which a lock record is reclaimed
 * @param lockHeartbeat interval at which the holder refreshes its record
 * @param shutdownGracePeriod time in-flight jobs get before their subprocess is killed
 */
public record ConverterSettings(
        int maxWorkers,
        Duration conversionTimeout,
        Duration stabilityInterval,
        int stabilitySamples,
        Duration stabilityTimeout,
        int maxRetries,
        Duration retryDelay,
        BackoffPolicy backoff,
        Duration maxRetryDelay,
        List<WatchedPath> watchedPaths,
        boolean deleteOriginal,
        boolean preservePermissions,
        boolean preserveTimestamps,
        Path lockFile,
        Duration lockStaleAfter,
        Duration lockHeartbeat,
        Duration shutdownGracePeriod
) {
    public ConverterSettings {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be >= 1");
        }
        if (stabilitySamples < 2) {
            throw new IllegalArgumentException("stabilitySamples must be >= 2");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        Objects.requireNonNull(conversionTimeout, "conversionTimeout");
        Objects.requireNonNull(stabilityInterval, "stabilityInterval");
        Objects.requireNonNull(stabilityTimeout, "stabilityTimeout");
        Objects.requireNonNull(retryDelay, "retryDelay");
        Objects.requireNonNull(backoff, "backoff");
        Objects.requireNonNull(maxRetryDelay, "maxRetryDelay");
        Objects.requireNonNull(lockFile, "lockFile");
        Objects.requireNonNull(lockStaleAfter, "lockStaleAfter");
        Objects.requireNonNull(lockHeartbeat, "lockHeartbeat");
        Objects.requireNonNull(shutdownGracePeriod, "shutdownGracePeriod");
        watchedPaths = List.copyOf(watchedPaths);
    }

    /** Watch entries that are actually monitored. */
    public List<WatchedPath> enabledWatchedPaths() {
        return watchedPaths.stream().filter(WatchedPath::enabled).toList();
    }
}
