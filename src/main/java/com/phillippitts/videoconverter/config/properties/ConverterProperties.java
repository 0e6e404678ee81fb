package com.phillippitts.videoconverter.config.properties;

import com.phillippitts.videoconverter.service.retry.BackoffPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the conversion engine, prefix {@code converter}.
 *
 * <p>The groups mirror the sections of the service's {@code config.yml}. Bare numbers for
 * durations are read as seconds, so {@code conversion-timeout: 3600} works as before.
 *
 * <p>Example application.yml:
 * <pre>
 * converter:
 *   service:
 *     max-workers: 2
 *     conversion-timeout: 3600
 *   directories:
 *     watch-paths:
 *       - /home/videos/incoming
 *       - path: /mnt/media/uploads
 *         recursive: false
 *     file-patterns: ["*.mkv", "*.mp4", "*.avi"]
 *     output-dir: ../converted
 *   error-handling:
 *     max-retries: 3
 *     retry-delay: 60
 * </pre>
 *
 * <p>These raw values are normalized into
 * {@link com.phillippitts.videoconverter.config.ConverterSettings} by
 * {@link ConverterSettingsFactory}; nothing outside the config package reads them.
 */
@ConfigurationProperties(prefix = "converter")
@Validated
public class ConverterProperties {

    @Valid
    private Service service = new Service();

    @Valid
    private Directories directories = new Directories();

    @Valid
    private FileHandling fileHandling = new FileHandling();

    @Valid
    private ErrorHandling errorHandling = new ErrorHandling();

    @Valid
    private Advanced advanced = new Advanced();

    public Service getService() {
        return service;
    }

    public void setService(Service service) {
        this.service = service;
    }

    public Directories getDirectories() {
        return directories;
    }

    public void setDirectories(Directories directories) {
        this.directories = directories;
    }

    public FileHandling getFileHandling() {
        return fileHandling;
    }

    public void setFileHandling(FileHandling fileHandling) {
        this.fileHandling = fileHandling;
    }

    public ErrorHandling getErrorHandling() {
        return errorHandling;
    }

    public void setErrorHandling(ErrorHandling errorHandling) {
        this.errorHandling = errorHandling;
    }

    public Advanced getAdvanced() {
        return advanced;
    }

    public void setAdvanced(Advanced advanced) {
        this.advanced = advanced;
    }

    /**
     * Worker pool sizing and per-job timeout.
     */
    public static class Service {
        /** Maximum concurrent conversion workers. */
        @Positive(message = "max-workers must be positive")
        private int maxWorkers = 2;

        /** Conversion timeout; a job exceeding it is killed and retried. */
        @NotNull
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration conversionTimeout = Duration.ofHours(1);

        /** Start watching and converting as soon as the context is up. */
        private boolean autoStart = true;

        public int getMaxWorkers() {
            return maxWorkers;
        }

        public void setMaxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
        }

        public Duration getConversionTimeout() {
            return conversionTimeout;
        }

        public void setConversionTimeout(Duration conversionTimeout) {
            this.conversionTimeout = conversionTimeout;
        }

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }
    }

    /**
     * Watched directories and the defaults applied to entries that do not override them.
     */
    public static class Directories {
        /** Entries may be plain path strings or objects; see {@link WatchPathPropertiesConverter}. */
        @Valid
        private List<WatchPathProperties> watchPaths = new ArrayList<>();

        @NotEmpty(message = "file-patterns must not be empty")
        private List<String> filePatterns = new ArrayList<>(List.of("*.mkv", "*.mp4", "*.avi"));

        private boolean recursive = true;

        /** Output directory; relative values resolve against each watched root. */
        @NotBlank(message = "output-dir must not be blank")
        private String outputDir = "../converted";

        public List<WatchPathProperties> getWatchPaths() {
            return watchPaths;
        }

        public void setWatchPaths(List<WatchPathProperties> watchPaths) {
            this.watchPaths = watchPaths;
        }

        public List<String> getFilePatterns() {
            return filePatterns;
        }

        public void setFilePatterns(List<String> filePatterns) {
            this.filePatterns = filePatterns;
        }

        public boolean isRecursive() {
            return recursive;
        }

        public void setRecursive(boolean recursive) {
            this.recursive = recursive;
        }

        public String getOutputDir() {
            return outputDir;
        }

        public void setOutputDir(String outputDir) {
            this.outputDir = outputDir;
        }
    }

    /**
     * What happens to the original and the converted file after success.
     */
    public static class FileHandling {
        private boolean deleteOriginal = true;
        private boolean preservePermissions = true;
        private boolean preserveTimestamps = true;

        public boolean isDeleteOriginal() {
            return deleteOriginal;
        }

        public void setDeleteOriginal(boolean deleteOriginal) {
            this.deleteOriginal = deleteOriginal;
        }

        public boolean isPreservePermissions() {
            return preservePermissions;
        }

        public void setPreservePermissions(boolean preservePermissions) {
            this.preservePermissions = preservePermissions;
        }

        public boolean isPreserveTimestamps() {
            return preserveTimestamps;
        }

        public void setPreserveTimestamps(boolean preserveTimestamps) {
            this.preserveTimestamps = preserveTimestamps;
        }
    }

    /**
     * Retry budget for retryable failures.
     */
    public static class ErrorHandling {
        @Min(value = 0, message = "max-retries must not be negative")
        private int maxRetries = 3;

        @NotNull
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration retryDelay = Duration.ofSeconds(60);

        @NotNull
        private BackoffPolicy backoff = BackoffPolicy.FIXED;

        /** Upper bound for exponential backoff. */
        @NotNull
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration maxRetryDelay = Duration.ofMinutes(30);

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getRetryDelay() {
            return retryDelay;
        }

        public void setRetryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
        }

        public BackoffPolicy getBackoff() {
            return backoff;
        }

        public void setBackoff(BackoffPolicy backoff) {
            this.backoff = backoff;
        }

        public Duration getMaxRetryDelay() {
            return maxRetryDelay;
        }

        public void setMaxRetryDelay(Duration maxRetryDelay) {
            this.maxRetryDelay = maxRetryDelay;
        }
    }

    /**
     * Lock file and stability sampling.
     */
    public static class Advanced {
        @NotBlank(message = "lockfile must not be blank")
        private String lockfile = "/var/run/videoconverter/videoconverter.lock";

        /** A lock record not refreshed for this long is reclaimed even if its pid looks alive. */
        @NotNull
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration lockStaleAfter = Duration.ofMinutes(10);

        @NotNull
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration lockHeartbeat = Duration.ofSeconds(60);

        @NotNull
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration stabilityCheckInterval = Duration.ofSeconds(2);

        /** Overall time a file may keep changing before it is dropped. */
        @NotNull
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration stabilityCheckDuration = Duration.ofMinutes(5);

        /** Consecutive equal size samples required. */
        @Min(value = 2, message = "stability-samples must be at least 2")
        private int stabilitySamples = 2;

        /** Time in-flight conversions get to finish on shutdown before ffmpeg is killed. */
        @NotNull
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration shutdownGracePeriod = Duration.ofSeconds(30);

        public String getLockfile() {
            return lockfile;
        }

        public void setLockfile(String lockfile) {
            this.lockfile = lockfile;
        }

        public Duration getLockStaleAfter() {
            return lockStaleAfter;
        }

        public void setLockStaleAfter(Duration lockStaleAfter) {
            this.lockStaleAfter = lockStaleAfter;
        }

        public Duration getLockHeartbeat() {
            return lockHeartbeat;
        }

        public void setLockHeartbeat(Duration lockHeartbeat) {
            this.lockHeartbeat = lockHeartbeat;
        }

        public Duration getStabilityCheckInterval() {
            return stabilityCheckInterval;
        }

        public void setStabilityCheckInterval(Duration stabilityCheckInterval) {
            this.stabilityCheckInterval = stabilityCheckInterval;
        }

        public Duration getStabilityCheckDuration() {
            return stabilityCheckDuration;
        }

        public void setStabilityCheckDuration(Duration stabilityCheckDuration) {
            this.stabilityCheckDuration = stabilityCheckDuration;
        }

        public int getStabilitySamples() {
            return stabilitySamples;
        }

        public void setStabilitySamples(int stabilitySamples) {
            this.stabilitySamples = stabilitySamples;
        }

        public Duration getShutdownGracePeriod() {
            return shutdownGracePeriod;
        }

        public void setShutdownGracePeriod(Duration shutdownGracePeriod) {
            this.shutdownGracePeriod = shutdownGracePeriod;
        }
    }
}
