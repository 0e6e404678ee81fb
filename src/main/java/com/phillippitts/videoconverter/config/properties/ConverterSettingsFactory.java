package com.phillippitts.videoconverter.config.properties;

import com.phillippitts.videoconverter.config.ConverterSettings;
import com.phillippitts.videoconverter.domain.WatchedPath;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalizes bound {@link ConverterProperties} into a {@link ConverterSettings}.
 *
 * <p>Normalization performed:
 * - watch paths made absolute and normalized; blank entries dropped; duplicates merged (first wins)
 * - per-entry {@code recursive}, {@code file-patterns}, {@code output-dir} fall back to directory defaults
 * - relative output directories resolved against their watched root
 */
public final class ConverterSettingsFactory {

    private static final Logger LOG = LogManager.getLogger(ConverterSettingsFactory.class);

    private ConverterSettingsFactory() {
    }

    public static ConverterSettings create(ConverterProperties props) {
        ConverterProperties.Directories dirs = props.getDirectories();
        ConverterProperties.Advanced adv = props.getAdvanced();
        ConverterProperties.ErrorHandling err = props.getErrorHandling();
        ConverterProperties.FileHandling files = props.getFileHandling();

        return new ConverterSettings(
                props.getService().getMaxWorkers(),
                props.getService().getConversionTimeout(),
                adv.getStabilityCheckInterval(),
                adv.getStabilitySamples(),
                adv.getStabilityCheckDuration(),
                err.getMaxRetries(),
                err.getRetryDelay(),
                err.getBackoff(),
                err.getMaxRetryDelay(),
                normalizeWatchPaths(dirs),
                files.isDeleteOriginal(),
                files.isPreservePermissions(),
                files.isPreserveTimestamps(),
                Path.of(adv.getLockfile()).toAbsolutePath().normalize(),
                adv.getLockStaleAfter(),
                adv.getLockHeartbeat(),
                adv.getShutdownGracePeriod());
    }

    static List<WatchedPath> normalizeWatchPaths(ConverterProperties.Directories dirs) {
        Map<Path, WatchedPath> byRoot = new LinkedHashMap<>();
        for (WatchPathProperties entry : dirs.getWatchPaths()) {
            if (entry == null || entry.getPath() == null || entry.getPath().isBlank()) {
                continue;
            }
            Path root = Path.of(entry.getPath().trim()).toAbsolutePath().normalize();
            boolean recursive = entry.getRecursive() != null ? entry.getRecursive() : dirs.isRecursive();
            List<String> patterns = entry.getFilePatterns() != null && !entry.getFilePatterns().isEmpty()
                    ? entry.getFilePatterns()
                    : dirs.getFilePatterns();
            String outputDir = entry.getOutputDir() != null && !entry.getOutputDir().isBlank()
                    ? entry.getOutputDir()
                    : dirs.getOutputDir();

            WatchedPath watched = new WatchedPath(root, recursive, entry.isEnabled(),
                    cleanPatterns(patterns), root.resolve(outputDir.trim()).normalize());
            if (byRoot.putIfAbsent(root, watched) != null) {
                LOG.warn("Duplicate watch path ignored: {}", root);
            }
        }
        if (byRoot.values().stream().noneMatch(WatchedPath::enabled)) {
            LOG.warn("No enabled watch paths configured; nothing will be converted");
        }
        return new ArrayList<>(byRoot.values());
    }

    private static List<String> cleanPatterns(List<String> patterns) {
        return patterns.stream()
                .filter(p -> p != null && !p.isBlank())
                .map(String::trim)
                .distinct()
                .toList();
    }
}
