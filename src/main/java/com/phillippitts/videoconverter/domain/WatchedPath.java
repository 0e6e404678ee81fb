package com.phillippitts.videoconverter.domain;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * A directory monitored for new media files, in canonical form.
 *
 * @param root absolute, normalized directory to watch
 * @param recursive whether sub-directories are watched as well
 * @param enabled disabled entries are kept for reporting but never scanned
 * @param filePatterns glob patterns matched against file names (e.g. {@code *.mkv})
 * @param outputDir absolute directory converted files are written under
 */
public record WatchedPath(
        Path root,
        boolean recursive,
        boolean enabled,
        List<String> filePatterns,
        Path outputDir
) {
    public WatchedPath {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(outputDir, "outputDir");
        filePatterns = List.copyOf(filePatterns);
    }
}
