package com.phillippitts.videoconverter.service.watch;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.Locale;

/**
 * Matches file names against glob patterns such as {@code *.mkv}, ignoring case.
 * Only the file name is matched, never the directory part.
 */
final class FilePatternMatcher {

    private final List<PathMatcher> matchers;

    FilePatternMatcher(List<String> patterns) {
        this.matchers = patterns.stream()
                .map(p -> FileSystems.getDefault().getPathMatcher("glob:" + p.toLowerCase(Locale.ROOT)))
                .toList();
    }

    boolean matches(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return false;
        }
        Path lower = Path.of(name.toString().toLowerCase(Locale.ROOT));
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(lower)) {
                return true;
            }
        }
        return false;
    }
}
