package com.phillippitts.videoconverter.service.transcode;

import com.phillippitts.videoconverter.config.properties.TranscoderProperties;
import com.phillippitts.videoconverter.domain.WatchedPath;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Maps a source file to its converted destination.
 *
 * <p>The path relative to the watched root is kept, so {@code <root>/show/s01/e01.mkv}
 * becomes {@code <outputDir>/show/s01/e01.mp4}. ffmpeg writes to
 * {@code <destination>.part} first; the watcher ignores that suffix.
 *
 * <p>Sources that differ only in extension ({@code movie.mkv}, {@code movie.avi}) map to
 * the same destination. {@link #alternative} yields the names used for the later ones:
 * {@code movie-avi.mp4}, then {@code movie-avi-2.mp4} and so on.
 */
public class DestinationResolver {

    public static final String IN_PROGRESS_SUFFIX = ".part";

    private final String extension;

    public DestinationResolver(TranscoderProperties props) {
        this(props.extension());
    }

    public DestinationResolver(String extension) {
        Objects.requireNonNull(extension, "extension");
        this.extension = extension.startsWith(".") ? extension.substring(1) : extension;
    }

    public Path resolve(Path source, WatchedPath watchedPath) {
        Path normalized = source.toAbsolutePath().normalize();
        Path relative = normalized.startsWith(watchedPath.root())
                ? watchedPath.root().relativize(normalized)
                : normalized.getFileName();
        Path target = watchedPath.outputDir().resolve(relative);
        return target.resolveSibling(replaceExtension(target.getFileName().toString()));
    }

    /**
     * Destination for the {@code n}-th source competing for the same name; {@code n = 0}
     * is the plain {@link #resolve} result.
     */
    public Path alternative(Path source, WatchedPath watchedPath, int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be >= 0: " + n);
        }
        Path primary = resolve(source, watchedPath);
        if (n == 0) {
            return primary;
        }
        String sourceName = source.getFileName().toString();
        int dot = sourceName.lastIndexOf('.');
        String base = dot > 0 ? sourceName.substring(0, dot) : sourceName;
        String tag = dot > 0 ? "-" + sourceName.substring(dot + 1) : "";
        if (tag.isEmpty() || n > 1) {
            tag = tag + "-" + n;
        }
        return primary.resolveSibling(base + tag + "." + extension);
    }

    public static Path partialPath(Path destination) {
        return destination.resolveSibling(destination.getFileName() + IN_PROGRESS_SUFFIX);
    }

    private String replaceExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        return base + "." + extension;
    }
}
