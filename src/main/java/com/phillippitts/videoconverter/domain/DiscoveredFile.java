package com.phillippitts.videoconverter.domain;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A candidate file seen for the first time by the directory watcher.
 *
 * @param path absolute, normalized file path (the de-duplication key)
 * @param size size at first sighting, or -1 if it could not be read
 * @param observedAt when the file was first seen
 * @param watchedPath the watched directory the file was found under
 */
public record DiscoveredFile(Path path, long size, Instant observedAt, WatchedPath watchedPath) {
}
