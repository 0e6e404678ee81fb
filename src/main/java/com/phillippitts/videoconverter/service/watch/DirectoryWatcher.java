package com.phillippitts.videoconverter.service.watch;

import com.phillippitts.videoconverter.config.ConverterSettings;
import com.phillippitts.videoconverter.domain.DiscoveredFile;
import com.phillippitts.videoconverter.domain.ErrorKind;
import com.phillippitts.videoconverter.domain.WatchedPath;
import com.phillippitts.videoconverter.service.events.ConverterEvent;
import com.phillippitts.videoconverter.service.events.EventSink;
import com.phillippitts.videoconverter.service.transcode.DestinationResolver;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Turns watched directories into a stream of {@link DiscoveredFile} notifications.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>{@link #start} registers every enabled root with a {@link WatchService} (whole tree when
 *       recursive), then enumerates the existing files on the calling thread</li>
 *   <li>live CREATE/MODIFY events are consumed on the supplied executor until {@link #close()}</li>
 * </ol>
 * Registration happens before the enumeration, so a file written during startup shows up in
 * at least one of the two; the shared {@code discovered} set makes sure it is emitted once.
 *
 * <p>Missing or unreadable roots are reported as PATH_LEVEL events and skipped; a directory
 * that vanishes at runtime loses its watch key and the others carry on.
 */
public class DirectoryWatcher implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(DirectoryWatcher.class);
    private static final String COMPONENT = "watcher";

    private final List<WatchedPath> watchedPaths;
    private final Map<WatchedPath, FilePatternMatcher> matchers = new ConcurrentHashMap<>();
    private final List<Path> excludedDirs;
    private final EventSink events;
    private final Clock clock;

    // Only forget() removes entries: a converted file whose original could not be deleted
    // must not be picked up again. Grows with distinct paths seen; cleared by restart.
    private final Set<Path> discovered = ConcurrentHashMap.newKeySet();
    private final Map<WatchKey, Registration> keys = new ConcurrentHashMap<>();

    private volatile WatchService watchService;
    private volatile Consumer<DiscoveredFile> sink;
    private volatile boolean running;

    private record Registration(Path dir, WatchedPath watchedPath) {}

    public DirectoryWatcher(ConverterSettings settings, EventSink events, Clock clock) {
        this.watchedPaths = settings.enabledWatchedPaths();
        this.excludedDirs = watchedPaths.stream().map(WatchedPath::outputDir).distinct().toList();
        this.events = Objects.requireNonNull(events, "events");
        this.clock = Objects.requireNonNull(clock, "clock");
        for (WatchedPath wp : watchedPaths) {
            matchers.put(wp, new FilePatternMatcher(wp.filePatterns()));
        }
    }

    /**
     * Registers watches, emits pre-existing files to {@code sink}, then hands the live event
     * loop to {@code executor}.
     *
     * @throws IOException if the platform watch service cannot be opened
     */
    public synchronized void start(Consumer<DiscoveredFile> sink, Executor executor) throws IOException {
        if (running) {
            throw new IllegalStateException("Watcher already started");
        }
        this.sink = Objects.requireNonNull(sink, "sink");
        this.watchService = FileSystems.getDefault().newWatchService();
        this.running = true;

        for (WatchedPath wp : watchedPaths) {
            if (!Files.isDirectory(wp.root())) {
                pathProblem(wp.root(), "Watched path missing or not a directory; skipping");
                continue;
            }
            registerTree(wp.root(), wp);
        }
        for (WatchedPath wp : watchedPaths) {
            if (Files.isDirectory(wp.root())) {
                scan(wp.root(), wp);
            }
        }
        LOG.info("Watching {} directories under {} roots; {} pre-existing files discovered",
                keys.size(), watchedPaths.size(), discovered.size());

        executor.execute(this::eventLoop);
    }

    /**
     * Forgets a path so a later event for it is treated as a new sighting. Used for files
     * dropped before they ever became a queued job.
     */
    public void forget(Path path) {
        discovered.remove(path.toAbsolutePath().normalize());
    }

    public boolean isRunning() {
        return running;
    }

    /** Number of directories currently watched. */
    public int watchedDirectoryCount() {
        return keys.size();
    }

    @Override
    public synchronized void close() {
        running = false;
        WatchService ws = this.watchService;
        this.watchService = null;
        if (ws != null) {
            try {
                ws.close();
            } catch (IOException e) {
                LOG.debug("Error closing watch service: {}", e.toString());
            }
        }
        keys.clear();
    }

    private void eventLoop() {
        LOG.debug("Watcher event loop started");
        while (running) {
            WatchService ws = this.watchService;
            if (ws == null) {
                break;
            }
            WatchKey key;
            try {
                key = ws.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ClosedWatchServiceException e) {
                break;
            }
            Registration reg = keys.get(key);
            if (reg == null) {
                key.reset();
                continue;
            }
            for (WatchEvent<?> event : key.pollEvents()) {
                try {
                    handleEvent(reg, event);
                } catch (RuntimeException e) {
                    LOG.warn("Failed to handle {} in {}: {}", event.kind().name(), reg.dir(), e.toString());
                }
            }
            if (!key.reset()) {
                keys.remove(key);
                if (running) {
                    pathProblem(reg.dir(), "Watched directory disappeared; no longer monitored");
                }
            }
        }
        LOG.debug("Watcher event loop stopped");
    }

    private void handleEvent(Registration reg, WatchEvent<?> event) {
        WatchEvent.Kind<?> kind = event.kind();
        if (kind == StandardWatchEventKinds.OVERFLOW) {
            LOG.warn("Watch event overflow in {}; rescanning all roots", reg.dir());
            rescanAll();
            return;
        }
        Path child = reg.dir().resolve((Path) event.context());
        if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
            if (kind == StandardWatchEventKinds.ENTRY_CREATE && reg.watchedPath().recursive() && !isExcluded(child)) {
                // Files copied in together with a new directory can land before it is registered
                registerTree(child, reg.watchedPath());
                scan(child, reg.watchedPath());
            }
            return;
        }
        offer(child, reg.watchedPath());
    }

    private void rescanAll() {
        for (WatchedPath wp : watchedPaths) {
            if (Files.isDirectory(wp.root())) {
                registerTree(wp.root(), wp);
                scan(wp.root(), wp);
            }
        }
    }

    private void offer(Path file, WatchedPath wp) {
        Path path = file.toAbsolutePath().normalize();
        if (isExcluded(path) || !matchers.get(wp).matches(path)) {
            return;
        }
        if (!Files.isRegularFile(path)) {
            return;
        }
        if (!discovered.add(path)) {
            return;
        }
        long size = sizeOrUnknown(path);
        events.emit(ConverterEvent.of(COMPONENT, Level.INFO, "File discovered")
                .with("path", path)
                .with("size", size)
                .with("root", wp.root()));
        Consumer<DiscoveredFile> target = this.sink;
        if (target != null) {
            target.accept(new DiscoveredFile(path, size, clock.instant(), wp));
        }
    }

    private void scan(Path dir, WatchedPath wp) {
        int maxDepth = wp.recursive() ? Integer.MAX_VALUE : 1;
        try {
            Files.walkFileTree(dir, EnumSet.noneOf(FileVisitOption.class), maxDepth, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path d, BasicFileAttributes attrs) {
                    return isExcluded(d) ? FileVisitResult.SKIP_SUBTREE : FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()) {
                        offer(file, wp);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    LOG.debug("Cannot read {} during scan: {}", file, exc.toString());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            pathProblem(dir, "Failed to enumerate watched directory: " + e.getMessage());
        }
    }

    private void registerTree(Path dir, WatchedPath wp) {
        if (!wp.recursive()) {
            register(dir, wp);
            return;
        }
        try {
            Files.walkFileTree(dir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path d, BasicFileAttributes attrs) {
                    if (isExcluded(d)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    register(d, wp);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    LOG.debug("Cannot register {}: {}", file, exc.toString());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            pathProblem(dir, "Failed to register watched directory: " + e.getMessage());
        }
    }

    private void register(Path dir, WatchedPath wp) {
        WatchService ws = this.watchService;
        if (ws == null) {
            return;
        }
        try {
            WatchKey key = dir.register(ws, StandardWatchEventKinds.ENTRY_CREATE,
                    StandardWatchEventKinds.ENTRY_MODIFY);
            keys.putIfAbsent(key, new Registration(dir.toAbsolutePath().normalize(), wp));
        } catch (IOException | ClosedWatchServiceException e) {
            pathProblem(dir, "Cannot watch directory: " + e.getMessage());
        }
    }

    private boolean isExcluded(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        Path name = normalized.getFileName();
        if (name != null && name.toString().endsWith(DestinationResolver.IN_PROGRESS_SUFFIX)) {
            return true;
        }
        for (Path excluded : excludedDirs) {
            if (normalized.startsWith(excluded)) {
                return true;
            }
        }
        return false;
    }

    private void pathProblem(Path path, String message) {
        events.emit(ConverterEvent.of(COMPONENT, Level.WARN, message)
                .with("path", path)
                .with("errorKind", ErrorKind.PATH_LEVEL));
    }

    private static long sizeOrUnknown(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            return -1L;
        }
    }
}
