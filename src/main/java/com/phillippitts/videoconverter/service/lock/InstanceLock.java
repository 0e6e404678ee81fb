package com.phillippitts.videoconverter.service.lock;

import com.phillippitts.videoconverter.domain.InstanceLockRecord;
import com.phillippitts.videoconverter.exception.LockFileException;
import com.phillippitts.videoconverter.service.events.ConverterEvent;
import com.phillippitts.videoconverter.service.events.EventSink;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.LongPredicate;

/**
 * Guarantees a single running instance per lock file.
 *
 * <p>The lock file holds a small JSON record ({@code pid}, {@code startedAt},
 * {@code hostname}). An existing record blocks startup only while it looks alive:
 * <ul>
 *   <li>its file was modified less than {@code staleAfter} ago (the holder refreshes it)</li>
 *   <li>on this host, its pid belongs to a running process</li>
 *   <li>if the pid is our own, it was written after this JVM started</li>
 * </ul>
 * Anything else, including an unreadable record, is reclaimed.
 *
 * <p>Judging a record stale and deleting it happen while holding an OS file lock on
 * {@code <lockfile>.reclaim}, and the record is re-read before it is deleted. A rival
 * can therefore never lose a record it has just written. New records are created with
 * {@code CREATE_NEW}, so only one of several racing instances can win.
 */
public class InstanceLock {

    private static final Logger LOG = LogManager.getLogger(InstanceLock.class);
    private static final String COMPONENT = "lock";
    private static final int MAX_CREATE_ATTEMPTS = 3;
    static final String GUARD_SUFFIX = ".reclaim";

    private final Path lockFile;
    private final Path guardFile;
    private final Duration staleAfter;
    private final EventSink events;
    private final Clock clock;
    private final LongPredicate pidAlive;
    private final long ownPid;
    private final Instant jvmStartedAt;
    private final String hostname;

    private InstanceLockRecord held;

    public InstanceLock(Path lockFile, Duration staleAfter, EventSink events, Clock clock) {
        this(lockFile, staleAfter, events, clock, InstanceLock::isProcessAlive,
                ProcessHandle.current().pid(),
                Instant.ofEpochMilli(ManagementFactory.getRuntimeMXBean().getStartTime()),
                localHostname());
    }

    // Visible for tests
    InstanceLock(Path lockFile, Duration staleAfter, EventSink events, Clock clock, LongPredicate pidAlive,
                 long ownPid, Instant jvmStartedAt, String hostname) {
        this.lockFile = Objects.requireNonNull(lockFile, "lockFile").toAbsolutePath().normalize();
        this.guardFile = this.lockFile.resolveSibling(this.lockFile.getFileName() + GUARD_SUFFIX);
        this.staleAfter = Objects.requireNonNull(staleAfter, "staleAfter");
        this.events = Objects.requireNonNull(events, "events");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.pidAlive = Objects.requireNonNull(pidAlive, "pidAlive");
        this.ownPid = ownPid;
        this.jvmStartedAt = Objects.requireNonNull(jvmStartedAt, "jvmStartedAt");
        this.hostname = Objects.requireNonNull(hostname, "hostname");
    }

    /**
     * Takes the lock, reclaiming a stale record if necessary. Idempotent while held.
     *
     * @throws LockFileException if the lock file cannot be written
     */
    public synchronized LockAcquisition acquire() {
        if (held != null) {
            return LockAcquisition.ACQUIRED;
        }
        createParentDirectory();

        for (int attempt = 1; attempt <= MAX_CREATE_ATTEMPTS; attempt++) {
            if (tryCreate()) {
                return LockAcquisition.ACQUIRED;
            }
            try (Guard guard = Guard.open(guardFile)) {
                if (guard == null) {
                    events.emit(ConverterEvent.of(COMPONENT, Level.WARN,
                                    "Instance lock is being claimed by another instance")
                            .with("lockfile", lockFile));
                    return LockAcquisition.ALREADY_RUNNING;
                }
                Optional<InstanceLockRecord> existing = read();
                if (existing.isEmpty() && !Files.exists(lockFile)) {
                    continue;
                }
                String staleReason = staleReason(existing);
                if (staleReason == null) {
                    InstanceLockRecord holder = existing.orElseThrow();
                    events.emit(ConverterEvent.of(COMPONENT, Level.WARN, "Instance lock held by another instance")
                            .with("lockfile", lockFile)
                            .with("holderPid", holder.pid())
                            .with("holderHost", holder.hostname())
                            .with("holderStartedAt", holder.startedAt()));
                    return LockAcquisition.ALREADY_RUNNING;
                }
                events.emit(ConverterEvent.of(COMPONENT, Level.INFO, "Reclaiming stale instance lock")
                        .with("lockfile", lockFile)
                        .with("holderPid", existing.map(InstanceLockRecord::pid).orElse(null))
                        .with("reason", staleReason));
                deleteIfUnchanged(existing);
                if (tryCreate()) {
                    return LockAcquisition.ACQUIRED;
                }
            } catch (IOException e) {
                throw new LockFileException(guardFile.toString(), "Cannot lock reclaim guard", e);
            }
        }
        throw new LockFileException(lockFile.toString(),
                "Lock file kept reappearing after " + MAX_CREATE_ATTEMPTS + " reclaim attempts", null);
    }

    /** Creates our record if no file exists; false if one is already there. */
    private boolean tryCreate() {
        InstanceLockRecord record = new InstanceLockRecord(ownPid, clock.instant(), hostname);
        try {
            Files.writeString(lockFile, toJson(record), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (FileAlreadyExistsException e) {
            return false;
        } catch (IOException e) {
            throw new LockFileException(lockFile.toString(), "Cannot create lock file", e);
        }
        held = record;
        events.emit(ConverterEvent.of(COMPONENT, Level.INFO, "Instance lock acquired")
                .with("lockfile", lockFile)
                .with("pid", ownPid));
        return true;
    }

    /**
     * Heartbeat: bumps the record's modification time so it never looks stale while we
     * run. Recreates the record if someone removed it.
     */
    public synchronized void refresh() {
        if (held == null) {
            return;
        }
        Optional<InstanceLockRecord> current = read();
        if (current.isPresent() && !current.get().equals(held)) {
            events.emit(ConverterEvent.of(COMPONENT, Level.ERROR, "Instance lock taken over by another instance")
                    .with("lockfile", lockFile)
                    .with("holderPid", current.get().pid())
                    .with("holderHost", current.get().hostname()));
            held = null;
            return;
        }
        try {
            Files.setLastModifiedTime(lockFile, FileTime.from(clock.instant()));
        } catch (NoSuchFileException e) {
            LOG.warn("Lock file {} disappeared while held; recreating it", lockFile);
            try {
                Files.writeString(lockFile, toJson(held), StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            } catch (IOException ex) {
                LOG.warn("Failed to recreate lock file {}: {}", lockFile, ex.toString());
            }
        } catch (IOException e) {
            LOG.warn("Failed to refresh lock file {}: {}", lockFile, e.toString());
        }
    }

    /**
     * Deletes the record if it is still ours. Safe to call more than once.
     */
    public synchronized void release() {
        if (held == null) {
            return;
        }
        InstanceLockRecord ours = held;
        held = null;
        try (Guard guard = Guard.open(guardFile)) {
            if (guard == null) {
                LOG.warn("Lock file {} is being reclaimed by another instance; leaving it in place", lockFile);
                return;
            }
            Optional<InstanceLockRecord> current = read();
            if (current.isPresent() && !current.get().equals(ours)) {
                LOG.warn("Lock file {} now belongs to pid {}; leaving it in place", lockFile, current.get().pid());
                return;
            }
            deleteQuietly();
        } catch (IOException e) {
            LOG.warn("Cannot lock reclaim guard {}; leaving lock file in place: {}", guardFile, e.toString());
            return;
        }
        events.emit(ConverterEvent.of(COMPONENT, Level.INFO, "Instance lock released")
                .with("lockfile", lockFile));
    }

    public synchronized boolean isHeld() {
        return held != null;
    }

    public Path getLockFile() {
        return lockFile;
    }

    /**
     * Reads the current record.
     *
     * @return empty if the file is missing or cannot be parsed
     */
    public Optional<InstanceLockRecord> read() {
        try {
            String json = Files.readString(lockFile, StandardCharsets.UTF_8);
            JSONObject obj = new JSONObject(json);
            return Optional.of(new InstanceLockRecord(
                    obj.getLong("pid"),
                    Instant.parse(obj.getString("startedAt")),
                    obj.optString("hostname", "")));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException | JSONException | DateTimeParseException e) {
            LOG.debug("Unreadable lock record {}: {}", lockFile, e.toString());
            return Optional.empty();
        }
    }

    /** Null when the existing record belongs to a live instance, otherwise why it is stale. */
    private String staleReason(Optional<InstanceLockRecord> existing) {
        if (existing.isEmpty()) {
            return "record missing or unreadable";
        }
        InstanceLockRecord record = existing.get();
        Instant modified;
        try {
            modified = Files.getLastModifiedTime(lockFile).toInstant();
        } catch (IOException e) {
            return "record vanished";
        }
        Duration age = Duration.between(modified, clock.instant());
        if (age.compareTo(staleAfter) > 0) {
            return "not refreshed for " + age.toSeconds() + "s";
        }
        if (!hostname.equals(record.hostname())) {
            return null;
        }
        if (record.pid() == ownPid) {
            return record.startedAt().isBefore(jvmStartedAt) ? "written by an earlier process with our pid" : null;
        }
        return pidAlive.test(record.pid()) ? null : "process " + record.pid() + " is not running";
    }

    private void createParentDirectory() {
        Path parent = lockFile.getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new LockFileException(lockFile.toString(), "Cannot create lock directory", e);
        }
    }

    /** Deletes the record only if it is still the one that was judged stale. */
    private void deleteIfUnchanged(Optional<InstanceLockRecord> judged) {
        Optional<InstanceLockRecord> current = read();
        if (!current.equals(judged)) {
            LOG.info("Lock file {} changed while being reclaimed; not deleting it", lockFile);
            return;
        }
        deleteQuietly();
    }

    private void deleteQuietly() {
        try {
            Files.deleteIfExists(lockFile);
        } catch (IOException e) {
            LOG.warn("Failed to delete lock file {}: {}", lockFile, e.toString());
        }
    }

    private static String toJson(InstanceLockRecord record) {
        JSONObject obj = new JSONObject();
        obj.put("pid", record.pid());
        obj.put("startedAt", record.startedAt().toString());
        obj.put("hostname", record.hostname());
        return obj.toString();
    }

    private static boolean isProcessAlive(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    private static String localHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            String env = System.getenv("HOSTNAME");
            return env == null ? "localhost" : env;
        }
    }

    /**
     * Exclusive OS lock on the reclaim guard file. Held only for the read-judge-delete
     * sequence, never while the service runs.
     */
    private static final class Guard implements AutoCloseable {
        private final FileChannel channel;
        private final FileLock lock;

        private Guard(FileChannel channel, FileLock lock) {
            this.channel = channel;
            this.lock = lock;
        }

        /** @return null if another instance in this JVM holds the guard */
        static Guard open(Path guardFile) throws IOException {
            FileChannel channel = FileChannel.open(guardFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            try {
                return new Guard(channel, channel.lock());
            } catch (OverlappingFileLockException e) {
                channel.close();
                return null;
            } catch (IOException | RuntimeException e) {
                channel.close();
                throw e;
            }
        }

        @Override
        public void close() throws IOException {
            try {
                lock.release();
            } finally {
                channel.close();
            }
        }
    }
}
