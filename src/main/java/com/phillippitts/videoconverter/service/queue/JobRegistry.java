package com.phillippitts.videoconverter.service.queue;

import com.phillippitts.videoconverter.domain.ConversionJob;
import com.phillippitts.videoconverter.domain.DiscoveredFile;
import com.phillippitts.videoconverter.domain.JobStatus;
import com.phillippitts.videoconverter.service.transcode.DestinationResolver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.time.Clock;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Every job the engine knows about, keyed by source path.
 *
 * <p>A path gets at most one job for the lifetime of the process unless the job is
 * {@link #release released} before it was queued, which happens when the file vanished
 * or never stopped growing. Finished jobs stay registered, so a converted original that
 * could not be deleted is not converted again; memory grows with the number of distinct
 * files seen until the process restarts.
 *
 * <p>Each job also claims its destination. A source whose natural destination is already
 * claimed by another source gets an {@link DestinationResolver#alternative alternative}
 * name, so two jobs never write the same output file.
 */
public class JobRegistry {

    private static final Logger LOG = LogManager.getLogger(JobRegistry.class);

    private final Map<Path, ConversionJob> jobs = new ConcurrentHashMap<>();
    // destination -> source; guarded by this
    private final Map<Path, Path> claims = new HashMap<>();
    private final DestinationResolver destinations;
    private final Clock clock;

    public JobRegistry(DestinationResolver destinations, Clock clock) {
        this.destinations = Objects.requireNonNull(destinations, "destinations");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Creates a PENDING job for the file unless its path already has one.
     */
    public synchronized Optional<ConversionJob> register(DiscoveredFile file) {
        Path key = file.path().toAbsolutePath().normalize();
        if (jobs.containsKey(key)) {
            return Optional.empty();
        }
        Path destination = claimDestination(key, file);
        ConversionJob job = new ConversionJob(key, destination, file.watchedPath(), clock);
        jobs.put(key, job);
        return Optional.of(job);
    }

    /**
     * Forgets the job for {@code path} so the file can be registered again.
     */
    public synchronized void release(Path path) {
        ConversionJob job = jobs.remove(path.toAbsolutePath().normalize());
        if (job != null) {
            claims.remove(job.getDestinationPath(), job.getSourcePath());
        }
    }

    private Path claimDestination(Path source, DiscoveredFile file) {
        for (int n = 0; ; n++) {
            Path candidate = destinations.alternative(source, file.watchedPath(), n);
            if (claims.putIfAbsent(candidate, source) == null) {
                if (n > 0) {
                    LOG.info("Destination of {} already taken by {}; writing {} instead",
                            source, claims.get(destinations.resolve(source, file.watchedPath())), candidate);
                }
                return candidate;
            }
        }
    }

    public Optional<ConversionJob> find(Path path) {
        return Optional.ofNullable(jobs.get(path.toAbsolutePath().normalize()));
    }

    public Map<JobStatus, Long> countByStatus() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0L);
        }
        for (ConversionJob job : jobs.values()) {
            counts.merge(job.getStatus(), 1L, Long::sum);
        }
        return counts;
    }

    public long count(JobStatus status) {
        return jobs.values().stream().filter(job -> job.getStatus() == status).count();
    }

    public List<ConversionJob> snapshot() {
        return List.copyOf(jobs.values());
    }
}
