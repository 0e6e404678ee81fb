package com.phillippitts.videoconverter.service.encoder;

import com.phillippitts.videoconverter.config.properties.EncoderProperties;
import com.phillippitts.videoconverter.domain.EncoderProfile;
import com.phillippitts.videoconverter.service.events.ConverterEvent;
import com.phillippitts.videoconverter.service.events.EventSink;
import com.phillippitts.videoconverter.service.process.ProcessResult;
import com.phillippitts.videoconverter.service.process.ProcessRunner;
import com.phillippitts.videoconverter.util.LogSanitizer;
import org.apache.logging.log4j.Level;

import java.util.Objects;
import java.util.Optional;

/**
 * Selects the encoder profile used for every conversion.
 *
 * <p>Probes hardware tiers in {@link EncoderCatalog} order and picks the first that works;
 * if none does, the software profile is returned, so detection never fails. The result is
 * cached for the lifetime of the process. An {@code encoder.override} other than
 * {@code auto} skips probing entirely.
 *
 * <p>Thread-safety: detection is serialized; readers of a finished detection see the
 * immutable profile through a volatile field.
 */
public class EncoderDetector {

    private static final String COMPONENT = "encoder";
    private static final int PROBE_OUTPUT_CHARS = 16_384;

    private final EncoderCatalog catalog;
    private final ProcessRunner runner;
    private final EncoderProperties props;
    private final EventSink events;

    private volatile EncoderProfile selected;

    public EncoderDetector(EncoderCatalog catalog, ProcessRunner runner, EncoderProperties props, EventSink events) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.runner = Objects.requireNonNull(runner, "runner");
        this.props = Objects.requireNonNull(props, "props");
        this.events = Objects.requireNonNull(events, "events");
    }

    /**
     * Returns the cached profile, detecting it on first use.
     */
    public EncoderProfile detect() {
        return detect(false);
    }

    /**
     * @param force re-run the probes even if a profile was already selected
     */
    public synchronized EncoderProfile detect(boolean force) {
        EncoderProfile current = selected;
        if (current != null && !force) {
            return current;
        }
        EncoderProfile profile = props.isOverridden() ? fromOverride() : probeTiers();
        selected = profile;
        events.emit(ConverterEvent.of(COMPONENT, Level.INFO, "Encoder selected")
                .with("profile", profile.name())
                .with("tier", profile.tier())
                .with("hardware", profile.hardware())
                .with("source", props.isOverridden() ? "override" : "probe"));
        return profile;
    }

    /** The selected profile, if detection has run. */
    public Optional<EncoderProfile> selected() {
        return Optional.ofNullable(selected);
    }

    private EncoderProfile fromOverride() {
        Optional<EncoderProfile> profile = catalog.byName(props.override());
        if (profile.isPresent()) {
            return profile.get();
        }
        events.emit(ConverterEvent.of(COMPONENT, Level.WARN, "Unknown encoder override; probing instead")
                .with("override", props.override()));
        return probeTiers();
    }

    private EncoderProfile probeTiers() {
        for (EncoderProbe probe : catalog.probes()) {
            if (runProbe(probe)) {
                return probe.profile();
            }
        }
        return catalog.software();
    }

    private boolean runProbe(EncoderProbe probe) {
        EncoderProfile profile = probe.profile();
        ProcessResult result = runner.run(profile.probeCommand(), props.probeTimeout(), PROBE_OUTPUT_CHARS);

        String failure = null;
        if (!result.started()) {
            failure = "not available: " + result.startFailure();
        } else if (result.timedOut()) {
            failure = "timed out after " + props.probeTimeout().toSeconds() + "s";
        } else if (result.exitCode() != 0) {
            failure = "exit " + result.exitCode() + ": "
                    + LogSanitizer.singleLine(LogSanitizer.tail(result.output(), 200));
        } else if (!probe.accepts(result.output())) {
            failure = "capability not reported";
        }

        boolean ok = failure == null;
        events.emit(ConverterEvent.of(COMPONENT, Level.INFO, "Encoder probe")
                .with("profile", profile.name())
                .with("tier", profile.tier())
                .with("command", profile.probeCommand().get(0))
                .with("result", ok ? "available" : "unavailable")
                .with("reason", failure)
                .with("durationMs", result.durationMs()));
        return ok;
    }
}
