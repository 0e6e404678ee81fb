package com.phillippitts.videoconverter.service.events;

import org.apache.logging.log4j.Level;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structured engine event handed to the {@link EventSink}.
 *
 * <p>Context values are plain strings so sinks can put them straight into a log
 * context map. Insertion order is preserved.
 *
 * @param component emitting component (e.g. "encoder", "watcher", "worker", "lock")
 * @param level severity
 * @param message human-readable message
 * @param context key-value diagnostics (job id, path, attempt, ...)
 */
public record ConverterEvent(String component, Level level, String message, Map<String, String> context) {

    public ConverterEvent {
        Objects.requireNonNull(component, "component");
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(message, "message");
        context = context == null ? Map.of() : java.util.Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public static Builder of(String component, Level level, String message) {
        return new Builder(component, level, message);
    }

    /**
     * Fluent builder; null values are skipped rather than rejected.
     */
    public static final class Builder {
        private final String component;
        private final Level level;
        private final String message;
        private final Map<String, String> context = new LinkedHashMap<>();

        private Builder(String component, Level level, String message) {
            this.component = component;
            this.level = level;
            this.message = message;
        }

        public Builder with(String key, Object value) {
            if (key != null && value != null) {
                context.put(key, String.valueOf(value));
            }
            return this;
        }

        public ConverterEvent build() {
            return new ConverterEvent(component, level, message, context);
        }
    }
}
