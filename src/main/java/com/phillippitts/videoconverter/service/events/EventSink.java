package com.phillippitts.videoconverter.service.events;

/**
 * Receives the engine's structured events: probe attempts and selection, file
 * discovery/drop/queue transitions, job start/success/failure/retry and lock
 * acquisition/reclaim/release.
 *
 * <p>Implementations must be thread-safe and must not throw.
 */
@FunctionalInterface
public interface EventSink {

    void emit(ConverterEvent event);

    default void emit(ConverterEvent.Builder builder) {
        emit(builder.build());
    }
}
