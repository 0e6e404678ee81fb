package com.phillippitts.videoconverter.domain;

/**
 * Closed classification of everything that can go wrong in the engine.
 */
public enum ErrorKind {
    /** The job can never succeed as configured (codec/container mismatch, corrupt input). */
    FATAL,
    /** Transient condition worth another attempt (I/O, busy device, timeout). */
    RETRYABLE,
    /** A watched directory is missing or unreadable; only that path is skipped. */
    PATH_LEVEL,
    /** The process cannot start (lock held, transcoder missing). */
    STARTUP_FATAL
}
