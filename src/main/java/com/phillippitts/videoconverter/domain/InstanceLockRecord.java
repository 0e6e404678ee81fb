package com.phillippitts.videoconverter.domain;

import java.time.Instant;

/**
 * Contents of the lock file that marks the single running instance.
 */
public record InstanceLockRecord(long pid, Instant startedAt, String hostname) {
}
