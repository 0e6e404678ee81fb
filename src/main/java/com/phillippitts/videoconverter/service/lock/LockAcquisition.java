package com.phillippitts.videoconverter.service.lock;

/**
 * Result of {@link InstanceLock#acquire()}.
 */
public enum LockAcquisition {
    ACQUIRED,
    ALREADY_RUNNING
}
