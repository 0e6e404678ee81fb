package com.phillippitts.videoconverter.exception;

import com.phillippitts.videoconverter.domain.InstanceLockRecord;

/**
 * Thrown when another live instance holds the lock file.
 */
public class InstanceAlreadyRunningException extends StartupFatalException {

    public static final int EXIT_CODE = 2;

    private final InstanceLockRecord holder;

    public InstanceAlreadyRunningException(String lockFile, InstanceLockRecord holder) {
        super("Another instance is already running (lockfile=" + lockFile
                + (holder == null ? "" : ", pid=" + holder.pid() + ", host=" + holder.hostname()) + ")",
                EXIT_CODE);
        this.holder = holder;
    }

    public InstanceLockRecord getHolder() {
        return holder;
    }
}
