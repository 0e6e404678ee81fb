package com.phillippitts.videoconverter.exception;

/**
 * Thrown when the instance lock file cannot be read, written or removed.
 */
public class LockFileException extends VideoConverterException {

    private final String lockFile;

    public LockFileException(String lockFile, String message, Throwable cause) {
        super(message + ": " + lockFile, cause);
        this.lockFile = lockFile;
    }

    public String getLockFile() {
        return lockFile;
    }
}
