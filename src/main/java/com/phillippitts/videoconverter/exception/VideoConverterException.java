package com.phillippitts.videoconverter.exception;

/**
 * Base exception for all videoconverter application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class VideoConverterException extends RuntimeException {

    public VideoConverterException(String message) {
        super(message);
    }

    public VideoConverterException(String message, Throwable cause) {
        super(message, cause);
    }

    public VideoConverterException(Throwable cause) {
        super(cause);
    }
}
