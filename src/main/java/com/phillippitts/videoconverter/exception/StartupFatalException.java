package com.phillippitts.videoconverter.exception;

import org.springframework.boot.ExitCodeGenerator;

/**
 * An error that prevents the service from starting at all.
 *
 * <p>Thrown from engine startup; Spring Boot turns the {@link ExitCodeGenerator} into
 * the process exit code when context refresh fails.
 */
public abstract class StartupFatalException extends VideoConverterException implements ExitCodeGenerator {

    private final int exitCode;

    protected StartupFatalException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    protected StartupFatalException(String message, int exitCode, Throwable cause) {
        super(message, cause);
        this.exitCode = exitCode;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
