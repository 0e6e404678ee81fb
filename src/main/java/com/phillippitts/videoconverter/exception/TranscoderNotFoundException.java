package com.phillippitts.videoconverter.exception;

/**
 * Thrown when the configured transcoding binary cannot be executed.
 * This is a fatal error that prevents the engine from starting.
 */
public class TranscoderNotFoundException extends StartupFatalException {

    public static final int EXIT_CODE = 3;

    private final String binary;

    public TranscoderNotFoundException(String binary, String detail) {
        super("Transcoder binary not usable: " + binary + " (" + detail + ")", EXIT_CODE);
        this.binary = binary;
    }

    public String getBinary() {
        return binary;
    }
}
