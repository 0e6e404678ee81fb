package com.phillippitts.videoconverter.service.transcode;

import com.phillippitts.videoconverter.domain.ErrorKind;

import java.util.List;
import java.util.Locale;

/**
 * Classifies a failed ffmpeg run as FATAL (retrying cannot help) or RETRYABLE.
 *
 * <p>Fatal patterns win when both kinds appear in the output: a corrupt file that also
 * triggers an I/O message is still corrupt. Anything unrecognised is retryable.
 */
public class FailureClassifier {

    /** Outcome of classification with the matched cause. */
    public record Classification(ErrorKind kind, String reason) {}

    private static final List<String> FATAL_PATTERNS = List.of(
            "invalid data found when processing input",
            "moov atom not found",
            "could not find codec parameters",
            "could not write header",
            "codec not currently supported in container",
            "is not supported by the bitstream filter",
            "unsupported codec",
            "no decoder for",
            "decoder not found",
            "unknown encoder",
            "does not contain any stream",
            "incompatible pixel format",
            "header missing"
    );

    private static final List<String> RETRYABLE_PATTERNS = List.of(
            "input/output error",
            "no space left on device",
            "device or resource busy",
            "resource temporarily unavailable",
            "cannot allocate memory",
            "out of memory",
            "connection reset",
            "broken pipe",
            "permission denied",
            "cuda_error_out_of_memory",
            "openencodesessionex failed"
    );

    /** Exit codes from signals (SIGKILL, SIGTERM) or ffmpeg's own abort. */
    private static final List<Integer> SIGNAL_EXIT_CODES = List.of(137, 143, 255);

    public Classification classify(int exitCode, String output) {
        String text = output == null ? "" : output.toLowerCase(Locale.ROOT);
        for (String pattern : FATAL_PATTERNS) {
            if (text.contains(pattern)) {
                return new Classification(ErrorKind.FATAL, pattern);
            }
        }
        for (String pattern : RETRYABLE_PATTERNS) {
            if (text.contains(pattern)) {
                return new Classification(ErrorKind.RETRYABLE, pattern);
            }
        }
        if (SIGNAL_EXIT_CODES.contains(exitCode)) {
            return new Classification(ErrorKind.RETRYABLE, "terminated with exit code " + exitCode);
        }
        return new Classification(ErrorKind.RETRYABLE, "unrecognised failure, exit code " + exitCode);
    }
}
