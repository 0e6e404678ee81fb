package com.phillippitts.videoconverter.domain;

/**
 * Verdict of a stability check on a discovered file.
 */
public enum StabilityResult {
    STABLE,
    /** Size kept changing until the stability timeout elapsed. */
    STILL_WRITING,
    /** File disappeared while being sampled. */
    VANISHED,
    /** Sampling was interrupted (shutdown). */
    ABORTED
}
