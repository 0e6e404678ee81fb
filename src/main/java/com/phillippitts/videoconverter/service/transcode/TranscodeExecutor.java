package com.phillippitts.videoconverter.service.transcode;

import com.phillippitts.videoconverter.domain.ConversionJob;
import com.phillippitts.videoconverter.domain.EncoderProfile;
import com.phillippitts.videoconverter.domain.TranscodeOutcome;

/**
 * Converts one job's source file with the given encoder profile.
 *
 * <p>Implementations block until the attempt is over and never throw for conversion
 * failures; they are reported in the returned {@link TranscodeOutcome}.
 */
public interface TranscodeExecutor {

    /**
     * Checks once at startup that conversions can run at all.
     *
     * @throws com.phillippitts.videoconverter.exception.TranscoderNotFoundException if they cannot
     */
    void verifyAvailable();

    TranscodeOutcome execute(ConversionJob job, EncoderProfile profile);

    /**
     * Kills every conversion still running. Used once the shutdown grace period is over.
     *
     * @return number of subprocesses terminated
     */
    int terminateAll();
}
