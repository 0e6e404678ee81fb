package com.phillippitts.videoconverter.service.encoder;

import com.phillippitts.videoconverter.domain.EncoderProfile;

import java.util.regex.Pattern;

/**
 * A capability check for one encoder tier: the profile's probe command must exit 0
 * and, when {@code expectedOutput} is set, print something matching it.
 */
record EncoderProbe(EncoderProfile profile, Pattern expectedOutput) {

    boolean accepts(String output) {
        return expectedOutput == null || expectedOutput.matcher(output == null ? "" : output).find();
    }
}
