package com.phillippitts.videoconverter.domain;

import java.util.List;

/**
 * An ffmpeg encoder backend and the arguments that select it.
 *
 * <p>Argument templates may contain {@code ${quality}}, substituted with the configured
 * quality value when the transcode command is built.
 *
 * @param name short profile name (nvenc, qsv, vaapi, software)
 * @param tier probe priority, 1 is probed first; the software fallback has the highest tier
 * @param hardware whether the profile uses a hardware encoder
 * @param probeCommand argv proving the backend is usable (empty for software)
 * @param inputArgs arguments placed before {@code -i}
 * @param videoArgs video codec arguments placed after the stream mapping
 */
public record EncoderProfile(
        String name,
        int tier,
        boolean hardware,
        List<String> probeCommand,
        List<String> inputArgs,
        List<String> videoArgs
) {
    public EncoderProfile {
        probeCommand = List.copyOf(probeCommand);
        inputArgs = List.copyOf(inputArgs);
        videoArgs = List.copyOf(videoArgs);
    }
}
