package com.phillippitts.videoconverter.service.transcode;

import com.phillippitts.videoconverter.config.properties.TranscoderProperties;
import com.phillippitts.videoconverter.domain.EncoderProfile;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the ffmpeg argument vector for one conversion.
 *
 * <p>Stream selection: {@code 0:V:0} is the first real video stream (attached pictures
 * such as cover art are skipped), {@code 0:a?} is every audio stream if there are any.
 * Subtitle and data streams are dropped unless subtitles are enabled.
 */
public class TranscodeCommandBuilder {

    static final String QUALITY_PLACEHOLDER = "${quality}";

    private final TranscoderProperties props;

    public TranscodeCommandBuilder(TranscoderProperties props) {
        this.props = Objects.requireNonNull(props, "props");
    }

    public List<String> build(Path source, Path output, EncoderProfile profile) {
        List<String> cmd = new ArrayList<>();
        cmd.add(props.binary());
        cmd.add("-hide_banner");
        cmd.add("-nostdin");
        cmd.add("-y");
        cmd.addAll(substitute(profile.inputArgs()));
        cmd.add("-i");
        cmd.add(source.toString());

        cmd.add("-map");
        cmd.add("0:V:0");
        cmd.add("-map");
        cmd.add("0:a?");
        if (props.includeSubtitles()) {
            cmd.add("-map");
            cmd.add("0:s?");
        }

        cmd.addAll(substitute(profile.videoArgs()));
        cmd.add("-c:a");
        cmd.add(props.audioCodec());
        cmd.add("-b:a");
        cmd.add(props.audioBitrate());

        if (props.includeSubtitles()) {
            cmd.add("-c:s");
            cmd.add(props.subtitleCodec());
        } else {
            cmd.add("-sn");
        }
        cmd.add("-dn");
        if (props.copyMetadata()) {
            cmd.add("-map_metadata");
            cmd.add("0");
        }
        cmd.addAll(props.extraArgs());
        cmd.add("-f");
        cmd.add(props.format());
        cmd.add(output.toString());
        return List.copyOf(cmd);
    }

    /** {@code <binary> -version}, used to check the binary at startup. */
    public List<String> versionCommand() {
        return List.of(props.binary(), "-version");
    }

    private List<String> substitute(List<String> args) {
        String quality = String.valueOf(props.quality());
        return args.stream().map(arg -> arg.replace(QUALITY_PLACEHOLDER, quality)).toList();
    }
}
