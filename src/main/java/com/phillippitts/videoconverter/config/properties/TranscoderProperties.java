package com.phillippitts.videoconverter.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Configuration properties for the ffmpeg invocation, prefix {@code transcoder}.
 *
 * <p>Example application.yml:
 * <pre>
 * transcoder:
 *   binary: /usr/bin/ffmpeg
 *   format: mp4
 *   extension: mp4
 *   quality: 23
 *   audio-codec: aac
 *   audio-bitrate: 192k
 * </pre>
 *
 * @param binary ffmpeg executable (name on PATH or absolute path)
 * @param format container passed to {@code -f}
 * @param extension extension of converted files
 * @param quality CRF/CQ/QP value substituted into the encoder profile's {@code ${quality}}
 * @param audioCodec audio encoder for all audio streams
 * @param audioBitrate audio bitrate for all audio streams
 * @param includeSubtitles map subtitle streams too (excluded by default)
 * @param subtitleCodec subtitle encoder used when subtitles are included
 * @param copyMetadata carry global metadata over with {@code -map_metadata 0}
 * @param extraArgs additional output arguments appended before the format
 * @param maxOutputChars cap on captured ffmpeg output
 */
@ConfigurationProperties(prefix = "transcoder")
@Validated
public record TranscoderProperties(
        @NotBlank(message = "Transcoder binary must not be blank")
        String binary,

        @NotBlank(message = "Container format must not be blank")
        String format,

        @NotBlank(message = "Output extension must not be blank")
        String extension,

        @PositiveOrZero(message = "Quality must not be negative")
        Integer quality,

        @NotBlank(message = "Audio codec must not be blank")
        String audioCodec,

        @NotBlank(message = "Audio bitrate must not be blank")
        String audioBitrate,

        Boolean includeSubtitles,

        String subtitleCodec,

        Boolean copyMetadata,

        List<String> extraArgs,

        @Positive(message = "Max output chars must be positive")
        Integer maxOutputChars
) {
    public TranscoderProperties {
        binary = binary == null ? "ffmpeg" : binary;
        format = format == null ? "mp4" : format;
        extension = extension == null ? format : extension;
        quality = quality == null ? 23 : quality;
        audioCodec = audioCodec == null ? "aac" : audioCodec;
        audioBitrate = audioBitrate == null ? "192k" : audioBitrate;
        includeSubtitles = includeSubtitles != null && includeSubtitles;
        subtitleCodec = subtitleCodec == null ? "mov_text" : subtitleCodec;
        copyMetadata = copyMetadata == null || copyMetadata;
        extraArgs = extraArgs == null ? List.of() : List.copyOf(extraArgs);
        maxOutputChars = maxOutputChars == null ? 65536 : maxOutputChars;
    }

    /**
     * All defaults; convenient for tests.
     */
    public static TranscoderProperties defaults() {
        return new TranscoderProperties(null, null, null, null, null, null, null, null, null, null, null);
    }

    public TranscoderProperties withBinary(String newBinary) {
        return new TranscoderProperties(newBinary, format, extension, quality, audioCodec, audioBitrate,
                includeSubtitles, subtitleCodec, copyMetadata, extraArgs, maxOutputChars);
    }

    public TranscoderProperties withSubtitles(boolean include) {
        return new TranscoderProperties(binary, format, extension, quality, audioCodec, audioBitrate,
                include, subtitleCodec, copyMetadata, extraArgs, maxOutputChars);
    }
}
