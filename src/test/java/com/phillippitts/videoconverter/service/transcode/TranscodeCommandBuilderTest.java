package com.phillippitts.videoconverter.service.transcode;

import com.phillippitts.videoconverter.config.properties.EncoderProperties;
import com.phillippitts.videoconverter.config.properties.TranscoderProperties;
import com.phillippitts.videoconverter.domain.EncoderProfile;
import com.phillippitts.videoconverter.service.encoder.EncoderCatalog;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TranscodeCommandBuilderTest {

    private final EncoderCatalog catalog = new EncoderCatalog(EncoderProperties.defaults());
    private final Path source = Path.of("/in/movie.mkv");
    private final Path output = Path.of("/out/movie.mp4.part");

    @Test
    void softwareCommandIsExactAndDeterministic() {
        TranscodeCommandBuilder builder = new TranscodeCommandBuilder(TranscoderProperties.defaults());

        List<String> cmd = builder.build(source, output, catalog.software());

        assertThat(cmd).containsExactly(
                "ffmpeg", "-hide_banner", "-nostdin", "-y",
                "-i", "/in/movie.mkv",
                "-map", "0:V:0", "-map", "0:a?",
                "-c:v", "libx264", "-preset", "medium", "-crf", "23",
                "-c:a", "aac", "-b:a", "192k",
                "-sn", "-dn",
                "-map_metadata", "0",
                "-f", "mp4", "/out/movie.mp4.part");
        assertThat(builder.build(source, output, catalog.software())).isEqualTo(cmd);
    }

    @Test
    void hardwareInputArgsGoBeforeTheInput() {
        TranscodeCommandBuilder builder = new TranscodeCommandBuilder(TranscoderProperties.defaults());
        EncoderProfile nvenc = catalog.byName(EncoderCatalog.NVENC).orElseThrow();

        List<String> cmd = builder.build(source, output, nvenc);

        assertThat(cmd.indexOf("-hwaccel")).isLessThan(cmd.indexOf("-i"));
        assertThat(cmd).containsSubsequence("-c:v", "h264_nvenc").containsSubsequence("-cq", "23");
        assertThat(cmd).doesNotContain("${quality}");
    }

    @Test
    void firstRealVideoStreamIsMappedSoCoverArtIsSkipped() {
        TranscodeCommandBuilder builder = new TranscodeCommandBuilder(TranscoderProperties.defaults());

        List<String> cmd = builder.build(source, output, catalog.software());

        assertThat(cmd).containsSubsequence("-map", "0:V:0");
        assertThat(cmd).doesNotContain("0:v:0", "0:v");
    }

    @Test
    void subtitlesAreIncludedOnlyWhenEnabled() {
        TranscodeCommandBuilder without = new TranscodeCommandBuilder(TranscoderProperties.defaults());
        TranscodeCommandBuilder with = new TranscodeCommandBuilder(TranscoderProperties.defaults().withSubtitles(true));

        assertThat(without.build(source, output, catalog.software())).contains("-sn").doesNotContain("0:s?");
        assertThat(with.build(source, output, catalog.software()))
                .containsSubsequence("-map", "0:s?")
                .containsSubsequence("-c:s", "mov_text")
                .doesNotContain("-sn");
    }

    @Test
    void versionCommandUsesConfiguredBinary() {
        TranscodeCommandBuilder builder = new TranscodeCommandBuilder(
                TranscoderProperties.defaults().withBinary("/opt/ffmpeg/bin/ffmpeg"));

        assertThat(builder.versionCommand()).containsExactly("/opt/ffmpeg/bin/ffmpeg", "-version");
    }
}
