package com.phillippitts.videoconverter.exception;

import com.phillippitts.videoconverter.domain.InstanceLockRecord;
import org.junit.jupiter.api.Test;
import org.springframework.boot.ExitCodeGenerator;

import java.io.IOException;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void videoConverterExceptionShouldIncludeMessageAndCause() {
        IOException cause = new IOException("IO failure");
        VideoConverterException ex = new VideoConverterException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void instanceAlreadyRunningShouldExitWithTwoAndNameHolder() {
        InstanceLockRecord holder = new InstanceLockRecord(1234, Instant.parse("2026-01-01T00:00:00Z"), "nas");
        InstanceAlreadyRunningException ex =
                new InstanceAlreadyRunningException("/var/run/videoconverter/videoconverter.lock", holder);

        assertThat(ex).isInstanceOf(StartupFatalException.class).isInstanceOf(ExitCodeGenerator.class);
        assertThat(ex.getExitCode()).isEqualTo(2);
        assertThat(ex.getMessage()).contains("pid=1234").contains("host=nas");
        assertThat(ex.getHolder()).isEqualTo(holder);
    }

    @Test
    void instanceAlreadyRunningShouldTolerateUnknownHolder() {
        InstanceAlreadyRunningException ex = new InstanceAlreadyRunningException("/tmp/x.lock", null);

        assertThat(ex.getMessage()).contains("/tmp/x.lock").doesNotContain("pid=");
    }

    @Test
    void transcoderNotFoundShouldExitWithThreeAndNameBinary() {
        TranscoderNotFoundException ex = new TranscoderNotFoundException("/usr/bin/ffmpeg", "No such file");

        assertThat(ex.getExitCode()).isEqualTo(3);
        assertThat(ex.getBinary()).isEqualTo("/usr/bin/ffmpeg");
        assertThat(ex.getMessage()).contains("/usr/bin/ffmpeg").contains("No such file");
    }

    @Test
    void lockFileExceptionShouldIncludePath() {
        LockFileException ex = new LockFileException("/run/a.lock", "Cannot create lock file", new IOException("denied"));

        assertThat(ex).isInstanceOf(VideoConverterException.class).isNotInstanceOf(StartupFatalException.class);
        assertThat(ex.getMessage()).isEqualTo("Cannot create lock file: /run/a.lock");
        assertThat(ex.getLockFile()).isEqualTo("/run/a.lock");
    }
}
