package com.phillippitts.videoconverter.service.process;

import com.phillippitts.videoconverter.testutil.ProcessTestDoubles.ProcessBehavior;
import com.phillippitts.videoconverter.testutil.ProcessTestDoubles.ScriptedProcessFactory;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProcessRunnerTest {

    @Test
    void successCapturesOutputAndExitCode() {
        // Arrange
        ScriptedProcessFactory factory = new ScriptedProcessFactory(cmd -> ProcessBehavior.ok("line one\nline two"));
        ProcessRunner runner = new ProcessRunner(factory);

        // Act
        ProcessResult result = runner.run(List.of("tool", "-v"), Duration.ofSeconds(5), 1024);

        // Assert
        assertThat(result.started()).isTrue();
        assertThat(result.succeeded()).isTrue();
        assertThat(result.output()).isEqualTo("line one\nline two");
        assertThat(factory.commands()).containsExactly(List.of("tool", "-v"));
    }

    @Test
    void missingBinaryIsReportedNotThrown() {
        ProcessRunner runner = new ProcessRunner(new ScriptedProcessFactory(cmd -> null));

        ProcessResult result = runner.run(List.of("nvidia-smi", "-L"), Duration.ofSeconds(5), 1024);

        assertThat(result.started()).isFalse();
        assertThat(result.succeeded()).isFalse();
        assertThat(result.startFailure()).contains("nvidia-smi");
    }

    @Test
    void nonZeroExitIsKept() {
        ProcessRunner runner = new ProcessRunner(new ScriptedProcessFactory(cmd -> ProcessBehavior.exit(1, "boom")));

        ProcessResult result = runner.run(List.of("ffmpeg"), Duration.ofSeconds(5), 1024);

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.succeeded()).isFalse();
        assertThat(result.output()).isEqualTo("boom");
    }

    @Test
    void timeoutKillsTheProcess() {
        ScriptedProcessFactory factory = new ScriptedProcessFactory(cmd -> ProcessBehavior.hang());
        ProcessRunner runner = new ProcessRunner(factory);

        long start = System.nanoTime();
        ProcessResult result = runner.run(List.of("ffmpeg"), Duration.ofMillis(200), 1024);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000L;

        assertThat(result.timedOut()).isTrue();
        assertThat(result.succeeded()).isFalse();
        assertThat(factory.started().get(0).wasDestroyCalled()).isTrue();
        assertThat(elapsedMs).isLessThan(5000);
        assertThat(runner.liveCount()).isZero();
    }

    @Test
    void outputBeyondCapKeepsTheTail() {
        StringBuilder big = new StringBuilder();
        for (int i = 0; i < 500; i++) {
            big.append("progress line ").append(i).append('\n');
        }
        big.append("Conversion failed!");
        ProcessRunner runner = new ProcessRunner(new ScriptedProcessFactory(cmd -> ProcessBehavior.exit(1, big.toString())));

        ProcessResult result = runner.run(List.of("ffmpeg"), Duration.ofSeconds(5), 200);

        assertThat(result.output().length()).isLessThanOrEqualTo(200);
        assertThat(result.output()).endsWith("Conversion failed!");
    }
}
