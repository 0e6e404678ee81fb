package com.phillippitts.videoconverter.service.transcode;

import com.phillippitts.videoconverter.config.properties.TranscoderProperties;
import com.phillippitts.videoconverter.domain.ConversionJob;
import com.phillippitts.videoconverter.domain.EncoderProfile;
import com.phillippitts.videoconverter.domain.ErrorKind;
import com.phillippitts.videoconverter.domain.TranscodeOutcome;
import com.phillippitts.videoconverter.exception.TranscoderNotFoundException;
import com.phillippitts.videoconverter.service.process.ProcessResult;
import com.phillippitts.videoconverter.service.process.ProcessRunner;
import com.phillippitts.videoconverter.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link TranscodeExecutor} that runs ffmpeg as a subprocess.
 *
 * <p>Output goes to {@code <destination>.part} and is moved into place only after ffmpeg
 * exited 0 and left a non-empty file, so a destination file is always complete. The
 * partial file is removed on every failure path.
 */
public class FfmpegTranscodeExecutor implements TranscodeExecutor {

    private static final Logger LOG = LogManager.getLogger(FfmpegTranscodeExecutor.class);
    private static final Duration VERSION_CHECK_TIMEOUT = Duration.ofSeconds(10);

    private final ProcessRunner runner;
    private final TranscodeCommandBuilder commandBuilder;
    private final FailureClassifier classifier;
    private final TranscoderProperties props;
    private final Duration timeout;

    public FfmpegTranscodeExecutor(ProcessRunner runner, TranscodeCommandBuilder commandBuilder,
                                   FailureClassifier classifier, TranscoderProperties props, Duration timeout) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.commandBuilder = Objects.requireNonNull(commandBuilder, "commandBuilder");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.props = Objects.requireNonNull(props, "props");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    /**
     * Runs {@code <binary> -version} once.
     *
     * @throws TranscoderNotFoundException if the binary cannot be started or exits non-zero
     */
    @Override
    public void verifyAvailable() {
        ProcessResult result = runner.run(commandBuilder.versionCommand(), VERSION_CHECK_TIMEOUT, 4096);
        if (!result.started()) {
            throw new TranscoderNotFoundException(props.binary(), result.startFailure());
        }
        if (result.timedOut() || result.exitCode() != 0) {
            throw new TranscoderNotFoundException(props.binary(),
                    result.timedOut() ? "version check timed out" : "version check exited " + result.exitCode());
        }
        String firstLine = result.output().lines().findFirst().orElse("");
        LOG.info("Transcoder available: {}", firstLine);
    }

    @Override
    public TranscodeOutcome execute(ConversionJob job, EncoderProfile profile) {
        Path source = job.getSourcePath();
        Path destination = job.getDestinationPath();
        Path partial = DestinationResolver.partialPath(destination);
        long startTime = System.nanoTime();

        try {
            Files.createDirectories(destination.getParent());
        } catch (IOException e) {
            return TranscodeOutcome.failure(-1, "", ErrorKind.RETRYABLE,
                    "cannot create output directory: " + e.getMessage(), false, 0L);
        }

        ProcessResult result = runner.run(commandBuilder.build(source, partial, profile), timeout,
                props.maxOutputChars());
        TranscodeOutcome outcome = toOutcome(result, partial, destination);
        if (!outcome.succeeded()) {
            deletePartial(partial);
            LOG.debug("ffmpeg output tail for {}: {}", source,
                    LogSanitizer.singleLine(LogSanitizer.tail(result.output(), 500)));
        }
        LOG.debug("Transcode of {} finished in {} ms (exit={})", source,
                (System.nanoTime() - startTime) / 1_000_000L, result.exitCode());
        return outcome;
    }

    @Override
    public int terminateAll() {
        return runner.terminateAll();
    }

    private TranscodeOutcome toOutcome(ProcessResult result, Path partial, Path destination) {
        long duration = result.durationMs();
        if (!result.started()) {
            return TranscodeOutcome.failure(-1, "", ErrorKind.RETRYABLE,
                    "ffmpeg could not be started: " + result.startFailure(), false, duration);
        }
        if (result.interrupted()) {
            return TranscodeOutcome.failure(-1, result.output(), ErrorKind.RETRYABLE,
                    "interrupted", false, duration);
        }
        if (result.timedOut()) {
            return TranscodeOutcome.failure(-1, result.output(), ErrorKind.RETRYABLE,
                    "timed out after " + timeout.toSeconds() + "s", true, duration);
        }
        if (result.exitCode() != 0) {
            FailureClassifier.Classification c = classifier.classify(result.exitCode(), result.output());
            return TranscodeOutcome.failure(result.exitCode(), result.output(), c.kind(), c.reason(),
                    false, duration);
        }

        try {
            if (!Files.isRegularFile(partial) || Files.size(partial) == 0) {
                return TranscodeOutcome.failure(0, result.output(), ErrorKind.RETRYABLE,
                        "ffmpeg exited 0 but produced no output", false, duration);
            }
            moveIntoPlace(partial, destination);
        } catch (IOException e) {
            return TranscodeOutcome.failure(0, result.output(), ErrorKind.RETRYABLE,
                    "cannot finalize output: " + e.getMessage(), false, duration);
        }
        return TranscodeOutcome.success(result.output(), duration);
    }

    // Destinations are unique per job, so a replaced file is output left by an earlier run.
    private static void moveIntoPlace(Path partial, Path destination) throws IOException {
        try {
            Files.move(partial, destination, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(partial, destination, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deletePartial(Path partial) {
        try {
            Files.deleteIfExists(partial);
        } catch (IOException e) {
            LOG.warn("Failed to delete partial output {}: {}", partial, e.toString());
        }
    }
}
