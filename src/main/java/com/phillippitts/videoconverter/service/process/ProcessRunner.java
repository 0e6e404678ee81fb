package com.phillippitts.videoconverter.service.process;

import com.phillippitts.videoconverter.util.ProcessTimeouts;
import com.phillippitts.videoconverter.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs external commands (ffmpeg, encoder probes) with a timeout and captured output.
 *
 * <p>Responsibilities:
 * - Start the process via {@link ProcessFactory} from an explicit argument vector
 * - Capture merged stdout/stderr on a daemon gobbler thread, capped to avoid unbounded memory
 * - Enforce a timeout and terminate runaway processes (SIGTERM, then SIGKILL)
 * - Track live processes so shutdown can terminate all of them via {@link #terminateAll()}
 *
 * <p>Never throws for process failures; everything is reported in {@link ProcessResult}.
 */
public class ProcessRunner {

    private static final Logger LOG = LogManager.getLogger(ProcessRunner.class);

    private final ProcessFactory processFactory;
    private final Set<Process> live = ConcurrentHashMap.newKeySet();

    public ProcessRunner(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    /**
     * Runs {@code command} and waits for it to finish.
     *
     * @param command argv, executable first
     * @param timeout maximum run time before the process is terminated
     * @param maxOutputChars cap on captured output; further output is drained and discarded
     * @return result describing exit code, captured output, timeout or start failure
     */
    public ProcessResult run(List<String> command, Duration timeout, int maxOutputChars) {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(timeout, "timeout");
        long startTime = System.nanoTime();

        Process process;
        try {
            process = processFactory.start(command, null);
        } catch (IOException e) {
            LOG.debug("Failed to start {}: {}", command.get(0), e.toString());
            return ProcessResult.notStarted(e.getMessage() == null ? e.toString() : e.getMessage(),
                    TimeUtils.elapsedMillis(startTime));
        }

        live.add(process);
        StringBuilder output = new StringBuilder();
        Thread gobbler = startGobbler(process.getInputStream(), output, gobblerName(command), maxOutputChars);
        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                LOG.warn("{} exceeded timeout of {}s; terminating", command.get(0), timeout.toSeconds());
                destroyProcess(process);
                joinQuietly(gobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
                return new ProcessResult(-1, snapshot(output), true, false, null,
                        TimeUtils.elapsedMillis(startTime));
            }
            joinQuietly(gobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            return new ProcessResult(process.exitValue(), snapshot(output), false, false, null,
                    TimeUtils.elapsedMillis(startTime));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroyProcess(process);
            return new ProcessResult(-1, snapshot(output), false, true, null,
                    TimeUtils.elapsedMillis(startTime));
        } finally {
            live.remove(process);
        }
    }

    /**
     * Terminates every process currently started by this runner. Used on shutdown once
     * the grace period for in-flight conversions has run out.
     *
     * @return number of processes that were terminated
     */
    public int terminateAll() {
        int count = 0;
        for (Process process : List.copyOf(live)) {
            if (process.isAlive()) {
                destroyProcess(process);
                count++;
            }
        }
        return count;
    }

    /** Number of processes currently running. */
    public int liveCount() {
        return live.size();
    }

    private static String gobblerName(List<String> command) {
        String exe = command.get(0);
        int slash = Math.max(exe.lastIndexOf('/'), exe.lastIndexOf('\\'));
        return (slash >= 0 ? exe.substring(slash + 1) : exe) + "-out";
    }

    private static String snapshot(StringBuilder output) {
        synchronized (output) {
            return output.toString();
        }
    }

    private Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxChars) {
        StreamGobbler gobbler = new StreamGobbler(inputStream, sink, name, maxChars);
        Thread thread = new Thread(gobbler, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines into a StringBuilder until the cap is reached, then keeps draining
     * without accumulating so the child never blocks on a full pipe.
     *
     * <p>ffmpeg prints the relevant error last, so once the cap is hit the oldest
     * half of the buffer is dropped rather than the newest lines.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxChars;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxChars) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxChars = maxChars;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (sink.length() > 0) {
                            sink.append('\n');
                        }
                        sink.append(line);
                        if (sink.length() > maxChars) {
                            sink.delete(0, sink.length() - maxChars / 2);
                            if (!capReached) {
                                LOG.debug("Stream '{}' reached {} char cap; keeping the tail", name, maxChars);
                                capReached = true;
                            }
                        }
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private void joinQuietly(Thread thread, Duration timeout) {
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            LOG.warn("Interrupted while destroying process; forced termination");
        }
    }
}
