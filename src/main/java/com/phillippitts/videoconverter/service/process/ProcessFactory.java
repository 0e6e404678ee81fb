package com.phillippitts.videoconverter.service.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} to enable hermetic testing of ffmpeg and probe invocations.
 *
 * <p>Production code uses {@link DefaultProcessFactory}. Tests may provide a stub
 * implementation that returns a fake {@link Process} with controlled output/exit behavior.
 */
public interface ProcessFactory {
    /**
     * Starts a new process with the given argument vector. No shell is involved.
     *
     * @param command full command line, with the executable as the first element
     * @param workingDir working directory for the process (may be null)
     * @return started {@link Process}
     * @throws IOException if the process cannot be started (e.g. binary missing)
     */
    Process start(List<String> command, Path workingDir) throws IOException;
}
