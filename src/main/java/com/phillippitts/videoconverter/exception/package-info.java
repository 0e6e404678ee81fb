/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.videoconverter.exception.VideoConverterException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.videoconverter.exception.StartupFatalException} - Errors that abort
 *       startup; each carries the process exit code</li>
 *   <li>{@link com.phillippitts.videoconverter.exception.InstanceAlreadyRunningException} - Another
 *       live instance holds the lock file (exit code 2)</li>
 *   <li>{@link com.phillippitts.videoconverter.exception.TranscoderNotFoundException} - The ffmpeg
 *       binary is missing or not executable (exit code 3)</li>
 *   <li>{@link com.phillippitts.videoconverter.exception.LockFileException} - Lock file I/O failure</li>
 * </ul>
 *
 * <p>Per-job failures are deliberately not exceptions: they travel as
 * {@link com.phillippitts.videoconverter.domain.TranscodeOutcome} values classified by
 * {@link com.phillippitts.videoconverter.domain.ErrorKind} and never cross the worker boundary.
 *
 * @since 1.0
 */
package com.phillippitts.videoconverter.exception;
