/**
 * Domain models of the conversion engine.
 *
 * <p>Value types are immutable records. The one exception is
 * {@link com.phillippitts.videoconverter.domain.ConversionJob}, whose status and attempt
 * fields change over its lifetime and are guarded by the job's own monitor.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.videoconverter.domain.WatchedPath} - a monitored directory</li>
 *   <li>{@link com.phillippitts.videoconverter.domain.DiscoveredFile} - a first sighting of a candidate file</li>
 *   <li>{@link com.phillippitts.videoconverter.domain.ConversionJob} - one file's conversion</li>
 *   <li>{@link com.phillippitts.videoconverter.domain.EncoderProfile} - a selected ffmpeg encoder backend</li>
 *   <li>{@link com.phillippitts.videoconverter.domain.TranscodeOutcome} - result of one attempt</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.videoconverter.domain;
