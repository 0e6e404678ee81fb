/**
 * Conversion pipeline services.
 *
 * <p>Data flows watcher → stability gate → queue → worker → transcoder → retry manager:
 * <ul>
 *   <li>{@code service.watch} - directory monitoring and de-duplicated discovery</li>
 *   <li>{@code service.stability} - waits until a file is no longer being written</li>
 *   <li>{@code service.queue} - FIFO of ready jobs and the registry of all jobs</li>
 *   <li>{@code service.worker} - fixed pool of conversion loops</li>
 *   <li>{@code service.transcode} - ffmpeg command line, execution and failure classification</li>
 *   <li>{@code service.retry} - success finalization, backoff and terminal transitions</li>
 *   <li>{@code service.encoder} - hardware encoder probing</li>
 *   <li>{@code service.lock} - single-instance guard</li>
 *   <li>{@code service.orchestration} - lifecycle of the whole pipeline</li>
 * </ul>
 *
 * <p>Services are plain classes assembled in
 * {@link com.phillippitts.videoconverter.config.ConverterConfig}; they take their
 * collaborators through the constructor and report through
 * {@link com.phillippitts.videoconverter.service.events.EventSink}.
 *
 * @since 1.0
 */
package com.phillippitts.videoconverter.service;
