/**
 * Lifecycle of the conversion pipeline.
 *
 * <p>{@link com.phillippitts.videoconverter.service.orchestration.ConversionEngine} is a
 * {@link org.springframework.context.SmartLifecycle}: it starts once the context is refreshed
 * and stops before the executors it uses are destroyed.
 */
package com.phillippitts.videoconverter.service.orchestration;
