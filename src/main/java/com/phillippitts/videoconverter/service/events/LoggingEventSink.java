package com.phillippitts.videoconverter.service.events;

import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link EventSink} that writes events through Log4j2.
 *
 * <p>Each component logs under {@code videoconverter.<component>} so levels can be tuned
 * per component in {@code log4j2-spring.xml}. The event context is pushed into the
 * ThreadContext for the duration of the call, which makes it available to both the
 * pattern layout ({@code %X}) and JSON layouts.
 */
@Component
public class LoggingEventSink implements EventSink {

    static final String LOGGER_PREFIX = "videoconverter.";

    private final Map<String, Logger> loggers = new ConcurrentHashMap<>();

    @Override
    public void emit(ConverterEvent event) {
        Logger logger = loggers.computeIfAbsent(event.component(),
                component -> LogManager.getLogger(LOGGER_PREFIX + component));
        if (!logger.isEnabled(event.level())) {
            return;
        }
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.putAll(event.context())
                .put("component", event.component())) {
            if (event.context().isEmpty()) {
                logger.log(event.level(), event.message());
            } else {
                logger.log(event.level(), "{} {}", event.message(), event.context());
            }
        }
    }
}
