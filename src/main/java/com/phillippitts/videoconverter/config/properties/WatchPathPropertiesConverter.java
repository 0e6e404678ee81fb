package com.phillippitts.videoconverter.config.properties;

import org.springframework.boot.context.properties.ConfigurationPropertiesBinding;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

/**
 * Lets {@code watch-paths} be written as a flat list of strings.
 *
 * <p>Older configs list bare directories while newer ones use objects with an
 * {@code enabled} flag. Both shapes bind to {@link WatchPathProperties}, so the engine
 * never sees the difference.
 */
@Component
@ConfigurationPropertiesBinding
public class WatchPathPropertiesConverter implements Converter<String, WatchPathProperties> {

    @Override
    public WatchPathProperties convert(String source) {
        return new WatchPathProperties(source.trim());
    }
}
