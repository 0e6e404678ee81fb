package com.phillippitts.videoconverter;

import com.phillippitts.videoconverter.config.properties.ConverterProperties;
import com.phillippitts.videoconverter.config.properties.EncoderProperties;
import com.phillippitts.videoconverter.config.properties.TranscoderProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        ConverterProperties.class,
        TranscoderProperties.class,
        EncoderProperties.class
})
public class VideoConverterApplication {

    public static void main(String[] args) {
        SpringApplication.run(VideoConverterApplication.class, args);
    }

}
