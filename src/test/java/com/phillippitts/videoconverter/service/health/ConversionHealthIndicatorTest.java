package com.phillippitts.videoconverter.service.health;

import com.phillippitts.videoconverter.config.properties.EncoderProperties;
import com.phillippitts.videoconverter.service.encoder.EncoderCatalog;
import com.phillippitts.videoconverter.service.orchestration.ConversionEngine;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ConversionHealthIndicatorTest {

    @Test
    void shouldReportUpWhenRunningWithLock() {
        ConversionEngine engine = mock(ConversionEngine.class);
        when(engine.isRunning()).thenReturn(true);
        when(engine.holdsLock()).thenReturn(true);
        when(engine.encoderProfile())
                .thenReturn(Optional.of(new EncoderCatalog(EncoderProperties.defaults()).software()));
        when(engine.queueSize()).thenReturn(3);
        when(engine.runningJobs()).thenReturn(2);

        Health health = new ConversionHealthIndicator(engine).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("encoder", "software");
        assertThat(health.getDetails()).containsEntry("queueSize", 3);
        assertThat(health.getDetails()).containsEntry("runningJobs", 2);
    }

    @Test
    void shouldReportOutOfServiceBeforeStart() {
        ConversionEngine engine = mock(ConversionEngine.class);
        when(engine.encoderProfile()).thenReturn(Optional.empty());

        Health health = new ConversionHealthIndicator(engine).health();

        assertThat(health.getStatus()).isEqualTo(Status.OUT_OF_SERVICE);
        assertThat(health.getDetails()).containsEntry("encoder", "undetected");
    }

    @Test
    void shouldReportDownWhenLockLost() {
        ConversionEngine engine = mock(ConversionEngine.class);
        when(engine.isRunning()).thenReturn(true);
        when(engine.holdsLock()).thenReturn(false);
        when(engine.encoderProfile()).thenReturn(Optional.empty());

        Health health = new ConversionHealthIndicator(engine).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("status", "Instance lock lost");
    }
}
