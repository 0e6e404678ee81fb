package com.phillippitts.videoconverter.service.health;

import com.phillippitts.videoconverter.domain.EncoderProfile;
import com.phillippitts.videoconverter.service.orchestration.ConversionEngine;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports whether the conversion engine is running.
 *
 * <ul>
 *   <li>UP: engine running and holding the instance lock</li>
 *   <li>OUT_OF_SERVICE: context up but the engine has not been started</li>
 *   <li>DOWN: engine running without the lock</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health under {@code conversion}.
 */
@Component
public class ConversionHealthIndicator implements HealthIndicator {

    private final ConversionEngine engine;

    public ConversionHealthIndicator(ConversionEngine engine) {
        this.engine = engine;
    }

    @Override
    public Health health() {
        Health.Builder builder;
        if (!engine.isRunning()) {
            builder = Health.outOfService().withDetail("status", "Engine not started");
        } else if (engine.holdsLock()) {
            builder = Health.up().withDetail("status", "Converting");
        } else {
            builder = Health.down().withDetail("status", "Instance lock lost");
        }
        return builder
                .withDetail("encoder", engine.encoderProfile().map(EncoderProfile::name).orElse("undetected"))
                .withDetail("queueSize", engine.queueSize())
                .withDetail("runningJobs", engine.runningJobs())
                .build();
    }
}
