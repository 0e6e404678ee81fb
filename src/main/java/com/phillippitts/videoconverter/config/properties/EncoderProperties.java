package com.phillippitts.videoconverter.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for hardware encoder detection, prefix {@code encoder}.
 *
 * @param override {@code auto} to probe, or a profile name (nvenc, qsv, vaapi, software) to skip probing
 * @param probeTimeout timeout of each probe command
 * @param nvidiaSmi NVIDIA query tool used by the tier 1 probe
 * @param vainfo VA-API query tool used by the tier 2 and tier 3 probes
 * @param renderDevice DRM render node used for VA-API and Quick Sync
 */
@ConfigurationProperties(prefix = "encoder")
@Validated
public record EncoderProperties(
        @NotBlank String override,
        Duration probeTimeout,
        @NotBlank String nvidiaSmi,
        @NotBlank String vainfo,
        @NotBlank String renderDevice
) {
    public static final String AUTO = "auto";

    public EncoderProperties {
        override = override == null ? AUTO : override.trim().toLowerCase();
        probeTimeout = probeTimeout == null ? Duration.ofSeconds(10) : probeTimeout;
        nvidiaSmi = nvidiaSmi == null ? "nvidia-smi" : nvidiaSmi;
        vainfo = vainfo == null ? "vainfo" : vainfo;
        renderDevice = renderDevice == null ? "/dev/dri/renderD128" : renderDevice;
    }

    public static EncoderProperties defaults() {
        return new EncoderProperties(null, null, null, null, null);
    }

    public boolean isOverridden() {
        return !AUTO.equals(override);
    }
}
