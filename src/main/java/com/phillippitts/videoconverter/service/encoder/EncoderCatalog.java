package com.phillippitts.videoconverter.service.encoder;

import com.phillippitts.videoconverter.config.properties.EncoderProperties;
import com.phillippitts.videoconverter.domain.EncoderProfile;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * The fixed set of encoder profiles, in probe order.
 *
 * <ol>
 *   <li>nvenc - NVIDIA NVENC; {@code nvidia-smi -L} must list a GPU</li>
 *   <li>qsv - Intel Quick Sync; {@code vainfo} must report the iHD media driver</li>
 *   <li>vaapi - any VA-API driver with an encode entrypoint (AMD/Mesa, older Intel)</li>
 *   <li>software - libx264, always available, never probed</li>
 * </ol>
 */
public final class EncoderCatalog {

    public static final String NVENC = "nvenc";
    public static final String QSV = "qsv";
    public static final String VAAPI = "vaapi";
    public static final String SOFTWARE = "software";

    private final List<EncoderProbe> probes;
    private final EncoderProfile software;

    public EncoderCatalog(EncoderProperties props) {
        List<String> vainfo = List.of(props.vainfo(), "--display", "drm", "--device", props.renderDevice());

        EncoderProfile nvenc = new EncoderProfile(NVENC, 1, true,
                List.of(props.nvidiaSmi(), "-L"),
                List.of("-hwaccel", "cuda"),
                List.of("-c:v", "h264_nvenc", "-preset", "p5", "-rc", "vbr", "-cq", "${quality}", "-b:v", "0"));
        EncoderProfile qsv = new EncoderProfile(QSV, 2, true,
                vainfo,
                List.of(),
                List.of("-c:v", "h264_qsv", "-preset", "medium", "-global_quality", "${quality}"));
        EncoderProfile vaapi = new EncoderProfile(VAAPI, 3, true,
                vainfo,
                List.of("-vaapi_device", props.renderDevice()),
                List.of("-vf", "format=nv12,hwupload", "-c:v", "h264_vaapi", "-qp", "${quality}"));
        this.software = new EncoderProfile(SOFTWARE, 4, false,
                List.of(),
                List.of(),
                List.of("-c:v", "libx264", "-preset", "medium", "-crf", "${quality}"));

        this.probes = List.of(
                new EncoderProbe(nvenc, Pattern.compile("^GPU \\d+:", Pattern.MULTILINE)),
                new EncoderProbe(qsv, Pattern.compile("iHD")),
                new EncoderProbe(vaapi, Pattern.compile("VAEntrypointEncSlice")));
    }

    /** Hardware probes in priority order. */
    List<EncoderProbe> probes() {
        return probes;
    }

    public EncoderProfile software() {
        return software;
    }

    public Optional<EncoderProfile> byName(String name) {
        if (SOFTWARE.equalsIgnoreCase(name)) {
            return Optional.of(software);
        }
        return probes.stream()
                .map(EncoderProbe::profile)
                .filter(p -> p.name().equalsIgnoreCase(name))
                .findFirst();
    }
}
