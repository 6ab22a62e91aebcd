package com.phillippitts.enhancer.service.io;

import com.phillippitts.enhancer.config.properties.EnhancerProperties;
import com.phillippitts.enhancer.domain.ChannelLayout;
import com.phillippitts.enhancer.domain.EnhancementRequest;
import com.phillippitts.enhancer.domain.ImageFormat;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Chooses output path, encoding and quality per operation.
 *
 * <p>The path is {@code <tempDir>/<sourceBase>_<suffix>.<ext>}; it depends only on the
 * request, so the same request always maps to the same file.
 */
@Component
public class OutputPolicy {

    public static final int QUALITY_HIGH = 95;
    public static final int QUALITY_OPTIMIZE = 85;
    public static final int QUALITY_COMPRESSED = 75;

    private final Path tempDir;

    public OutputPolicy(EnhancerProperties properties) {
        this.tempDir = properties.getTempDir();
    }

    /**
     * @param request       enhancement request
     * @param resultLayout  layout of the transformed buffer about to be written
     * @return output specification
     */
    public OutputSpec outputFor(EnhancementRequest request, ChannelLayout resultLayout) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(resultLayout, "resultLayout");
        return switch (request.operation()) {
            case TO_HD -> jpeg(request, "HD", QUALITY_HIGH, false);
            case TO_4K -> jpeg(request, "4K", QUALITY_HIGH, false);
            case TO_4K_COMPRESSED -> jpeg(request, "4K_compressed", QUALITY_COMPRESSED, true);
            case OPTIMIZE -> jpeg(request, "optimized", QUALITY_OPTIMIZE, true);
            case CONVERT_FORMAT -> spec(request, "converted", request.targetFormat(), QUALITY_HIGH, false);
            case CUSTOM_UPSCALE -> {
                String suffix = suffixForUpscale(request);
                yield resultLayout == ChannelLayout.RGBA
                        ? spec(request, suffix, ImageFormat.PNG, QUALITY_HIGH, false)
                        : jpeg(request, suffix, QUALITY_HIGH, true);
            }
        };
    }

    /** {@code <n>x_<mode>}, e.g. {@code 4x_standard}. */
    static String suffixForUpscale(EnhancementRequest request) {
        return request.scaleFactor() + "x_" + request.mode().label();
    }

    private OutputSpec jpeg(EnhancementRequest request, String suffix, int quality, boolean progressive) {
        return spec(request, suffix, ImageFormat.JPEG, quality, progressive);
    }

    private OutputSpec spec(EnhancementRequest request, String suffix, ImageFormat format, int quality,
                            boolean progressive) {
        Path path = tempDir.resolve(request.sourceBaseName() + "_" + suffix + "." + format.extension());
        return new OutputSpec(path, format, quality, progressive);
    }
}
