package com.phillippitts.enhancer.service.pipeline;

import com.phillippitts.enhancer.domain.EnhancementRequest;
import com.phillippitts.enhancer.domain.RasterBuffer;
import com.phillippitts.enhancer.domain.TargetSpec;
import com.phillippitts.enhancer.exception.ImageEnhancerException;
import com.phillippitts.enhancer.service.normalize.ColorNormalizer;
import com.phillippitts.enhancer.service.progressive.ProgressiveUpscaler;
import com.phillippitts.enhancer.service.resample.ImageFilters;
import com.phillippitts.enhancer.service.resample.Resampler;
import com.phillippitts.enhancer.service.resample.ResamplingKernel;
import com.phillippitts.enhancer.service.resample.SmartResizer;
import com.phillippitts.enhancer.service.strategy.EnhancementPath;
import com.phillippitts.enhancer.service.strategy.EnhancementPlan;
import com.phillippitts.enhancer.service.strategy.StrategySelector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Pixel transforms for every {@link EnhancementPath}, plus the simple direct-resize
 * transform used as the fallback tier.
 */
@Component
public class PathTransforms {

    private static final Logger LOG = LogManager.getLogger(PathTransforms.class);

    static final int STRONG_DENOISE_DIAMETER = 9;
    static final double STRONG_DENOISE_SIGMA = 75.0;
    static final double HD_ORIGINAL_WEIGHT = 0.3;
    static final double UNSHARP_4K_AMOUNT = 1.2;
    static final double UNSHARP_4K_SIGMA = 1.0;
    static final double UNSHARP_MAX_AMOUNT = 1.5;
    static final double UNSHARP_MAX_SIGMA = 2.0;
    static final double FINISH_SHARPNESS = 1.1;
    static final double SIMPLE_SHARPNESS = 1.2;
    static final int COMPRESSED_INTERMEDIATE_FACTOR = 4;

    /** Method name reported by the fallback tier. */
    public static final String SIMPLE_RESIZE = "SIMPLE_RESIZE";

    private final StrategySelector selector;
    private final ProgressiveUpscaler upscaler;
    private final ColorNormalizer normalizer;

    public PathTransforms(StrategySelector selector, ProgressiveUpscaler upscaler, ColorNormalizer normalizer) {
        this.selector = selector;
        this.upscaler = upscaler;
        this.normalizer = normalizer;
    }

    /**
     * Runs the path the selector picks for this buffer.
     */
    public Transformed preferred(RasterBuffer working, EnhancementRequest request) {
        EnhancementPlan plan = selector.plan(request, working.width(), working.height());
        LOG.info("Selected {} for {} ({}x{} -> {}, maxScale={})", plan.path(), request.operation(),
                working.width(), working.height(), plan.target() == null ? "source size" : plan.target(),
                String.format("%.2f", plan.maxScale()));
        TargetSpec target = plan.target();
        return switch (plan.path()) {
            case SMART_RESIZE -> done(SmartResizer.resize(working, target), plan.path());
            case SINGLE_STEP_HQ -> done(ImageFilters.enhanceSharpness(lanczos(working, target), SIMPLE_SHARPNESS),
                    plan.path());
            case DENOISE_SHARPEN -> done(denoiseSharpen(working, target), plan.path());
            case PROGRESSIVE_4K -> done(ImageFilters.unsharpMask(
                    upscaler.upscale(working, target, ProgressiveUpscaler.Variant.DENOISED_BICUBIC),
                    UNSHARP_4K_AMOUNT, UNSHARP_4K_SIGMA), plan.path());
            case COMPRESSED -> done(ImageFilters.enhanceSharpness(lanczos(working, target), FINISH_SHARPNESS),
                    plan.path());
            case COMPRESSED_INTERMEDIATE -> done(compressedWithIntermediate(working, target), plan.path());
            case SMART_SINGLE, SMART_PROGRESSIVE -> done(smart(working, target, plan.path()), plan.path());
            case MAX_QUALITY -> maxQuality(working, target, plan.maxScale());
            case STANDARD -> done(lanczos(working, target), plan.path());
            case OPTIMIZE -> done(ImageFilters.enhanceSharpness(
                    target == null ? working : lanczos(working, target), FINISH_SHARPNESS), plan.path());
            case CONVERT -> done(working, plan.path());
        };
    }

    /**
     * Fallback tier: one direct Lanczos resize to the target, with a mild sharpen for the
     * fixed-target operations only. No crop, denoise or unsharp mask.
     */
    public Transformed simple(RasterBuffer working, EnhancementRequest request) {
        TargetSpec target = selector.targetFor(request, working.width(), working.height());
        RasterBuffer out = target == null ? working : lanczos(working, target);
        if (request.operation().hasFixedTarget()) {
            out = ImageFilters.enhanceSharpness(out, SIMPLE_SHARPNESS);
        }
        return new Transformed(out, SIMPLE_RESIZE);
    }

    RasterBuffer denoiseSharpen(RasterBuffer working, TargetSpec target) {
        RasterBuffer denoised = ImageFilters.bilateral(working, STRONG_DENOISE_DIAMETER,
                STRONG_DENOISE_SIGMA, STRONG_DENOISE_SIGMA);
        RasterBuffer upscaled = Resampler.resize(denoised, target.width(), target.height(), ResamplingKernel.BICUBIC);
        return ImageFilters.sharpenBlend(upscaled, HD_ORIGINAL_WEIGHT);
    }

    RasterBuffer compressedWithIntermediate(RasterBuffer working, TargetSpec target) {
        int iw = Math.min(target.width(), working.width() * COMPRESSED_INTERMEDIATE_FACTOR);
        int ih = Math.min(target.height(), working.height() * COMPRESSED_INTERMEDIATE_FACTOR);
        RasterBuffer intermediate = Resampler.resize(working, iw, ih, ResamplingKernel.LANCZOS);
        LOG.debug("Compressed path intermediate size {}x{}", iw, ih);
        return ImageFilters.enhanceSharpness(lanczos(intermediate, target), FINISH_SHARPNESS);
    }

    RasterBuffer smart(RasterBuffer working, TargetSpec target, EnhancementPath path) {
        RasterBuffer upscaled = path == EnhancementPath.SMART_PROGRESSIVE
                ? upscaler.upscale(working, target, ProgressiveUpscaler.Variant.LANCZOS)
                : lanczos(working, target);
        return ImageFilters.enhanceSharpness(upscaled, FINISH_SHARPNESS);
    }

    /**
     * Max-quality upscale. Any runtime failure of the denoise, bicubic or unsharp stages
     * degrades to the smart path instead of leaving the request to the fallback tier.
     */
    Transformed maxQuality(RasterBuffer working, TargetSpec target, double maxScale) {
        try {
            return done(maxQualityPixels(working, target), EnhancementPath.MAX_QUALITY);
        } catch (RuntimeException e) {
            String stage = e instanceof ImageEnhancerException iee ? iee.stage() : "unclassified";
            EnhancementPath degraded = maxScale > StrategySelector.SMART_PROGRESSIVE_THRESHOLD
                    ? EnhancementPath.SMART_PROGRESSIVE
                    : EnhancementPath.SMART_SINGLE;
            LOG.warn("Max-quality path failed at stage {} ({}), degrading to {}", stage, e.getMessage(), degraded);
            return new Transformed(smart(normalizer.toWorkingLayout(working), target, degraded),
                    EnhancementPath.MAX_QUALITY + "->" + degraded);
        }
    }

    RasterBuffer maxQualityPixels(RasterBuffer working, TargetSpec target) {
        RasterBuffer denoised = ImageFilters.bilateral(working, STRONG_DENOISE_DIAMETER,
                STRONG_DENOISE_SIGMA, STRONG_DENOISE_SIGMA);
        RasterBuffer upscaled = Resampler.resize(denoised, target.width(), target.height(),
                ResamplingKernel.BICUBIC);
        return ImageFilters.unsharpMask(upscaled, UNSHARP_MAX_AMOUNT, UNSHARP_MAX_SIGMA);
    }

    private static RasterBuffer lanczos(RasterBuffer buffer, TargetSpec target) {
        return Resampler.resize(buffer, target.width(), target.height(), ResamplingKernel.LANCZOS);
    }

    private static Transformed done(RasterBuffer buffer, EnhancementPath path) {
        return new Transformed(buffer, path.name());
    }
}
