package com.phillippitts.enhancer.service.strategy;

import com.phillippitts.enhancer.config.properties.EnhancerProperties;
import com.phillippitts.enhancer.domain.EnhancementRequest;
import com.phillippitts.enhancer.domain.Operation;
import com.phillippitts.enhancer.domain.TargetSpec;
import com.phillippitts.enhancer.domain.UpscaleMode;
import com.phillippitts.enhancer.exception.OutputTooLargeException;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Maps (operation, source size, target size, mode) to an algorithm path.
 *
 * <p>Selection is a pure function of its inputs; nothing is retained between calls.
 */
@Component
public class StrategySelector {

    /** HD/4K stretches beyond this skip progressive upscaling. */
    public static final double SINGLE_STEP_THRESHOLD = 8.0;

    /** 4K-compressed stretches beyond this go through an intermediate size. */
    public static final double COMPRESSED_INTERMEDIATE_THRESHOLD = 10.0;

    /** Custom smart stretches beyond this use the progressive upscaler. */
    public static final double SMART_PROGRESSIVE_THRESHOLD = 4.0;

    private final int optimizeMaxDimension;
    private final long maxOutputPixels;

    public StrategySelector(EnhancerProperties properties) {
        this.optimizeMaxDimension = properties.getOptimizeMaxDimension();
        this.maxOutputPixels = properties.getMaxOutputPixels();
    }

    /**
     * Plans one request against a decoded source size.
     *
     * @param request      enhancement request
     * @param sourceWidth  decoded width
     * @param sourceHeight decoded height
     * @return plan with the path and exact target
     */
    public EnhancementPlan plan(EnhancementRequest request, int sourceWidth, int sourceHeight) {
        Objects.requireNonNull(request, "request");
        TargetSpec target = targetFor(request, sourceWidth, sourceHeight);
        EnhancementPath path = select(request.operation(), sourceWidth, sourceHeight, target, request.mode());
        double maxScale = target == null ? 1.0 : target.maxScaleFrom(sourceWidth, sourceHeight);
        return new EnhancementPlan(path, target, maxScale);
    }

    /**
     * Output dimensions for a request: fixed for HD/4K, source times factor for custom
     * upscale, a fit within the optimize bound for optimize, none otherwise.
     *
     * @throws OutputTooLargeException if the target exceeds {@code enhancer.max-output-pixels}
     */
    public TargetSpec targetFor(EnhancementRequest request, int sourceWidth, int sourceHeight) {
        TargetSpec target = switch (request.operation()) {
            case TO_HD, TO_4K, TO_4K_COMPRESSED -> TargetSpec.fixedFor(request.operation());
            case CUSTOM_UPSCALE -> TargetSpec.scaled(sourceWidth, sourceHeight, request.scaleFactor());
            case OPTIMIZE -> optimizeTarget(sourceWidth, sourceHeight, optimizeMaxDimension);
            case CONVERT_FORMAT -> null;
        };
        if (target != null && (long) target.width() * target.height() > maxOutputPixels) {
            throw new OutputTooLargeException(target.width(), target.height(), maxOutputPixels);
        }
        return target;
    }

    /**
     * Fits the longer side within {@code maxDimension}, preserving aspect.
     *
     * @return fitted size, or null when the source already fits
     */
    public static TargetSpec optimizeTarget(int sourceWidth, int sourceHeight, int maxDimension) {
        int longest = Math.max(sourceWidth, sourceHeight);
        if (longest <= maxDimension) {
            return null;
        }
        double ratio = (double) maxDimension / longest;
        return new TargetSpec(Math.max(1, (int) (sourceWidth * ratio)), Math.max(1, (int) (sourceHeight * ratio)));
    }

    /**
     * Pure selection rule.
     *
     * @param operation    requested operation
     * @param sourceWidth  source width
     * @param sourceHeight source height
     * @param target       exact output dimensions, null for operations without a target
     * @param mode         upscale mode, only read for custom upscale
     * @return chosen path
     */
    public static EnhancementPath select(Operation operation, int sourceWidth, int sourceHeight,
                                         TargetSpec target, UpscaleMode mode) {
        Objects.requireNonNull(operation, "operation");
        if (operation == Operation.CONVERT_FORMAT) {
            return EnhancementPath.CONVERT;
        }
        if (operation == Operation.OPTIMIZE) {
            return EnhancementPath.OPTIMIZE;
        }
        Objects.requireNonNull(target, "target");
        if (target.isCoveredBy(sourceWidth, sourceHeight)) {
            return EnhancementPath.SMART_RESIZE;
        }
        double maxScale = target.maxScaleFrom(sourceWidth, sourceHeight);
        return switch (operation) {
            case TO_HD -> maxScale > SINGLE_STEP_THRESHOLD
                    ? EnhancementPath.SINGLE_STEP_HQ
                    : EnhancementPath.DENOISE_SHARPEN;
            case TO_4K -> maxScale > SINGLE_STEP_THRESHOLD
                    ? EnhancementPath.SINGLE_STEP_HQ
                    : EnhancementPath.PROGRESSIVE_4K;
            case TO_4K_COMPRESSED -> maxScale > COMPRESSED_INTERMEDIATE_THRESHOLD
                    ? EnhancementPath.COMPRESSED_INTERMEDIATE
                    : EnhancementPath.COMPRESSED;
            case CUSTOM_UPSCALE -> selectCustom(mode, maxScale);
            default -> throw new IllegalStateException("Unhandled operation: " + operation);
        };
    }

    private static EnhancementPath selectCustom(UpscaleMode mode, double maxScale) {
        UpscaleMode m = mode == null ? UpscaleMode.STANDARD : mode;
        return switch (m) {
            case SMART -> maxScale > SMART_PROGRESSIVE_THRESHOLD
                    ? EnhancementPath.SMART_PROGRESSIVE
                    : EnhancementPath.SMART_SINGLE;
            case MAX -> EnhancementPath.MAX_QUALITY;
            case STANDARD -> EnhancementPath.STANDARD;
        };
    }
}
