package com.phillippitts.enhancer.service.resample;

import com.phillippitts.enhancer.domain.RasterBuffer;
import com.phillippitts.enhancer.domain.TargetSpec;

import java.awt.Rectangle;

/**
 * Aspect-preserving crop-resize for sources that already cover the target.
 *
 * <p>When the aspect ratios differ, the longer axis is cropped symmetrically about the centre
 * to the target aspect, then the crop is resized to the exact target. No padding is ever added.
 */
public final class SmartResizer {

    /** Aspect difference below which the source is resized without cropping. */
    public static final double ASPECT_TOLERANCE = 0.01;

    public static final double SHARPNESS = 1.1;

    private SmartResizer() {
        // utility
    }

    /**
     * Computes the centred region with the target's aspect ratio.
     *
     * @param width  source width
     * @param height source height
     * @param target target dimensions
     * @return region to keep; the whole image when the aspects already match
     */
    public static Rectangle cropRegion(int width, int height, TargetSpec target) {
        double sourceAspect = (double) width / height;
        double targetAspect = target.aspect();
        if (Math.abs(sourceAspect - targetAspect) < ASPECT_TOLERANCE) {
            return new Rectangle(0, 0, width, height);
        }
        if (sourceAspect > targetAspect) {
            int newWidth = Math.max(1, Math.min(width, (int) (height * targetAspect)));
            int left = (width - newWidth) / 2;
            return new Rectangle(left, 0, newWidth, height);
        }
        int newHeight = Math.max(1, Math.min(height, (int) (width / targetAspect)));
        int top = (height - newHeight) / 2;
        return new Rectangle(0, top, width, newHeight);
    }

    /**
     * Crops to the target aspect, resizes with Lanczos and applies a mild sharpness pass.
     *
     * @param source working-layout buffer
     * @param target exact output dimensions
     * @return buffer of exactly {@code target} size
     */
    public static RasterBuffer resize(RasterBuffer source, TargetSpec target) {
        Rectangle region = cropRegion(source.width(), source.height(), target);
        RasterBuffer cropped = region.width == source.width() && region.height == source.height()
                ? source
                : ImageFilters.crop(source, region);
        RasterBuffer resized = Resampler.resize(cropped, target.width(), target.height(), ResamplingKernel.LANCZOS);
        return ImageFilters.enhanceSharpness(resized, SHARPNESS);
    }
}
