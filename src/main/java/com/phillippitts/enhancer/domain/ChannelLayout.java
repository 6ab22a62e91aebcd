package com.phillippitts.enhancer.domain;

import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;
import java.util.Objects;

/**
 * Set and order of colour/alpha components per pixel of a decoded raster.
 *
 * <p>Only {@link #RGB} and {@link #RGBA} are working layouts; every resampling and
 * filtering primitive requires one of them.
 */
public enum ChannelLayout {
    GRAY,
    GRAY_ALPHA,
    RGB,
    RGBA,
    INDEXED;

    /**
     * Classifies the layout of a decoded image from its colour model.
     *
     * @param image decoded image
     * @return detected layout
     * @throws NullPointerException if image is null
     */
    public static ChannelLayout of(BufferedImage image) {
        Objects.requireNonNull(image, "image");
        ColorModel cm = image.getColorModel();
        if (cm instanceof IndexColorModel) {
            return INDEXED;
        }
        int colorComponents = cm.getNumColorComponents();
        if (colorComponents == 1) {
            return cm.hasAlpha() ? GRAY_ALPHA : GRAY;
        }
        return cm.hasAlpha() ? RGBA : RGB;
    }

    /** @return true for layouts the resampling primitives accept directly */
    public boolean isWorkingLayout() {
        return this == RGB || this == RGBA;
    }

    /** @return true if the layout carries (or may carry) an alpha channel */
    public boolean hasAlpha() {
        return this == RGBA || this == GRAY_ALPHA;
    }
}
