package com.phillippitts.enhancer.domain;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Decoded pixel data travelling through one enhancement call.
 *
 * <p>Each transformation step produces a new buffer; the previous one is discarded. A buffer
 * never outlives the request that decoded it.
 *
 * @param image  owned pixel data
 * @param layout channel layout of {@code image}
 */
public record RasterBuffer(BufferedImage image, ChannelLayout layout) {

    public RasterBuffer {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(layout, "layout");
    }

    /**
     * Wraps an image, detecting its layout.
     *
     * @param image decoded or transformed image
     * @return new buffer
     */
    public static RasterBuffer of(BufferedImage image) {
        return new RasterBuffer(image, ChannelLayout.of(image));
    }

    public int width() {
        return image.getWidth();
    }

    public int height() {
        return image.getHeight();
    }

    public boolean hasAlpha() {
        return layout.hasAlpha();
    }

    /**
     * Returns a buffer holding {@code next}, keeping this buffer's layout.
     * Used by primitives that preserve the channel set.
     */
    public RasterBuffer with(BufferedImage next) {
        return new RasterBuffer(next, layout);
    }
}
