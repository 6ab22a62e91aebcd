package com.phillippitts.enhancer.service.resample;

import com.phillippitts.enhancer.domain.RasterBuffer;
import com.phillippitts.enhancer.exception.FilterUnavailableException;

import java.awt.image.BufferedImage;

/** Packed-ARGB helpers shared by the resampling and filtering primitives. */
final class Pixels {

    private Pixels() {
        // utility
    }

    static void requireWorkingLayout(RasterBuffer buffer, String filter) {
        if (!buffer.layout().isWorkingLayout()) {
            throw new FilterUnavailableException(filter, buffer.layout());
        }
    }

    /** Non-premultiplied sRGB ARGB pixels, row-major. Alpha is 255 for opaque images. */
    static int[] argb(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        return image.getRGB(0, 0, w, h, null, 0, w);
    }

    static BufferedImage image(int[] argb, int width, int height, boolean alpha) {
        BufferedImage out = new BufferedImage(width, height,
                alpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
        out.setRGB(0, 0, width, height, argb, 0, width);
        return out;
    }

    static int clamp(double v) {
        if (v <= 0.0) {
            return 0;
        }
        if (v >= 255.0) {
            return 255;
        }
        return (int) (v + 0.5);
    }

    static int clampIndex(int i, int size) {
        if (i < 0) {
            return 0;
        }
        return i >= size ? size - 1 : i;
    }

    static int pack(int a, int r, int g, int b) {
        return (a << 24) | (r << 16) | (g << 8) | b;
    }
}
