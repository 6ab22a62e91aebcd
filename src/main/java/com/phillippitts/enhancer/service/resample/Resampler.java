package com.phillippitts.enhancer.service.resample;

import com.phillippitts.enhancer.domain.ChannelLayout;
import com.phillippitts.enhancer.domain.RasterBuffer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Separable two-pass resampler for RGB and RGBA buffers.
 *
 * <p>Each axis is resampled independently with precomputed contributions. When shrinking,
 * the kernel is stretched by the inverse scale so every source pixel contributes. RGBA
 * buffers are resampled premultiplied so transparent pixels do not bleed colour into their
 * neighbours. The pass order is chosen so the intermediate buffer is the smaller one.
 */
public final class Resampler {

    private static final Logger LOG = LogManager.getLogger(Resampler.class);

    private static final int CHANNELS = 4;

    private Resampler() {
        // utility
    }

    /**
     * Resizes a buffer to exact dimensions.
     *
     * @param source working-layout buffer
     * @param width  output width, positive
     * @param height output height, positive
     * @param kernel interpolation kernel
     * @return new buffer with the same layout, or {@code source} when the size is unchanged
     * @throws com.phillippitts.enhancer.exception.FilterUnavailableException if the layout
     *         is not RGB or RGBA
     */
    public static RasterBuffer resize(RasterBuffer source, int width, int height, ResamplingKernel kernel) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(kernel, "kernel");
        Pixels.requireWorkingLayout(source, "resample");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Resample target must be positive, got: " + width + "x" + height);
        }
        int sw = source.width();
        int sh = source.height();
        if (sw == width && sh == height) {
            return source;
        }

        boolean alpha = source.layout() == ChannelLayout.RGBA;
        float[] pixels = unpack(Pixels.argb(source.image()), alpha);
        Contributions horizontal = Contributions.compute(sw, width, kernel);
        Contributions vertical = Contributions.compute(sh, height, kernel);

        boolean horizontalFirst = (long) width * sh <= (long) sw * height;
        float[] out;
        if (horizontalFirst) {
            float[] work = horizontalPass(pixels, sw, sh, width, horizontal);
            out = verticalPass(work, width, sh, height, vertical);
        } else {
            float[] work = verticalPass(pixels, sw, sh, height, vertical);
            out = horizontalPass(work, sw, height, width, horizontal);
        }
        LOG.trace("Resampled {}x{} -> {}x{} ({}, {} first)", sw, sh, width, height, kernel.name(),
                horizontalFirst ? "horizontal" : "vertical");
        return source.with(Pixels.image(pack(out, alpha), width, height, alpha));
    }

    private static float[] horizontalPass(float[] src, int w, int h, int dstW, Contributions c) {
        float[] dst = new float[dstW * h * CHANNELS];
        for (int y = 0; y < h; y++) {
            int row = y * w * CHANNELS;
            int outRow = y * dstW * CHANNELS;
            for (int x = 0; x < dstW; x++) {
                int start = c.start[x];
                float[] ws = c.weights[x];
                float a = 0f;
                float r = 0f;
                float g = 0f;
                float b = 0f;
                for (int k = 0; k < ws.length; k++) {
                    int i = row + Pixels.clampIndex(start + k, w) * CHANNELS;
                    float wk = ws[k];
                    a += src[i] * wk;
                    r += src[i + 1] * wk;
                    g += src[i + 2] * wk;
                    b += src[i + 3] * wk;
                }
                int o = outRow + x * CHANNELS;
                dst[o] = a;
                dst[o + 1] = r;
                dst[o + 2] = g;
                dst[o + 3] = b;
            }
        }
        return dst;
    }

    private static float[] verticalPass(float[] src, int w, int h, int dstH, Contributions c) {
        int stride = w * CHANNELS;
        float[] dst = new float[w * dstH * CHANNELS];
        for (int y = 0; y < dstH; y++) {
            int start = c.start[y];
            float[] ws = c.weights[y];
            int outRow = y * stride;
            for (int k = 0; k < ws.length; k++) {
                int row = Pixels.clampIndex(start + k, h) * stride;
                float wk = ws[k];
                for (int i = 0; i < stride; i++) {
                    dst[outRow + i] += src[row + i] * wk;
                }
            }
        }
        return dst;
    }

    private static float[] unpack(int[] argb, boolean premultiply) {
        float[] out = new float[argb.length * CHANNELS];
        for (int p = 0, o = 0; p < argb.length; p++, o += CHANNELS) {
            int px = argb[p];
            int a = px >>> 24;
            int r = (px >> 16) & 0xFF;
            int g = (px >> 8) & 0xFF;
            int b = px & 0xFF;
            out[o] = a;
            if (premultiply) {
                float f = a / 255f;
                out[o + 1] = r * f;
                out[o + 2] = g * f;
                out[o + 3] = b * f;
            } else {
                out[o + 1] = r;
                out[o + 2] = g;
                out[o + 3] = b;
            }
        }
        return out;
    }

    private static int[] pack(float[] data, boolean premultiplied) {
        int[] out = new int[data.length / CHANNELS];
        for (int p = 0, o = 0; p < out.length; p++, o += CHANNELS) {
            if (!premultiplied) {
                out[p] = Pixels.pack(255, Pixels.clamp(data[o + 1]), Pixels.clamp(data[o + 2]),
                        Pixels.clamp(data[o + 3]));
                continue;
            }
            int a = Pixels.clamp(data[o]);
            if (a == 0) {
                out[p] = 0;
                continue;
            }
            float f = 255f / a;
            out[p] = Pixels.pack(a, Pixels.clamp(data[o + 1] * f), Pixels.clamp(data[o + 2] * f),
                    Pixels.clamp(data[o + 3] * f));
        }
        return out;
    }

    /** Per-output-pixel source window and normalised weights along one axis. */
    static final class Contributions {
        final int[] start;
        final float[][] weights;

        private Contributions(int[] start, float[][] weights) {
            this.start = start;
            this.weights = weights;
        }

        static Contributions compute(int srcSize, int dstSize, ResamplingKernel kernel) {
            double scale = (double) dstSize / srcSize;
            double filterScale = Math.max(1.0, 1.0 / scale);
            double support = kernel.radius() * filterScale;
            int[] start = new int[dstSize];
            float[][] weights = new float[dstSize][];
            for (int i = 0; i < dstSize; i++) {
                double center = (i + 0.5) / scale - 0.5;
                int left = (int) Math.floor(center - support) + 1;
                int right = (int) Math.floor(center + support);
                int n = Math.max(1, right - left + 1);
                float[] w = new float[n];
                double sum = 0.0;
                for (int j = 0; j < n; j++) {
                    double v = kernel.weight((left + j - center) / filterScale);
                    w[j] = (float) v;
                    sum += v;
                }
                if (Math.abs(sum) < 1e-12) {
                    // degenerate window: nearest neighbour
                    w = new float[] {1f};
                    left = (int) Math.round(center);
                } else {
                    for (int j = 0; j < n; j++) {
                        w[j] = (float) (w[j] / sum);
                    }
                }
                start[i] = left;
                weights[i] = w;
            }
            return new Contributions(start, weights);
        }
    }
}
