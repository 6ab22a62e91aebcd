package com.phillippitts.enhancer.service.resample;

import com.phillippitts.enhancer.domain.ChannelLayout;
import com.phillippitts.enhancer.domain.RasterBuffer;

import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.WritableRaster;
import java.util.Objects;

/**
 * Filtering primitives: edge-preserving denoise, Gaussian blur, unsharp mask, sharpness
 * boost, 3x3 sharpen blend and crop.
 *
 * <p>Filters operate on the colour channels of RGB and RGBA buffers; alpha is carried through
 * unchanged. Borders are handled by clamping to the nearest edge pixel. Every call returns a
 * new buffer.
 */
public final class ImageFilters {

    /** Smoothing kernel used as the degenerate image of a sharpness boost. */
    private static final float[] SMOOTH = {
            1f, 1f, 1f,
            1f, 5f, 1f,
            1f, 1f, 1f
    };
    private static final float SMOOTH_DIVISOR = 13f;

    private static final float[] SHARPEN = {
            -1f, -1f, -1f,
            -1f, 9f, -1f,
            -1f, -1f, -1f
    };

    private ImageFilters() {
        // utility
    }

    /**
     * Bilateral filter: weights neighbours by spatial distance and by colour similarity
     * (sum of absolute channel differences), so edges survive while flat noise is smoothed.
     *
     * @param source     working-layout buffer
     * @param diameter   neighbourhood diameter in pixels; the window is the inscribed disc
     * @param sigmaColor colour-domain standard deviation
     * @param sigmaSpace spatial standard deviation
     * @return filtered buffer
     */
    public static RasterBuffer bilateral(RasterBuffer source, int diameter, double sigmaColor, double sigmaSpace) {
        Objects.requireNonNull(source, "source");
        Pixels.requireWorkingLayout(source, "bilateral");
        if (diameter < 1 || sigmaColor <= 0 || sigmaSpace <= 0) {
            throw new IllegalArgumentException("Invalid bilateral parameters: d=" + diameter
                    + ", sigmaColor=" + sigmaColor + ", sigmaSpace=" + sigmaSpace);
        }
        int radius = diameter / 2;
        int side = 2 * radius + 1;
        int[] dx = new int[side * side];
        int[] dy = new int[side * side];
        double[] spatial = new double[side * side];
        int taps = 0;
        double spaceCoeff = -0.5 / (sigmaSpace * sigmaSpace);
        for (int j = -radius; j <= radius; j++) {
            for (int i = -radius; i <= radius; i++) {
                int d2 = i * i + j * j;
                if (d2 > radius * radius) {
                    continue;
                }
                dx[taps] = i;
                dy[taps] = j;
                spatial[taps] = Math.exp(d2 * spaceCoeff);
                taps++;
            }
        }
        double colorCoeff = -0.5 / (sigmaColor * sigmaColor);
        double[] colorWeight = new double[3 * 255 + 1];
        for (int d = 0; d < colorWeight.length; d++) {
            colorWeight[d] = Math.exp(d * d * colorCoeff);
        }

        int w = source.width();
        int h = source.height();
        int[] in = Pixels.argb(source.image());
        int[] out = new int[in.length];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int c = in[y * w + x];
                int cr = (c >> 16) & 0xFF;
                int cg = (c >> 8) & 0xFF;
                int cb = c & 0xFF;
                double sr = 0;
                double sg = 0;
                double sb = 0;
                double sw = 0;
                for (int k = 0; k < taps; k++) {
                    int nx = Pixels.clampIndex(x + dx[k], w);
                    int ny = Pixels.clampIndex(y + dy[k], h);
                    int p = in[ny * w + nx];
                    int pr = (p >> 16) & 0xFF;
                    int pg = (p >> 8) & 0xFF;
                    int pb = p & 0xFF;
                    double wk = spatial[k] * colorWeight[Math.abs(pr - cr) + Math.abs(pg - cg) + Math.abs(pb - cb)];
                    sr += pr * wk;
                    sg += pg * wk;
                    sb += pb * wk;
                    sw += wk;
                }
                out[y * w + x] = Pixels.pack(c >>> 24, Pixels.clamp(sr / sw), Pixels.clamp(sg / sw),
                        Pixels.clamp(sb / sw));
            }
        }
        return toBuffer(source, out);
    }

    /**
     * Separable Gaussian blur with a kernel radius of {@code ceil(3 * sigma)}.
     */
    public static RasterBuffer gaussianBlur(RasterBuffer source, double sigma) {
        Objects.requireNonNull(source, "source");
        Pixels.requireWorkingLayout(source, "gaussianBlur");
        return toBuffer(source, blur(Pixels.argb(source.image()), source.width(), source.height(), sigma));
    }

    /**
     * Unsharp mask: {@code original * amount - blurred * (amount - 1)}.
     *
     * @param source working-layout buffer
     * @param amount weight of the original, greater than 1 to sharpen
     * @param sigma  blur standard deviation
     * @return sharpened buffer
     */
    public static RasterBuffer unsharpMask(RasterBuffer source, double amount, double sigma) {
        Objects.requireNonNull(source, "source");
        Pixels.requireWorkingLayout(source, "unsharpMask");
        int[] in = Pixels.argb(source.image());
        int[] blurred = blur(in, source.width(), source.height(), sigma);
        return toBuffer(source, blend(in, amount, blurred, 1.0 - amount));
    }

    /**
     * Sharpness enhancement: {@code smooth + factor * (original - smooth)}. A factor of 1
     * returns the original, above 1 sharpens, below 1 softens.
     */
    public static RasterBuffer enhanceSharpness(RasterBuffer source, double factor) {
        Objects.requireNonNull(source, "source");
        Pixels.requireWorkingLayout(source, "sharpness");
        int[] in = Pixels.argb(source.image());
        int[] smooth = convolve3x3(in, source.width(), source.height(), SMOOTH, SMOOTH_DIVISOR);
        return toBuffer(source, blend(in, factor, smooth, 1.0 - factor));
    }

    /**
     * Applies the 3x3 sharpen kernel (centre 9, neighbours -1) and blends the result with
     * the original: {@code original * originalWeight + sharpened * (1 - originalWeight)}.
     */
    public static RasterBuffer sharpenBlend(RasterBuffer source, double originalWeight) {
        Objects.requireNonNull(source, "source");
        Pixels.requireWorkingLayout(source, "sharpen");
        int[] in = Pixels.argb(source.image());
        int[] sharpened = convolve3x3(in, source.width(), source.height(), SHARPEN, 1f);
        return toBuffer(source, blend(in, originalWeight, sharpened, 1.0 - originalWeight));
    }

    /**
     * Copies a region into a new buffer that owns its pixels.
     *
     * @param source buffer of any layout
     * @param region region inside the buffer
     * @return cropped buffer with the same layout
     */
    public static RasterBuffer crop(RasterBuffer source, Rectangle region) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(region, "region");
        if (region.isEmpty() || !new Rectangle(0, 0, source.width(), source.height()).contains(region)) {
            throw new IllegalArgumentException("Crop region " + region + " outside "
                    + source.width() + "x" + source.height());
        }
        BufferedImage sub = source.image().getSubimage(region.x, region.y, region.width, region.height);
        ColorModel cm = sub.getColorModel();
        WritableRaster raster = cm.createCompatibleWritableRaster(region.width, region.height);
        sub.copyData(raster);
        return source.with(new BufferedImage(cm, raster, cm.isAlphaPremultiplied(), null));
    }

    private static RasterBuffer toBuffer(RasterBuffer source, int[] argb) {
        return source.with(Pixels.image(argb, source.width(), source.height(),
                source.layout() == ChannelLayout.RGBA));
    }

    private static int[] blend(int[] a, double wa, int[] b, double wb) {
        int[] out = new int[a.length];
        for (int i = 0; i < a.length; i++) {
            int pa = a[i];
            int pb = b[i];
            out[i] = Pixels.pack(pa >>> 24,
                    Pixels.clamp(((pa >> 16) & 0xFF) * wa + ((pb >> 16) & 0xFF) * wb),
                    Pixels.clamp(((pa >> 8) & 0xFF) * wa + ((pb >> 8) & 0xFF) * wb),
                    Pixels.clamp((pa & 0xFF) * wa + (pb & 0xFF) * wb));
        }
        return out;
    }

    private static int[] convolve3x3(int[] in, int w, int h, float[] kernel, float divisor) {
        int[] out = new int[in.length];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                float r = 0f;
                float g = 0f;
                float b = 0f;
                int k = 0;
                for (int j = -1; j <= 1; j++) {
                    int row = Pixels.clampIndex(y + j, h) * w;
                    for (int i = -1; i <= 1; i++, k++) {
                        int p = in[row + Pixels.clampIndex(x + i, w)];
                        r += ((p >> 16) & 0xFF) * kernel[k];
                        g += ((p >> 8) & 0xFF) * kernel[k];
                        b += (p & 0xFF) * kernel[k];
                    }
                }
                int c = in[y * w + x];
                out[y * w + x] = Pixels.pack(c >>> 24, Pixels.clamp(r / divisor), Pixels.clamp(g / divisor),
                        Pixels.clamp(b / divisor));
            }
        }
        return out;
    }

    private static int[] blur(int[] in, int w, int h, double sigma) {
        if (sigma <= 0) {
            throw new IllegalArgumentException("Blur sigma must be positive, got: " + sigma);
        }
        int radius = Math.max(1, (int) Math.ceil(3.0 * sigma));
        float[] kernel = new float[2 * radius + 1];
        double sum = 0.0;
        for (int i = -radius; i <= radius; i++) {
            double v = Math.exp(-(i * i) / (2.0 * sigma * sigma));
            kernel[i + radius] = (float) v;
            sum += v;
        }
        for (int i = 0; i < kernel.length; i++) {
            kernel[i] = (float) (kernel[i] / sum);
        }

        float[] work = new float[in.length * 3];
        for (int y = 0; y < h; y++) {
            int row = y * w;
            for (int x = 0; x < w; x++) {
                float r = 0f;
                float g = 0f;
                float b = 0f;
                for (int k = -radius; k <= radius; k++) {
                    int p = in[row + Pixels.clampIndex(x + k, w)];
                    float wk = kernel[k + radius];
                    r += ((p >> 16) & 0xFF) * wk;
                    g += ((p >> 8) & 0xFF) * wk;
                    b += (p & 0xFF) * wk;
                }
                int o = (row + x) * 3;
                work[o] = r;
                work[o + 1] = g;
                work[o + 2] = b;
            }
        }

        int[] out = new int[in.length];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                float r = 0f;
                float g = 0f;
                float b = 0f;
                for (int k = -radius; k <= radius; k++) {
                    int o = (Pixels.clampIndex(y + k, h) * w + x) * 3;
                    float wk = kernel[k + radius];
                    r += work[o] * wk;
                    g += work[o + 1] * wk;
                    b += work[o + 2] * wk;
                }
                out[y * w + x] = Pixels.pack(in[y * w + x] >>> 24, Pixels.clamp(r), Pixels.clamp(g), Pixels.clamp(b));
            }
        }
        return out;
    }
}
