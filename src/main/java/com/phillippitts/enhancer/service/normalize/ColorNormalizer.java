package com.phillippitts.enhancer.service.normalize;

import com.phillippitts.enhancer.domain.ChannelLayout;
import com.phillippitts.enhancer.domain.ImageFormat;
import com.phillippitts.enhancer.domain.RasterBuffer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.util.Objects;

/**
 * Reconciles a buffer's channel layout with the resampling primitives and with the target
 * encoding.
 *
 * <ul>
 *   <li>Working layout: palette images become RGBA when the palette has transparency, RGB
 *       otherwise; grayscale becomes RGB; grayscale+alpha becomes RGBA. The pixel data is
 *       always packed int ARGB/RGB after this step.</li>
 *   <li>Encoding layout: alpha is flattened onto white for encodings without alpha.</li>
 * </ul>
 */
@Component
public class ColorNormalizer {

    private static final Logger LOG = LogManager.getLogger(ColorNormalizer.class);

    private static final int WHITE = 255;

    /**
     * Converts a decoded buffer to RGB or RGBA.
     *
     * @param buffer decoded buffer of any layout
     * @return buffer whose layout is {@link ChannelLayout#RGB} or {@link ChannelLayout#RGBA},
     *         backed by a packed int image
     */
    public RasterBuffer toWorkingLayout(RasterBuffer buffer) {
        Objects.requireNonNull(buffer, "buffer");
        BufferedImage image = buffer.image();
        return switch (buffer.layout()) {
            case RGB -> image.getType() == BufferedImage.TYPE_INT_RGB
                    ? buffer
                    : new RasterBuffer(copyPacked(image, false), ChannelLayout.RGB);
            case RGBA -> image.getType() == BufferedImage.TYPE_INT_ARGB
                    ? buffer
                    : new RasterBuffer(copyPacked(image, true), ChannelLayout.RGBA);
            case INDEXED -> {
                boolean alpha = paletteHasAlpha((IndexColorModel) image.getColorModel());
                LOG.debug("Expanding palette image to {}", alpha ? "RGBA" : "RGB");
                yield new RasterBuffer(copyPacked(image, alpha), alpha ? ChannelLayout.RGBA : ChannelLayout.RGB);
            }
            case GRAY -> new RasterBuffer(expandGray(image, false), ChannelLayout.RGB);
            case GRAY_ALPHA -> new RasterBuffer(expandGray(image, true), ChannelLayout.RGBA);
        };
    }

    /**
     * Prepares a working buffer for an encoding: alpha is composited onto white when the
     * format has no alpha channel.
     *
     * @param buffer working-layout buffer
     * @param format target encoding
     * @return buffer the encoder can write as-is
     */
    public RasterBuffer forEncoding(RasterBuffer buffer, ImageFormat format) {
        Objects.requireNonNull(buffer, "buffer");
        Objects.requireNonNull(format, "format");
        RasterBuffer working = buffer.layout().isWorkingLayout() ? buffer : toWorkingLayout(buffer);
        if (working.layout() == ChannelLayout.RGBA && !format.supportsAlpha()) {
            return new RasterBuffer(flattenOnWhite(working.image()), ChannelLayout.RGB);
        }
        return working;
    }

    static BufferedImage flattenOnWhite(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        int[] px = image.getRGB(0, 0, w, h, null, 0, w);
        for (int i = 0; i < px.length; i++) {
            int p = px[i];
            int a = p >>> 24;
            if (a == 255) {
                continue;
            }
            int r = (((p >> 16) & 0xFF) * a + WHITE * (255 - a) + 127) / 255;
            int g = (((p >> 8) & 0xFF) * a + WHITE * (255 - a) + 127) / 255;
            int b = ((p & 0xFF) * a + WHITE * (255 - a) + 127) / 255;
            px[i] = 0xFF000000 | (r << 16) | (g << 8) | b;
        }
        BufferedImage out = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        out.setRGB(0, 0, w, h, px, 0, w);
        return out;
    }

    private static boolean paletteHasAlpha(IndexColorModel cm) {
        if (cm.getTransparentPixel() >= 0) {
            return true;
        }
        if (!cm.hasAlpha()) {
            return false;
        }
        for (int i = 0; i < cm.getMapSize(); i++) {
            if (cm.getAlpha(i) < 255) {
                return true;
            }
        }
        return false;
    }

    private static BufferedImage copyPacked(BufferedImage image, boolean alpha) {
        int w = image.getWidth();
        int h = image.getHeight();
        int[] px = image.getRGB(0, 0, w, h, null, 0, w);
        BufferedImage out = new BufferedImage(w, h, alpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
        out.setRGB(0, 0, w, h, px, 0, w);
        return out;
    }

    /**
     * Replicates gray samples into RGB directly from the raster. Going through the colour
     * model would apply the linear-gray to sRGB curve and brighten mid tones.
     */
    private static BufferedImage expandGray(BufferedImage image, boolean alpha) {
        int w = image.getWidth();
        int h = image.getHeight();
        Raster raster = image.getRaster();
        int graySize = raster.getSampleModel().getSampleSize(0);
        int alphaSize = alpha ? raster.getSampleModel().getSampleSize(1) : 8;
        int[] gray = raster.getSamples(0, 0, w, h, 0, (int[]) null);
        int[] alphas = alpha ? raster.getSamples(0, 0, w, h, 1, (int[]) null) : null;
        int[] px = new int[w * h];
        for (int i = 0; i < px.length; i++) {
            int v = to8Bit(gray[i], graySize);
            int a = alphas == null ? 255 : to8Bit(alphas[i], alphaSize);
            px[i] = (a << 24) | (v << 16) | (v << 8) | v;
        }
        BufferedImage out = new BufferedImage(w, h, alpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
        out.setRGB(0, 0, w, h, px, 0, w);
        return out;
    }

    private static int to8Bit(int sample, int bits) {
        if (bits == 8) {
            return sample;
        }
        if (bits > 8) {
            return sample >>> (bits - 8);
        }
        int max = (1 << bits) - 1;
        return sample * 255 / max;
    }
}
