package com.phillippitts.enhancer.domain;

import java.util.Locale;

/**
 * Custom upscale choice as offered to users: an explicit factor ({@code 2x}, {@code 3x},
 * {@code 4x}, {@code 8x}) in standard mode, or a named mode with its default factor.
 *
 * @param scaleFactor resolved factor
 * @param mode        resolved mode
 */
public record UpscaleOption(int scaleFactor, UpscaleMode mode) {

    private static final UpscaleOption DEFAULT = new UpscaleOption(2, UpscaleMode.STANDARD);

    /**
     * Resolves an option token. Unknown tokens fall back to 2x standard.
     *
     * @param token option such as {@code "4x"}, {@code "smart"} or {@code "max"}
     * @return resolved option
     */
    public static UpscaleOption parse(String token) {
        if (token == null) {
            return DEFAULT;
        }
        String t = token.trim().toLowerCase(Locale.ROOT);
        switch (t) {
            case "2x", "3x", "4x", "8x":
                return new UpscaleOption(Integer.parseInt(t.substring(0, t.length() - 1)), UpscaleMode.STANDARD);
            case "smart":
                return new UpscaleOption(UpscaleMode.SMART.defaultScaleFactor(), UpscaleMode.SMART);
            case "max":
                return new UpscaleOption(UpscaleMode.MAX.defaultScaleFactor(), UpscaleMode.MAX);
            default:
                return DEFAULT;
        }
    }
}
