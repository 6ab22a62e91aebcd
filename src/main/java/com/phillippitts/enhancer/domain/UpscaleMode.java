package com.phillippitts.enhancer.domain;

import java.util.Locale;

/** Quality tier for custom upscaling. */
public enum UpscaleMode {
    /** Single high-quality resample, no filtering. */
    STANDARD(2),
    /** Progressive resampling for large factors, mild sharpening. */
    SMART(2),
    /** Denoise, bicubic resample and unsharp mask. */
    MAX(4);

    private final int defaultScaleFactor;

    UpscaleMode(int defaultScaleFactor) {
        this.defaultScaleFactor = defaultScaleFactor;
    }

    /** Scale factor used when the caller names only the mode. */
    public int defaultScaleFactor() {
        return defaultScaleFactor;
    }

    /**
     * Lenient parse; unknown or missing values map to {@link #STANDARD}.
     *
     * @param value mode name, may be null
     * @return parsed mode
     */
    public static UpscaleMode parse(String value) {
        if (value == null) {
            return STANDARD;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "smart" -> SMART;
            case "max" -> MAX;
            default -> STANDARD;
        };
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
