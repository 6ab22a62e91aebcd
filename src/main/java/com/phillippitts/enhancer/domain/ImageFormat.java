package com.phillippitts.enhancer.domain;

import java.util.Locale;

/**
 * Encodings accepted as sources and produced as outputs.
 *
 * <p>{@code formatName} is the ImageIO writer/reader name; {@code extension} is the file
 * suffix written to the temp directory.
 */
public enum ImageFormat {
    JPEG("jpeg", "jpg", true, false),
    PNG("png", "png", false, true),
    WEBP("webp", "webp", true, true),
    BMP("bmp", "bmp", false, false),
    TIFF("tiff", "tiff", false, true);

    private final String formatName;
    private final String extension;
    private final boolean lossy;
    private final boolean supportsAlpha;

    ImageFormat(String formatName, String extension, boolean lossy, boolean supportsAlpha) {
        this.formatName = formatName;
        this.extension = extension;
        this.lossy = lossy;
        this.supportsAlpha = supportsAlpha;
    }

    public String formatName() {
        return formatName;
    }

    public String extension() {
        return extension;
    }

    public boolean isLossy() {
        return lossy;
    }

    public boolean supportsAlpha() {
        return supportsAlpha;
    }

    /**
     * Parses a format name or file extension ({@code jpg}, {@code JPEG}, {@code tif}, ...).
     *
     * @param value format name
     * @return matching format
     * @throws IllegalArgumentException if unsupported
     */
    public static ImageFormat parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Format must not be blank");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.startsWith(".")) {
            v = v.substring(1);
        }
        return switch (v) {
            case "jpeg", "jpg" -> JPEG;
            case "png" -> PNG;
            case "webp" -> WEBP;
            case "bmp" -> BMP;
            case "tiff", "tif" -> TIFF;
            default -> throw new IllegalArgumentException("Unsupported format: " + value);
        };
    }
}
