package com.phillippitts.enhancer.util;

import java.util.Locale;

/**
 * Formats byte counts for result summaries: {@code 512.0 B}, {@code 1.5 KB}, {@code 20.0 MB}.
 */
public final class FileSizeFormatter {

    private static final String[] UNITS = {"B", "KB", "MB", "GB"};

    private FileSizeFormatter() {
        // utility
    }

    /**
     * @param bytes size in bytes, not negative
     * @return size with one decimal and a binary unit
     */
    public static String format(long bytes) {
        if (bytes < 0) {
            throw new IllegalArgumentException("Size must not be negative: " + bytes);
        }
        double size = bytes;
        for (String unit : UNITS) {
            if (size < 1024.0) {
                return String.format(Locale.ROOT, "%.1f %s", size, unit);
            }
            size /= 1024.0;
        }
        return String.format(Locale.ROOT, "%.1f TB", size);
    }
}
