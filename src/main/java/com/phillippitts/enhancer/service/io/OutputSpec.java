package com.phillippitts.enhancer.service.io;

import com.phillippitts.enhancer.domain.ImageFormat;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Where and how one result is written.
 *
 * @param path        output file inside the shared temp directory
 * @param format      encoding
 * @param quality     0-100, only meaningful for lossy encodings
 * @param progressive request progressive/interlaced output where the writer supports it
 */
public record OutputSpec(Path path, ImageFormat format, int quality, boolean progressive) {

    public OutputSpec {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(format, "format");
        if (quality < 0 || quality > 100) {
            throw new IllegalArgumentException("Quality must be within 0-100, got: " + quality);
        }
    }

    public boolean isLossless() {
        return !format.isLossy();
    }
}
