package com.phillippitts.enhancer.service.pipeline;

import com.phillippitts.enhancer.domain.RasterBuffer;

import java.util.Objects;

/**
 * Result of a pixel transform.
 *
 * @param buffer transformed buffer
 * @param method name of the algorithm that produced it, reported in the processing result
 */
public record Transformed(RasterBuffer buffer, String method) {

    public Transformed {
        Objects.requireNonNull(buffer, "buffer");
        Objects.requireNonNull(method, "method");
    }
}
