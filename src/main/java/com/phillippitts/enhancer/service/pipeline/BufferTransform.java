package com.phillippitts.enhancer.service.pipeline;

import com.phillippitts.enhancer.domain.EnhancementRequest;
import com.phillippitts.enhancer.domain.RasterBuffer;

/** Pixel stage of the pipeline: working-layout buffer in, transformed buffer out. */
@FunctionalInterface
public interface BufferTransform {

    Transformed apply(RasterBuffer working, EnhancementRequest request);
}
