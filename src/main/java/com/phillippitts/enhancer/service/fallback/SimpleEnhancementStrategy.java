package com.phillippitts.enhancer.service.fallback;

import com.phillippitts.enhancer.domain.EnhancementRequest;
import com.phillippitts.enhancer.service.pipeline.EnhancementPipeline;
import com.phillippitts.enhancer.service.pipeline.PathTransforms;
import com.phillippitts.enhancer.service.pipeline.PipelineOutput;
import org.springframework.stereotype.Component;

/** Last tier: direct resize plus mild sharpen, nothing that can fail on layout or scale. */
@Component
class SimpleEnhancementStrategy implements EnhancementStrategy {

    static final String NAME = "simple";

    private final EnhancementPipeline pipeline;
    private final PathTransforms transforms;

    SimpleEnhancementStrategy(EnhancementPipeline pipeline, PathTransforms transforms) {
        this.pipeline = pipeline;
        this.transforms = transforms;
    }

    @Override
    public boolean canHandle(EnhancementRequest request) {
        return true;
    }

    @Override
    public PipelineOutput enhance(EnhancementRequest request) {
        return pipeline.execute(request, transforms::simple);
    }

    @Override
    public String name() {
        return NAME;
    }
}
