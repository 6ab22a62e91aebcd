package com.phillippitts.enhancer.service.fallback;

import com.phillippitts.enhancer.domain.EnhancementRequest;
import com.phillippitts.enhancer.service.pipeline.EnhancementPipeline;
import com.phillippitts.enhancer.service.pipeline.PathTransforms;
import com.phillippitts.enhancer.service.pipeline.PipelineOutput;
import org.springframework.stereotype.Component;

/** First tier: the path chosen by the strategy selector. */
@Component
class PreferredEnhancementStrategy implements EnhancementStrategy {

    static final String NAME = "preferred";

    private final EnhancementPipeline pipeline;
    private final PathTransforms transforms;

    PreferredEnhancementStrategy(EnhancementPipeline pipeline, PathTransforms transforms) {
        this.pipeline = pipeline;
        this.transforms = transforms;
    }

    @Override
    public boolean canHandle(EnhancementRequest request) {
        return true;
    }

    @Override
    public PipelineOutput enhance(EnhancementRequest request) {
        return pipeline.execute(request, transforms::preferred);
    }

    @Override
    public String name() {
        return NAME;
    }
}
