package com.phillippitts.enhancer.service.fallback;

import com.phillippitts.enhancer.domain.EnhancementRequest;
import com.phillippitts.enhancer.service.pipeline.PipelineOutput;

/** One tier of the fallback chain. */
interface EnhancementStrategy {
    /** @return true if this tier can attempt the request */
    boolean canHandle(EnhancementRequest request);

    /** Runs the tier; throws on any failure. */
    PipelineOutput enhance(EnhancementRequest request);

    /** Name for logs/metrics. */
    String name();
}
