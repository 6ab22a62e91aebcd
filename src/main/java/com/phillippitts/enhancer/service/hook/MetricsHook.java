package com.phillippitts.enhancer.service.hook;

import com.phillippitts.enhancer.domain.EnhancementRequest;
import com.phillippitts.enhancer.domain.ProcessingResult;
import com.phillippitts.enhancer.service.fallback.event.EnhancementFallbackEvent;
import com.phillippitts.enhancer.service.metrics.EnhancementMetrics;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Records latency, outcome and fallback counters for every call. */
@Component
public class MetricsHook implements EnhancementHook {

    private final EnhancementMetrics metrics;

    public MetricsHook(EnhancementMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public void after(EnhancementRequest request, ProcessingResult result) {
        metrics.recordLatency(request.operation(), result.strategy(), result.durationMs());
        if (result.isSuccess()) {
            metrics.incrementSuccess(request.operation());
        } else {
            metrics.incrementFailure(request.operation(), stageOf(result.failureReason()));
        }
    }

    @EventListener
    void onFallback(EnhancementFallbackEvent e) {
        metrics.incrementFallback(e.operation(), e.tier(), e.stage());
    }

    /** Leading {@code stage:} token of a failure reason. */
    static String stageOf(String reason) {
        if (reason == null) {
            return "unclassified";
        }
        int colon = reason.indexOf(':');
        return colon > 0 ? reason.substring(0, colon).trim() : "unclassified";
    }
}
