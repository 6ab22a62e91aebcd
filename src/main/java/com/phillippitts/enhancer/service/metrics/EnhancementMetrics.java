package com.phillippitts.enhancer.service.metrics;

import com.phillippitts.enhancer.domain.Operation;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for enhancement calls.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Latency per operation and method</li>
 *   <li>Success/failure counts per operation</li>
 *   <li>Fallback tier activations per operation and stage</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class EnhancementMetrics {

    private static final String METRIC_PREFIX = "enhancer.processing";

    private final MeterRegistry registry;

    public EnhancementMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records wall time of one call.
     *
     * @param operation  requested operation
     * @param method     algorithm that produced the output, or the last failed tier
     * @param durationMs duration in milliseconds
     */
    public void recordLatency(Operation operation, String method, long durationMs) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to enhance an image")
                .tag("operation", tag(operation))
                .tag("method", method == null ? "none" : method)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void incrementSuccess(Operation operation) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successful enhancements")
                .tag("operation", tag(operation))
                .register(registry)
                .increment();
    }

    /**
     * @param operation requested operation
     * @param stage     failing stage (decode, filter, encode, capacity, unclassified)
     */
    public void incrementFailure(Operation operation, String stage) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed enhancements")
                .tag("operation", tag(operation))
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    public void incrementFallback(Operation operation, String tier, String stage) {
        Counter.builder(METRIC_PREFIX + ".fallback")
                .description("Number of strategy tiers that failed and fell through")
                .tag("operation", tag(operation))
                .tag("tier", tier)
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    private static String tag(Operation operation) {
        return operation.name().toLowerCase(Locale.ROOT);
    }
}
