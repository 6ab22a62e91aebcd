package com.phillippitts.enhancer.service.fallback;

import com.phillippitts.enhancer.service.fallback.event.AllEnhancementStrategiesFailedEvent;
import com.phillippitts.enhancer.service.fallback.event.EnhancementFallbackEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/** Logs fallback events succinctly, throttled per operation and stage. */
@Component
class EnhancementEventsListener {
    private static final Logger LOG = LogManager.getLogger(EnhancementEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();

    @EventListener
    void onFallback(EnhancementFallbackEvent e) {
        if (shouldLog("fallback-" + e.operation() + '-' + e.stage())) {
            LOG.warn("Enhancement fallback: operation={}, tier={}, stage={}, reason={}",
                    e.operation(), e.tier(), e.stage(), e.reason());
        }
    }

    @EventListener
    void onAllFailed(AllEnhancementStrategiesFailedEvent e) {
        if (shouldLog("all-failed-" + e.operation())) {
            LOG.warn("All enhancement strategies failed: operation={}, reason={}", e.operation(), e.reason());
        }
    }

    // Package-private for tests. Check and update happen in one compute, so concurrent
    // workers cannot both win the same window.
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        AtomicBoolean granted = new AtomicBoolean();
        lastLog.compute(key, (k, prev) -> {
            if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
                granted.set(true);
                return now;
            }
            return prev;
        });
        return granted.get();
    }
}
