package com.phillippitts.enhancer.service.fallback;

import com.phillippitts.enhancer.domain.EnhancementRequest;
import com.phillippitts.enhancer.domain.ProcessingResult;
import com.phillippitts.enhancer.exception.ImageEnhancerException;
import com.phillippitts.enhancer.service.fallback.event.AllEnhancementStrategiesFailedEvent;
import com.phillippitts.enhancer.service.fallback.event.EnhancementFallbackEvent;
import com.phillippitts.enhancer.service.pipeline.PipelineOutput;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Tries strategies in order until one succeeds: preferred path first, then the simple
 * direct resize. Never throws; every call ends in a {@link ProcessingResult}, including a tier
 * that exhausts the heap.
 */
@Service
public class StrategyChainEnhancementService implements EnhancementService {
    private static final Logger LOG = LogManager.getLogger(StrategyChainEnhancementService.class);

    static final String UNCLASSIFIED = "unclassified";
    static final String MEMORY = "memory";

    private final List<EnhancementStrategy> chain;
    private final ApplicationEventPublisher publisher;

    StrategyChainEnhancementService(List<EnhancementStrategy> strategies, ApplicationEventPublisher publisher) {
        this.publisher = Objects.requireNonNull(publisher);
        // Order strategies: preferred -> simple -> anything else
        List<EnhancementStrategy> ordered = new ArrayList<>();
        List<EnhancementStrategy> others = new ArrayList<>();
        EnhancementStrategy simple = null;
        for (EnhancementStrategy s : strategies) {
            if (PreferredEnhancementStrategy.NAME.equalsIgnoreCase(s.name())) {
                ordered.add(s);
            } else if (SimpleEnhancementStrategy.NAME.equalsIgnoreCase(s.name())) {
                simple = s;
            } else {
                others.add(s);
            }
        }
        if (simple != null) {
            ordered.add(simple);
        }
        ordered.addAll(others);
        this.chain = List.copyOf(ordered);
    }

    @Override
    public ProcessingResult enhance(EnhancementRequest request) {
        Objects.requireNonNull(request, "request");
        long start = System.nanoTime();
        String lastTier = "none";
        String lastReason = "no strategy available";
        for (EnhancementStrategy s : chain) {
            if (!s.canHandle(request)) {
                LOG.debug("Skipping strategy {}: cannot handle {}", s.name(), request.operation());
                continue;
            }
            lastTier = s.name();
            try {
                PipelineOutput out = s.enhance(request);
                long ms = elapsedMs(start);
                LOG.info("{} via {} ({}) -> {} in {} ms", request.operation(), s.name(), out.method(),
                        out.path().getFileName(), ms);
                return ProcessingResult.success(request.operation(), out.path(), out.method(), ms);
            } catch (ImageEnhancerException e) {
                lastReason = e.stage() + ": " + e.getMessage();
                LOG.warn("Strategy {} failed for {} at stage {}: {}", s.name(), request.operation(),
                        e.stage(), e.getMessage());
                publisher.publishEvent(new EnhancementFallbackEvent(request.operation(), s.name(), e.stage(),
                        e.getClass().getSimpleName(), Instant.now()));
            } catch (Exception e) {
                lastReason = UNCLASSIFIED + ": " + e;
                LOG.warn("Strategy {} failed for {} (unclassified)", s.name(), request.operation(), e);
                publisher.publishEvent(new EnhancementFallbackEvent(request.operation(), s.name(), UNCLASSIFIED,
                        e.getClass().getSimpleName(), Instant.now()));
            } catch (OutOfMemoryError e) {
                // Work buffers of the failed tier are unreachable once we get here
                lastReason = MEMORY + ": " + e.getMessage();
                LOG.error("Strategy {} ran out of memory for {} (source={})", s.name(), request.operation(),
                        request.source().getFileName());
                publisher.publishEvent(new EnhancementFallbackEvent(request.operation(), s.name(), MEMORY,
                        e.getClass().getSimpleName(), Instant.now()));
            }
        }
        LOG.error("No enhancement strategy succeeded for {} (source={})", request.operation(),
                request.source().getFileName());
        publisher.publishEvent(new AllEnhancementStrategiesFailedEvent(request.operation(), lastReason, Instant.now()));
        return ProcessingResult.failure(request.operation(), lastTier, lastReason, elapsedMs(start));
    }

    List<String> strategyNames() {
        return chain.stream().map(EnhancementStrategy::name).toList();
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
