package com.phillippitts.enhancer.service.fallback.event;

import com.phillippitts.enhancer.domain.Operation;

import java.time.Instant;

/** Published when no strategy tier succeeds. */
public record AllEnhancementStrategiesFailedEvent(Operation operation, String reason, Instant at) { }
