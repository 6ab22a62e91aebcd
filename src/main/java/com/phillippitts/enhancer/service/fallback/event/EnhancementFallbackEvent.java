package com.phillippitts.enhancer.service.fallback.event;

import com.phillippitts.enhancer.domain.Operation;

import java.time.Instant;

/** Published when a strategy tier fails and the next tier is attempted. */
public record EnhancementFallbackEvent(Operation operation, String tier, String stage, String reason, Instant at) { }
