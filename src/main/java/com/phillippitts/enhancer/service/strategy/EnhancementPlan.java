package com.phillippitts.enhancer.service.strategy;

import com.phillippitts.enhancer.domain.TargetSpec;

import java.util.Objects;

/**
 * Selected path plus the dimensions it must produce.
 *
 * @param path     algorithm path
 * @param target   exact output dimensions, or null when the source size is kept
 * @param maxScale {@code max(tw/w, th/h)}, 1.0 when there is no target
 */
public record EnhancementPlan(EnhancementPath path, TargetSpec target, double maxScale) {

    public EnhancementPlan {
        Objects.requireNonNull(path, "path");
    }

    public boolean resizes() {
        return target != null;
    }
}
