package com.phillippitts.enhancer.service.hook;

import com.phillippitts.enhancer.domain.EnhancementRequest;
import com.phillippitts.enhancer.domain.ProcessingResult;

/**
 * Callback around every enhancement call, invoked by {@link HookedEnhancementService}.
 * Hook failures are logged and never affect the result.
 */
public interface EnhancementHook {

    /** Called before processing starts. */
    default void before(EnhancementRequest request) {
    }

    /** Called with the outcome once processing ends, successful or not. */
    void after(EnhancementRequest request, ProcessingResult result);
}
