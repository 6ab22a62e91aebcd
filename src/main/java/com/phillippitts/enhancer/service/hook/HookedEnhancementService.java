package com.phillippitts.enhancer.service.hook;

import com.phillippitts.enhancer.domain.EnhancementRequest;
import com.phillippitts.enhancer.domain.ProcessingResult;
import com.phillippitts.enhancer.service.fallback.EnhancementService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Decorates the core service with {@link EnhancementHook} callbacks (activity log, metrics).
 * This is the {@link EnhancementService} the rest of the application receives.
 */
@Service
@Primary
public class HookedEnhancementService implements EnhancementService {

    private static final Logger LOG = LogManager.getLogger(HookedEnhancementService.class);

    private final EnhancementService delegate;
    private final List<EnhancementHook> hooks;

    public HookedEnhancementService(@Qualifier("strategyChainEnhancementService") EnhancementService delegate,
                                    List<EnhancementHook> hooks) {
        this.delegate = Objects.requireNonNull(delegate);
        this.hooks = List.copyOf(hooks);
    }

    @Override
    public ProcessingResult enhance(EnhancementRequest request) {
        for (EnhancementHook hook : hooks) {
            try {
                hook.before(request);
            } catch (RuntimeException e) {
                LOG.warn("Hook {} failed before {}: {}", hook.getClass().getSimpleName(),
                        request.operation(), e.toString());
            }
        }
        ProcessingResult result = delegate.enhance(request);
        for (EnhancementHook hook : hooks) {
            try {
                hook.after(request, result);
            } catch (RuntimeException e) {
                LOG.warn("Hook {} failed after {}: {}", hook.getClass().getSimpleName(),
                        request.operation(), e.toString());
            }
        }
        return result;
    }
}
