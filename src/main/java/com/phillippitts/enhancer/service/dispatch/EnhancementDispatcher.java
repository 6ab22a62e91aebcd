package com.phillippitts.enhancer.service.dispatch;

import com.phillippitts.enhancer.domain.EnhancementRequest;
import com.phillippitts.enhancer.domain.ProcessingResult;
import com.phillippitts.enhancer.service.fallback.EnhancementService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs enhancement calls on the bounded {@code enhancementExecutor} so request-handling
 * threads never do pixel work.
 *
 * <p>At most {@code threadpool.enhance.max-concurrent} calls run at once and at most
 * {@code queue-capacity} wait. A request beyond that completes immediately with a failed
 * result whose reason starts with {@value #CAPACITY}. Calls are not cancellable once started.
 */
@Service
public class EnhancementDispatcher {

    private static final Logger LOG = LogManager.getLogger(EnhancementDispatcher.class);

    public static final String CAPACITY = "capacity";
    static final String MDC_OPERATION = "operation";

    private final EnhancementService service;
    private final Executor executor;

    public EnhancementDispatcher(EnhancementService service,
                                 @Qualifier("enhancementExecutor") Executor executor) {
        this.service = Objects.requireNonNull(service);
        this.executor = Objects.requireNonNull(executor);
    }

    /**
     * Submits a request to the worker pool.
     *
     * @param request enhancement request
     * @return future completing with the result; never completes exceptionally
     */
    public CompletableFuture<ProcessingResult> submit(EnhancementRequest request) {
        Objects.requireNonNull(request, "request");
        String previousOperation = ThreadContext.get(MDC_OPERATION);
        ThreadContext.put(MDC_OPERATION, request.operation().name());
        try {
            return CompletableFuture
                    .supplyAsync(() -> service.enhance(request), executor)
                    .exceptionally(ex -> {
                        LOG.error("Enhancement worker failed unexpectedly for {}", request.operation(), ex);
                        return ProcessingResult.failure(request.operation(), "dispatcher",
                                "unclassified: " + ex.getClass().getSimpleName(), 0L);
                    });
        } catch (RejectedExecutionException e) {
            LOG.warn("Rejected {} for {}: worker pool and queue are full", request.operation(),
                    request.source().getFileName());
            return CompletableFuture.completedFuture(ProcessingResult.failure(request.operation(), "dispatcher",
                    CAPACITY + ": too many concurrent enhancements, try again later", 0L));
        } finally {
            if (previousOperation == null) {
                ThreadContext.remove(MDC_OPERATION);
            } else {
                ThreadContext.put(MDC_OPERATION, previousOperation);
            }
        }
    }

    /**
     * Submits and waits for the result on the calling thread.
     */
    public ProcessingResult submitAndWait(EnhancementRequest request) {
        return submit(request).join();
    }
}
