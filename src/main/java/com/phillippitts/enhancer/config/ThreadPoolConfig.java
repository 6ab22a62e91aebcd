package com.phillippitts.enhancer.config;

import com.phillippitts.enhancer.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.task.TaskDecorator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the enhancement worker pool.
 *
 * <p>Pixel work is CPU-bound, so the pool is fixed at {@code threadpool.enhance.max-concurrent}
 * threads; that value is the hard cap on transforms in flight. Work beyond the bounded queue
 * is rejected ({@link ThreadPoolExecutor.AbortPolicy}) and surfaced by the dispatcher as a
 * failed result instead of running on the caller's thread.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the bounded executor that runs enhancement calls.
     *
     * <p>Pool sizing configured via {@code threadpool.enhance.*} properties:
     * <ul>
     *   <li>Core and max pool: {@code max-concurrent}, default 3</li>
     *   <li>Queue: default 20 waiting requests</li>
     * </ul>
     *
     * <p>MDC propagation: copies Log4j2 ThreadContext from the submitting thread so the
     * request id and operation appear in worker logs.
     *
     * @return configured executor for enhancement work
     */
    @Bean(name = "enhancementExecutor")
    public ThreadPoolTaskExecutor enhancementExecutor() {
        ThreadPoolProperties.EnhancePoolProperties props = threadPoolProperties.getEnhance();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getMaxConcurrent());
        executor.setMaxPoolSize(props.getMaxConcurrent());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());

        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
