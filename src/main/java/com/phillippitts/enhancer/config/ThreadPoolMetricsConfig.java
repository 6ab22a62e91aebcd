package com.phillippitts.enhancer.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the enhancement worker pool through Micrometer.
 *
 * <ul>
 *   <li>enhance.pool.active - transforms currently running</li>
 *   <li>enhance.pool.queued - requests waiting for a worker</li>
 *   <li>enhance.pool.completed - cumulative completed transforms</li>
 *   <li>enhance.pool.max.size - concurrency cap</li>
 * </ul>
 *
 * <p>Also logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> executorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("enhancementExecutor") ObjectProvider<ThreadPoolTaskExecutor> executorProvider) {
        this.executorProvider = executorProvider;
    }

    @Bean
    public MeterBinder enhancementExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = executorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("enhance.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of enhancement transforms running")
                    .register(registry);

            Gauge.builder("enhance.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of enhancement requests waiting in the queue")
                    .register(registry);

            Gauge.builder("enhance.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed enhancement tasks")
                    .register(registry);

            Gauge.builder("enhance.pool.max.size", executor, ThreadPoolExecutor::getMaximumPoolSize)
                    .description("Maximum concurrent enhancement transforms")
                    .register(registry);

            LOG.info("Enhancement pool metrics registered: enhance.pool.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = executorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Enhancement Pool Health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
