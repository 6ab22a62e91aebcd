package com.phillippitts.enhancer.service.health;

import com.phillippitts.enhancer.config.properties.EnhancerProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Health indicator for the enhancement service.
 *
 * <p>Reports DOWN when the shared temp directory is missing or not writable. Worker pool
 * usage is reported as details; a saturated pool (all workers busy, queue full) is still UP
 * but flagged, since new requests will be rejected until work drains.
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class EnhancerHealthIndicator implements HealthIndicator {

    private final Path tempDir;
    private final ThreadPoolTaskExecutor executor;

    public EnhancerHealthIndicator(EnhancerProperties properties,
                                   @Qualifier("enhancementExecutor") ThreadPoolTaskExecutor executor) {
        this.tempDir = properties.getTempDir();
        this.executor = executor;
    }

    @Override
    public Health health() {
        boolean dirOk = Files.isDirectory(tempDir) && Files.isWritable(tempDir);
        ThreadPoolExecutor pool = executor.getThreadPoolExecutor();
        int active = pool.getActiveCount();
        int max = pool.getMaximumPoolSize();
        int queued = pool.getQueue().size();
        int remaining = pool.getQueue().remainingCapacity();
        boolean saturated = active >= max && remaining == 0;

        Health.Builder builder = dirOk ? Health.up() : Health.down();
        return builder
                .withDetail("tempDir", formatStatus(dirOk, tempDir))
                .withDetail("activeWorkers", active)
                .withDetail("maxConcurrent", max)
                .withDetail("queued", queued)
                .withDetail("saturated", saturated)
                .build();
    }

    private static String formatStatus(boolean ok, Path path) {
        if (ok) {
            return "writable at " + path;
        }
        return "NOT WRITABLE at " + path;
    }
}
