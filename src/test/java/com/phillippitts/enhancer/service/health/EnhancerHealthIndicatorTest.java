package com.phillippitts.enhancer.service.health;

import com.phillippitts.enhancer.config.ThreadPoolConfig;
import com.phillippitts.enhancer.config.properties.EnhancerProperties;
import com.phillippitts.enhancer.config.properties.ThreadPoolProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class EnhancerHealthIndicatorTest {

    @TempDir
    Path tempDir;

    private ThreadPoolTaskExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).enhancementExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void shouldReportUpWhenTempDirWritable() {
        EnhancerHealthIndicator indicator =
                new EnhancerHealthIndicator(EnhancerProperties.withTempDir(tempDir), executor);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails().get("tempDir")).asString().startsWith("writable at");
        assertThat(health.getDetails()).containsEntry("maxConcurrent", 3);
        assertThat(health.getDetails()).containsEntry("activeWorkers", 0);
        assertThat(health.getDetails()).containsEntry("saturated", false);
    }

    @Test
    void shouldReportDownWhenTempDirMissing() {
        EnhancerHealthIndicator indicator =
                new EnhancerHealthIndicator(EnhancerProperties.withTempDir(tempDir.resolve("missing")), executor);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails().get("tempDir")).asString().contains("NOT WRITABLE");
    }
}
