package com.phillippitts.enhancer.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the enhancement worker pool.
 *
 * <p>{@code max-concurrent} is the hard cap on transforms running at once; the pool never
 * grows beyond it. Requests beyond {@code max-concurrent + queue-capacity} are rejected
 * and reported to the caller as a failed result.
 */
@Validated
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    @Valid
    private EnhancePoolProperties enhance = new EnhancePoolProperties();

    public EnhancePoolProperties getEnhance() {
        return enhance;
    }

    public void setEnhance(EnhancePoolProperties enhance) {
        this.enhance = enhance;
    }

    /**
     * Enhancement executor pool configuration.
     */
    public static class EnhancePoolProperties {
        @Positive(message = "Max concurrent transforms must be positive")
        private int maxConcurrent = 3;

        @Min(value = 0, message = "Queue capacity must not be negative")
        private int queueCapacity = 20;

        @Positive
        private int keepAliveSeconds = 60;

        @NotBlank
        private String threadNamePrefix = "enhance-pool-";

        public int getMaxConcurrent() {
            return maxConcurrent;
        }

        public void setMaxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
