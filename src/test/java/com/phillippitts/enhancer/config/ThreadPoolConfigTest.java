package com.phillippitts.enhancer.config;

import com.phillippitts.enhancer.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdown();
        }
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateFixedPoolCappedAtMaxConcurrent() {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).enhancementExecutor();

        // Check against default property values
        assertThat(executor.getCorePoolSize()).isEqualTo(3);
        assertThat(executor.getMaxPoolSize()).isEqualTo(3);
        assertThat(executor.getThreadPoolExecutor().getQueue().remainingCapacity()).isEqualTo(20);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("enhance-pool-");
    }

    @Test
    void shouldNeverRunMoreThanMaxConcurrentTasks() throws InterruptedException {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getEnhance().setMaxConcurrent(2);
        executor = new ThreadPoolConfig(properties).enhancementExecutor();

        int taskCount = 10;
        CountDownLatch latch = new CountDownLatch(taskCount);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();

        for (int i = 0; i < taskCount; i++) {
            executor.execute(() -> {
                int now = running.incrementAndGet();
                peak.accumulateAndGet(now, Math::max);
                try {
                    Thread.sleep(20);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    running.decrementAndGet();
                    latch.countDown();
                }
            });
        }

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(peak.get()).isLessThanOrEqualTo(2);
    }

    @Test
    void shouldRejectWorkBeyondQueueCapacity() throws InterruptedException {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getEnhance().setMaxConcurrent(1);
        properties.getEnhance().setQueueCapacity(1);
        executor = new ThreadPoolConfig(properties).enhancementExecutor();

        CountDownLatch release = new CountDownLatch(1);
        Runnable blocker = () -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        executor.execute(blocker);
        executor.execute(blocker);

        assertThatThrownBy(() -> executor.execute(blocker)).isInstanceOf(TaskRejectedException.class);
        release.countDown();
    }

    @Test
    void shouldPropagateThreadContextToWorkers() throws InterruptedException {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).enhancementExecutor();
        ThreadContext.put("requestId", "req-7");
        AtomicReference<String> seen = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        executor.execute(() -> {
            seen.set(ThreadContext.get("requestId"));
            done.countDown();
        });

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("req-7");
    }
}
