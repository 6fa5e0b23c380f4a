package com.phillippitts.kioskwatch.config;

import com.phillippitts.kioskwatch.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
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
    void shouldCreateExecutorWithCorrectConfiguration() {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).deviceExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(3);
        assertThat(executor.getMaxPoolSize()).isEqualTo(3);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("device-pool-");
        assertThat(executor.getThreadPoolExecutor().getRejectedExecutionHandler())
                .isInstanceOf(ThreadPoolExecutor.AbortPolicy.class);
    }

    @Test
    void shouldPropagateThreadContextToWorker() throws InterruptedException {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).deviceExecutor();
        AtomicReference<String> seen = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        ThreadContext.put("activity", "health");
        executor.execute(() -> {
            seen.set(ThreadContext.get("activity"));
            done.countDown();
        });

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("health");
    }

    @Test
    void shouldRestoreWorkerContextAfterTask() {
        ThreadContext.put("activity", "stream");
        Runnable decorated = ThreadPoolConfig.mdcPropagatingDecorator().decorate(() -> { });

        ThreadContext.clearAll();
        ThreadContext.put("errorKind", "anr");
        decorated.run();

        assertThat(ThreadContext.get("activity")).isNull();
        assertThat(ThreadContext.get("errorKind")).isEqualTo("anr");
    }

    @Test
    void shouldRejectWhenPoolAndQueueAreFull() throws InterruptedException {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getDevice().setCorePoolSize(1);
        properties.getDevice().setMaxPoolSize(1);
        properties.getDevice().setQueueCapacity(1);
        executor = new ThreadPoolConfig(properties).deviceExecutor();
        CountDownLatch release = new CountDownLatch(1);
        Runnable blocking = () -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };

        executor.execute(blocking);
        executor.execute(blocking);

        try {
            assertThatThrownBy(() -> executor.execute(blocking))
                    .isInstanceOf(RejectedExecutionException.class);
        } finally {
            release.countDown();
        }
    }
}
