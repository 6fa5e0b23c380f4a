package com.phillippitts.kioskwatch.config;

import com.phillippitts.kioskwatch.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool for blocking device calls.
 *
 * <p>Every adb invocation (probes, remediation scripts, connect/disconnect) runs on
 * {@code deviceExecutor}. The monitor loop never calls the device directly; it hands the call
 * to this pool and continues when the returned future completes.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the bounded device pool (the bulkhead in front of the device link).
     *
     * <p>Pool sizing via {@code threadpool.device.*}:
     * <ul>
     *   <li>Core and max pool: default 3, fixed size</li>
     *   <li>Queue: default 50 tasks</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. Submissions come from the
     * single monitor loop thread, which must never run a blocking adb call itself, so a full
     * queue fails the submitting stage instead of falling back to the caller.
     *
     * <p>MDC propagation: copies the Log4j2 ThreadContext ({@code activity}, {@code errorKind})
     * from the submitting thread to the worker.
     *
     * @return configured executor for device calls
     */
    @Bean(name = "deviceExecutor")
    public ThreadPoolTaskExecutor deviceExecutor() {
        ThreadPoolProperties.DevicePoolProperties deviceProps = threadPoolProperties.getDevice();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(deviceProps.getCorePoolSize());
        executor.setMaxPoolSize(deviceProps.getMaxPoolSize());
        executor.setQueueCapacity(deviceProps.getQueueCapacity());
        executor.setThreadNamePrefix(deviceProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(deviceProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(deviceProps.getAwaitTerminationSeconds());
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Decorator that runs the task with the submitter's ThreadContext and restores the
     * worker's own context afterwards.
     */
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
