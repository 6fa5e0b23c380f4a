package com.phillippitts.kioskwatch.config;

import com.phillippitts.kioskwatch.service.orchestration.MonitorOrchestrator;
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
 * Exposes executor metrics via Micrometer.
 *
 * <p>Device pool (the bulkhead in front of adb):
 * <ul>
 *   <li>kioskwatch.device.pool.active - threads running an adb call</li>
 *   <li>kioskwatch.device.pool.queued - device calls waiting for a thread</li>
 *   <li>kioskwatch.device.pool.saturation - active plus queued calls as a fraction of
 *       threads plus queue capacity; at 1.0 the next submission is rejected</li>
 * </ul>
 *
 * <p>Monitor loop:
 * <ul>
 *   <li>kioskwatch.monitor.loop.pending - scheduled and handed-back tasks waiting on the loop</li>
 *   <li>kioskwatch.remediation.in_flight - remediations running on the device pool</li>
 * </ul>
 *
 * <p>Also logs a summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> deviceExecutorProvider;
    private final ObjectProvider<MonitorOrchestrator> orchestratorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("deviceExecutor") ObjectProvider<ThreadPoolTaskExecutor> deviceExecutorProvider,
            ObjectProvider<MonitorOrchestrator> orchestratorProvider) {
        this.deviceExecutorProvider = deviceExecutorProvider;
        this.orchestratorProvider = orchestratorProvider;
    }

    @Bean
    public MeterBinder deviceExecutorMetrics() {
        return registry -> {
            ThreadPoolTaskExecutor taskExecutor = deviceExecutorProvider.getObject();
            ThreadPoolExecutor executor = taskExecutor.getThreadPoolExecutor();
            int capacity = taskExecutor.getMaxPoolSize() + taskExecutor.getQueueCapacity();

            Gauge.builder("kioskwatch.device.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads running a device call")
                    .register(registry);

            Gauge.builder("kioskwatch.device.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of device calls waiting in the queue")
                    .register(registry);

            Gauge.builder("kioskwatch.device.pool.saturation", executor,
                            e -> (e.getActiveCount() + e.getQueue().size()) / (double) capacity)
                    .description("Share of device pool threads and queue slots in use")
                    .register(registry);

            LOG.info("Device pool metrics registered: kioskwatch.device.pool.* available via /actuator/metrics");
        };
    }

    @Bean
    public MeterBinder monitorLoopMetrics() {
        return registry -> {
            MonitorOrchestrator orchestrator = orchestratorProvider.getIfAvailable();
            if (orchestrator == null) {
                return;
            }
            Gauge.builder("kioskwatch.monitor.loop.pending", orchestrator, MonitorOrchestrator::pendingLoopTasks)
                    .description("Tasks waiting on the monitor loop")
                    .register(registry);

            Gauge.builder("kioskwatch.remediation.in_flight", orchestrator, MonitorOrchestrator::fixesInFlight)
                    .description("Remediations dispatched and not yet recorded")
                    .register(registry);
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = deviceExecutorProvider.getObject().getThreadPoolExecutor();
        MonitorOrchestrator orchestrator = orchestratorProvider.getIfAvailable();
        LOG.info("Device pool health: active={}/{}, queued={}, completed={}; monitor loop pending={}, fixes in flight={}",
                executor.getActiveCount(),
                executor.getMaximumPoolSize(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount(),
                orchestrator == null ? 0 : orchestrator.pendingLoopTasks(),
                orchestrator == null ? 0 : orchestrator.fixesInFlight());
    }
}
