package com.phillippitts.kioskwatch.service.health;

import com.phillippitts.kioskwatch.domain.MonitorStatus;
import com.phillippitts.kioskwatch.service.orchestration.MonitorOrchestrator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the kiosk monitor.
 *
 * <ul>
 *   <li>UP: monitoring</li>
 *   <li>OUT_OF_SERVICE: starting or stopping</li>
 *   <li>DOWN: not started or stopped</li>
 * </ul>
 *
 * <p>Exposed as {@code monitor} via /actuator/health.
 */
@Component("monitor")
public class MonitorHealthIndicator implements HealthIndicator {

    private final MonitorOrchestrator orchestrator;

    public MonitorHealthIndicator(MonitorOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public Health health() {
        MonitorStatus status = orchestrator.currentStatus();
        Health.Builder builder = switch (status) {
            case MONITORING -> Health.up();
            case STARTING, STOPPING -> Health.outOfService();
            case INITIALIZING, STOPPED -> Health.down();
        };
        return builder.withDetail("status", status.tag()).build();
    }
}
