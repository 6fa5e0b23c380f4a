package com.phillippitts.kioskwatch.service.health;

import com.phillippitts.kioskwatch.domain.MonitorStatus;
import com.phillippitts.kioskwatch.service.orchestration.MonitorOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MonitorHealthIndicatorTest {

    private static Health healthFor(MonitorStatus status) {
        MonitorOrchestrator orchestrator = mock(MonitorOrchestrator.class);
        when(orchestrator.currentStatus()).thenReturn(status);
        return new MonitorHealthIndicator(orchestrator).health();
    }

    @Test
    void shouldReportUpWhileMonitoring() {
        Health health = healthFor(MonitorStatus.MONITORING);

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("status", "monitoring");
    }

    @Test
    void shouldReportOutOfServiceWhileStartingOrStopping() {
        assertThat(healthFor(MonitorStatus.STARTING).getStatus()).isEqualTo(Status.OUT_OF_SERVICE);
        assertThat(healthFor(MonitorStatus.STOPPING).getStatus()).isEqualTo(Status.OUT_OF_SERVICE);
    }

    @Test
    void shouldReportDownWhenNotMonitoring() {
        Health health = healthFor(MonitorStatus.STOPPED);

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("status", "stopped");
        assertThat(healthFor(MonitorStatus.INITIALIZING).getStatus()).isEqualTo(Status.DOWN);
    }
}
