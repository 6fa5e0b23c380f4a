package com.phillippitts.kioskwatch.service.orchestration;

import com.phillippitts.kioskwatch.domain.MonitorStatus;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MonitorStateMachineTest {

    @Test
    void shouldStartInInitializing() {
        MonitorStateMachine machine = new MonitorStateMachine();

        assertThat(machine.current()).isEqualTo(MonitorStatus.INITIALIZING);
        assertThat(machine.isShuttingDown()).isFalse();
    }

    @Test
    void shouldOnlyMoveForward() {
        MonitorStateMachine machine = new MonitorStateMachine();

        assertThat(machine.advanceTo(MonitorStatus.MONITORING)).isTrue();
        assertThat(machine.advanceTo(MonitorStatus.STARTING)).isFalse();
        assertThat(machine.advanceTo(MonitorStatus.MONITORING)).isFalse();

        assertThat(machine.current()).isEqualTo(MonitorStatus.MONITORING);
    }

    @Test
    void shouldTransitionOnlyFromExpectedState() {
        MonitorStateMachine machine = new MonitorStateMachine();

        assertThat(machine.transition(MonitorStatus.STARTING, MonitorStatus.MONITORING)).isFalse();
        assertThat(machine.transition(MonitorStatus.INITIALIZING, MonitorStatus.STARTING)).isTrue();
        assertThat(machine.transition(MonitorStatus.INITIALIZING, MonitorStatus.STARTING)).isFalse();

        assertThat(machine.is(MonitorStatus.STARTING)).isTrue();
    }

    @Test
    void shouldReportShuttingDownFromStopping() {
        MonitorStateMachine machine = new MonitorStateMachine();

        machine.advanceTo(MonitorStatus.STOPPING);

        assertThat(machine.isShuttingDown()).isTrue();
        assertThat(machine.transition(MonitorStatus.STOPPING, MonitorStatus.MONITORING)).isFalse();
    }

    @Test
    void shouldRejectNullTarget() {
        assertThatThrownBy(() -> new MonitorStateMachine().advanceTo(null))
                .isInstanceOf(NullPointerException.class);
    }
}
