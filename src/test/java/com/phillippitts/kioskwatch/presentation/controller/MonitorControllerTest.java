package com.phillippitts.kioskwatch.presentation.controller;

import com.phillippitts.kioskwatch.domain.MonitorStatus;
import com.phillippitts.kioskwatch.exception.EmergencyRecoveryDisabledException;
import com.phillippitts.kioskwatch.service.orchestration.MonitorOrchestrator;
import com.phillippitts.kioskwatch.service.orchestration.MonitorStatusSnapshot;
import com.phillippitts.kioskwatch.service.orchestration.MonitoringStats;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(MonitorController.class)
class MonitorControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private MonitorOrchestrator orchestrator;

    @Test
    void shouldReturnStatusAsJson() throws Exception {
        MonitoringStats.Snapshot stats = new MonitoringStats.Snapshot(Instant.parse("2024-05-01T10:00:00Z"),
                4, 2, 1, 1, null, null, MonitorStatus.MONITORING);
        when(orchestrator.status()).thenReturn(new MonitorStatusSnapshot(true, stats, 120, 3, 42));

        mvc.perform(get("/api/monitor/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(true))
                .andExpect(jsonPath("$.stats.errors_detected").value(4))
                .andExpect(jsonPath("$.stats.current_status").value("monitoring"))
                .andExpect(jsonPath("$.log_buffer_size").value(42));
    }

    @Test
    void shouldReturnReport() throws Exception {
        when(orchestrator.generateReport()).thenReturn(new JSONObject().put("uptime_seconds", 7));

        mvc.perform(get("/api/monitor/report"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.uptime_seconds").value(7));
    }

    @Test
    void shouldTriggerEmergencyRecovery() throws Exception {
        when(orchestrator.emergencyRecovery()).thenReturn(CompletableFuture.completedFuture(true));

        MvcResult pending = mvc.perform(post("/api/monitor/recovery"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recovered").value(true));
    }

    @Test
    void shouldReturnConflictWhenRecoveryDisabled() throws Exception {
        when(orchestrator.emergencyRecovery()).thenThrow(new EmergencyRecoveryDisabledException());

        mvc.perform(post("/api/monitor/recovery"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("EmergencyRecoveryDisabledException"));
    }

    @Test
    void shouldReturnServiceUnavailableWhenLoopUnresponsive() throws Exception {
        when(orchestrator.status()).thenThrow(new IllegalStateException("Monitor loop did not respond"));

        mvc.perform(get("/api/monitor/status"))
                .andExpect(status().isServiceUnavailable());
    }
}
