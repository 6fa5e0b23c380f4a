package com.phillippitts.kioskwatch.presentation.controller;

import com.phillippitts.kioskwatch.service.orchestration.MonitorOrchestrator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Read-only views of the monitor plus a manual emergency recovery trigger.
 */
@RestController
@RequestMapping("/api/monitor")
class MonitorController {

    private static final Logger LOG = LogManager.getLogger(MonitorController.class);

    private final MonitorOrchestrator orchestrator;

    MonitorController(MonitorOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping(value = "/status", produces = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<String> status() {
        return ResponseEntity.ok(orchestrator.status().toJson().toString());
    }

    @GetMapping(value = "/report", produces = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<String> report() {
        return ResponseEntity.ok(orchestrator.generateReport().toString());
    }

    @PostMapping("/recovery")
    CompletableFuture<ResponseEntity<Map<String, Object>>> recovery() {
        LOG.warn("Emergency recovery requested via REST");
        return orchestrator.emergencyRecovery()
                .thenApply(recovered -> ResponseEntity.ok(Map.<String, Object>of(
                        "recovered", recovered,
                        "timestamp", Instant.now().toString()
                )));
    }
}
