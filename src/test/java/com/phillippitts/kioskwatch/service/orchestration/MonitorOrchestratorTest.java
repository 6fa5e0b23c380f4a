package com.phillippitts.kioskwatch.service.orchestration;

import com.phillippitts.kioskwatch.config.properties.DeviceProperties;
import com.phillippitts.kioskwatch.config.properties.MonitorProperties;
import com.phillippitts.kioskwatch.config.properties.RemediationProperties;
import com.phillippitts.kioskwatch.config.properties.UiMonitoringProperties;
import com.phillippitts.kioskwatch.domain.DetectedError;
import com.phillippitts.kioskwatch.domain.DeviceInfo;
import com.phillippitts.kioskwatch.domain.ErrorKind;
import com.phillippitts.kioskwatch.domain.MonitorStatus;
import com.phillippitts.kioskwatch.domain.RemediationOutcome;
import com.phillippitts.kioskwatch.domain.RemediationResult;
import com.phillippitts.kioskwatch.domain.Severity;
import com.phillippitts.kioskwatch.exception.EmergencyRecoveryDisabledException;
import com.phillippitts.kioskwatch.exception.MonitorStartupException;
import com.phillippitts.kioskwatch.service.detect.ErrorClassifier;
import com.phillippitts.kioskwatch.service.metrics.RemediationMetrics;
import com.phillippitts.kioskwatch.service.remediate.Remediator;
import com.phillippitts.kioskwatch.testutil.FakeDeviceLink;
import com.phillippitts.kioskwatch.testutil.FakeLogStream;
import com.phillippitts.kioskwatch.testutil.SyncExecutor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static com.phillippitts.kioskwatch.testutil.TestErrors.error;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Drives {@link MonitorOrchestrator} with a real monitor loop, an in-line device pool and a
 * scripted device.
 */
class MonitorOrchestratorTest {

    private static final String CRASH_LINE =
            "E/AndroidRuntime: FATAL EXCEPTION: main Process: com.webviewer.firetv, PID: 4242";

    @TempDir
    Path tempDir;

    private FakeDeviceLink device;
    private MonitorProperties props;
    private ErrorClassifier classifier;
    private Remediator remediator;
    private MeterRegistry registry;
    private ScheduledExecutorService loop;
    private MonitorOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        device = new FakeDeviceLink();
        props = new MonitorProperties();
        props.setReportFile(tempDir.resolve("monitor_report.json").toString());
        props.setHealthCheckInterval(Duration.ofHours(1));
        props.setMaintenanceInterval(Duration.ofHours(1));
        props.setLogPollTimeout(Duration.ofMillis(10));
        props.setLogReopenDelay(Duration.ofMillis(50));
        props.setShutdownTimeout(Duration.ofSeconds(5));
        registry = new SimpleMeterRegistry();
        loop = Executors.newSingleThreadScheduledExecutor();
        classifier = new ErrorClassifier(new DeviceProperties(), new UiMonitoringProperties(), props);
        remediator = new Remediator(device, new RemediationProperties(), props, d -> { });
    }

    @AfterEach
    void tearDown() {
        if (orchestrator != null) {
            orchestrator.shutdown();
        }
        loop.shutdownNow();
    }

    private MonitorOrchestrator newOrchestrator(Executor deviceExecutor) {
        orchestrator = new MonitorOrchestrator(device, classifier, remediator, new RemediationMetrics(registry),
                props, FakeDeviceLink.DEVICE_ID, deviceExecutor, loop);
        return orchestrator;
    }

    private MonitorOrchestrator newOrchestrator() {
        return newOrchestrator(new SyncExecutor());
    }

    /** Runs {@code handleError} on the monitor loop and returns its completion. */
    private CompletableFuture<Void> dispatch(DetectedError error) throws Exception {
        return loop.submit(() -> orchestrator.handleError(error)).get(5, TimeUnit.SECONDS);
    }

    private void handle(DetectedError error) throws Exception {
        dispatch(error).get(5, TimeUnit.SECONDS);
    }

    private double skipped(String reason) {
        Counter counter = registry.find("kioskwatch.remediation.skipped").tag("reason", reason).counter();
        return counter == null ? 0 : counter.count();
    }

    private long count(String call) {
        return device.calls().stream().filter(call::equals).count();
    }

    private static RemediationOutcome pastOutcome() {
        DetectedError error = error(ErrorKind.ANR, Severity.HIGH);
        return new RemediationOutcome("fix_anr", RemediationResult.SUCCESS, "Fix attempt for anr",
                Map.of(RemediationOutcome.ORIGINAL_ERROR, error), Instant.now(), Duration.ZERO);
    }

    // ---- lifecycle ----

    @Test
    void shouldFailStartupWhenDeviceUnreachable() {
        // Arrange
        device.connectResult = false;
        device.connected = false;
        newOrchestrator();

        // Act + Assert
        assertThatThrownBy(() -> orchestrator.start())
                .isInstanceOf(MonitorStartupException.class)
                .hasMessageContaining("Failed to connect")
                .extracting(e -> ((MonitorStartupException) e).getDeviceId())
                .isEqualTo(FakeDeviceLink.DEVICE_ID);
        assertThat(orchestrator.currentStatus()).isEqualTo(MonitorStatus.STOPPED);
        assertThat(device.calls()).doesNotContain("isAppInstalled");
    }

    @Test
    void shouldFailStartupWhenAppNotInstalled() {
        device.appInstalled = false;
        newOrchestrator();

        assertThatThrownBy(() -> orchestrator.start())
                .isInstanceOf(MonitorStartupException.class)
                .hasMessageContaining("not installed");
        assertThat(orchestrator.currentStatus()).isEqualTo(MonitorStatus.STOPPED);
        assertThat(orchestrator.isRunning()).isFalse();
    }

    @Test
    void shouldMonitorAfterStartAndStopIdempotently() throws Exception {
        newOrchestrator();

        orchestrator.start();
        assertThat(orchestrator.isRunning()).isTrue();
        assertThat(orchestrator.currentStatus()).isEqualTo(MonitorStatus.MONITORING);

        orchestrator.stop();
        orchestrator.stop();

        assertThat(orchestrator.currentStatus()).isEqualTo(MonitorStatus.STOPPED);
        assertThat(count("disconnect")).isEqualTo(1);
        Path report = tempDir.resolve("monitor_report.json");
        assertThat(report).exists();
        JSONObject json = new JSONObject(Files.readString(report));
        assertThat(json.getJSONObject("statistics").getString("current_status")).isEqualTo("stopping");
    }

    @Test
    void shouldGoStraightToStoppedWhenStoppedBeforeStart() {
        newOrchestrator();

        orchestrator.stop();

        assertThat(orchestrator.currentStatus()).isEqualTo(MonitorStatus.STOPPED);
        assertThat(device.calls()).isEmpty();
        assertThatThrownBy(() -> orchestrator.start()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldDisconnectWhenStoppedDuringStartup() {
        device = new FakeDeviceLink() {
            @Override
            public boolean isAppInstalled() {
                orchestrator.stop();
                return super.isAppInstalled();
            }
        };
        remediator = new Remediator(device, new RemediationProperties(), props, d -> { });
        newOrchestrator();

        orchestrator.start();

        assertThat(orchestrator.currentStatus()).isEqualTo(MonitorStatus.STOPPED);
        assertThat(orchestrator.isRunning()).isFalse();
        assertThat(device.calls()).contains("connect", "disconnect");
        assertThat(device.connected).isFalse();
    }

    // ---- stream tailer ----

    @Test
    void shouldRemediateCrashSeenInLogStream() {
        // Arrange
        device.enqueueStream(new FakeLogStream(CRASH_LINE));
        newOrchestrator();

        // Act
        orchestrator.start();

        // Assert
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
            assertThat(device.calls()).contains("forceStopApp", "startApp");
            MonitoringStats.Snapshot stats = orchestrator.status().stats();
            assertThat(stats.errorsDetected()).isEqualTo(1);
            assertThat(stats.fixesSuccessful()).isEqualTo(1);
        });
        assertThat(remediator.history()).extracting(RemediationOutcome::action).containsExactly("fix_app_crash");
    }

    @Test
    void shouldBoundLogBuffer() {
        props.setLogBufferSize(3);
        FakeLogStream stream = new FakeLogStream();
        for (int i = 0; i < 10; i++) {
            stream.push("I/chromium: frame " + i);
        }
        device.enqueueStream(stream);
        newOrchestrator();

        orchestrator.start();

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
                assertThat(orchestrator.status().logBufferSize()).isEqualTo(3));
        assertThat(orchestrator.status().stats().errorsDetected()).isZero();
    }

    @Test
    void shouldReopenLogStreamAfterItEnds() {
        FakeLogStream first = new FakeLogStream();
        first.finish();
        device.enqueueStream(first);
        newOrchestrator();

        orchestrator.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> device.streamsOpened() >= 2);
        assertThat(first.isClosed()).isTrue();
    }

    @Test
    void shouldAnswerStatusWhileLogStreamIsClosing() throws Exception {
        // Arrange
        CountDownLatch closing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        FakeLogStream slow = new FakeLogStream() {
            @Override
            public void close() {
                closing.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                super.close();
            }
        };
        slow.finish();
        device.enqueueStream(slow);
        ExecutorService pool = Executors.newCachedThreadPool();
        newOrchestrator(pool);

        try {
            // Act
            orchestrator.start();
            assertThat(closing.await(5, TimeUnit.SECONDS)).isTrue();

            // Assert
            CompletableFuture<MonitorStatusSnapshot> status = CompletableFuture.supplyAsync(orchestrator::status);
            assertThat(status.get(1, TimeUnit.SECONDS).running()).isTrue();
            assertThat(slow.isClosed()).isFalse();
        } finally {
            release.countDown();
            orchestrator.shutdown();
            pool.shutdownNow();
        }
        assertThat(slow.isClosed()).isTrue();
    }

    // ---- health loop ----

    @Test
    void shouldRunHealthStagesInOrder() {
        device.screenDump = "<hierarchy/>";
        newOrchestrator();

        orchestrator.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> device.calls().contains("getScreenDump"));
        assertThat(device.calls()).containsSubsequence(
                "ensureConnection", "isAppRunning", "getCurrentActivity", "getMemoryUsage", "getScreenDump");
    }

    @Test
    void shouldRelaunchAppFoundStoppedByHealthCheck() {
        device.appRunning = false;
        newOrchestrator();

        orchestrator.start();

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
                assertThat(remediator.history()).extracting(RemediationOutcome::action)
                        .contains("fix_app_not_running"));
        assertThat(device.calls()).contains("startApp");
    }

    // ---- error handling gates ----

    @Test
    void shouldRecordButNotRemediateWhenAutoFixDisabled() throws Exception {
        props.setEnableAutoFix(false);
        newOrchestrator();

        handle(error(ErrorKind.APP_CRASH, Severity.CRITICAL));

        assertThat(device.calls()).isEmpty();
        assertThat(orchestrator.status().stats().errorsDetected()).isEqualTo(1);
        assertThat(skipped("disabled")).isEqualTo(1);
    }

    @Test
    void shouldNotRemediateLowSeverity() throws Exception {
        newOrchestrator();

        handle(error(ErrorKind.UNEXPECTED_ACTIVITY, Severity.LOW));

        assertThat(device.calls()).isEmpty();
        assertThat(skipped("not_escalated")).isEqualTo(1);
    }

    @Test
    void shouldEscalateMediumErrorOnThirdOccurrence() throws Exception {
        newOrchestrator();

        handle(error(ErrorKind.PERMISSION_ERROR, Severity.MEDIUM));
        handle(error(ErrorKind.PERMISSION_ERROR, Severity.MEDIUM));
        handle(error(ErrorKind.PERMISSION_ERROR, Severity.MEDIUM));

        assertThat(skipped("not_escalated")).isEqualTo(2);
        assertThat(skipped("no_strategy")).isEqualTo(1);
        assertThat(device.calls()).isEmpty();
    }

    @Test
    void shouldSkipWhenHourlyRateLimitReached() throws Exception {
        // Arrange
        props.setMaxFixAttemptsPerHour(2);
        remediator.record(pastOutcome());
        remediator.record(pastOutcome());
        newOrchestrator();

        // Act
        handle(error(ErrorKind.APP_CRASH, Severity.CRITICAL));

        // Assert
        assertThat(device.calls()).isEmpty();
        assertThat(skipped("rate_limited")).isEqualTo(1);
        assertThat(orchestrator.status().stats().fixesAttempted()).isZero();
    }

    @Test
    void shouldCountInFlightFixesTowardsRateLimit() throws Exception {
        // Arrange
        props.setMaxFixAttemptsPerHour(1);
        List<Runnable> queued = new ArrayList<>();
        newOrchestrator(queued::add);

        // Act
        CompletableFuture<Void> first = dispatch(error(ErrorKind.APP_CRASH, Severity.CRITICAL));
        handle(error(ErrorKind.ANR, Severity.HIGH));
        queued.forEach(Runnable::run);
        first.get(5, TimeUnit.SECONDS);

        // Assert
        assertThat(skipped("rate_limited")).isEqualTo(1);
        assertThat(remediator.history()).extracting(RemediationOutcome::action).containsExactly("fix_app_crash");
        assertThat(device.calls()).doesNotContain("key:4");
    }

    @Test
    void shouldSkipRepeatWithinCooldown() throws Exception {
        newOrchestrator();

        handle(error(ErrorKind.APP_CRASH, Severity.CRITICAL));
        handle(error(ErrorKind.APP_CRASH, Severity.CRITICAL));

        assertThat(count("forceStopApp")).isEqualTo(1);
        assertThat(skipped("cooldown")).isEqualTo(1);
        MonitoringStats.Snapshot stats = orchestrator.status().stats();
        assertThat(stats.errorsDetected()).isEqualTo(2);
        assertThat(stats.fixesAttempted()).isEqualTo(1);
    }

    @Test
    void shouldCountRejectedDispatchAsFailedFix() throws Exception {
        newOrchestrator(task -> {
            throw new RejectedExecutionException("pool saturated");
        });

        handle(error(ErrorKind.APP_CRASH, Severity.CRITICAL));

        MonitoringStats.Snapshot stats = orchestrator.status().stats();
        assertThat(stats.fixesAttempted()).isEqualTo(1);
        assertThat(stats.fixesFailed()).isEqualTo(1);
        assertThat(remediator.history()).isEmpty();
    }

    @Test
    void shouldUpdateStatisticsAfterFix() throws Exception {
        newOrchestrator();
        DetectedError crash = error(ErrorKind.APP_CRASH, Severity.CRITICAL);

        handle(crash);

        MonitoringStats.Snapshot stats = orchestrator.status().stats();
        assertThat(stats.fixesSuccessful()).isEqualTo(1);
        assertThat(stats.fixesFailed()).isZero();
        assertThat(stats.lastErrorTime()).isEqualTo(crash.timestamp());
        assertThat(stats.lastFixTime()).isAfterOrEqualTo(stats.lastErrorTime());
        assertThat(registry.find("kioskwatch.remediation.outcome")
                .tags("action", "fix_app_crash", "result", "success").counter().count()).isEqualTo(1);
    }

    // ---- reporting ----

    @Test
    void shouldGenerateReportWithAllSections() {
        newOrchestrator();
        orchestrator.start();

        JSONObject report = orchestrator.generateReport();

        assertThat(report.keySet()).containsExactlyInAnyOrder("timestamp", "uptime_seconds", "statistics",
                "error_summary", "fix_statistics", "device_info");
        assertThat(report.getJSONObject("statistics").getString("current_status")).isEqualTo("monitoring");
        assertThat(report.getJSONObject("device_info").getString("device_id")).isEqualTo(FakeDeviceLink.DEVICE_ID);
    }

    @Test
    void shouldReportZeroUptimeBeforeStart() {
        newOrchestrator();

        MonitorStatusSnapshot status = orchestrator.status();

        assertThat(status.running()).isFalse();
        assertThat(status.uptimeSeconds()).isZero();
        assertThat(status.stats().startTime()).isNull();
    }

    @Test
    void shouldRefreshDeviceInfoForEachReport() {
        newOrchestrator();
        orchestrator.start();
        assertThat(orchestrator.generateReport().getJSONObject("device_info").getString("model"))
                .isEqualTo("AFTMM");

        device.deviceInfo = new DeviceInfo(FakeDeviceLink.DEVICE_ID, "device", "AFTKA", "11", 30);
        JSONObject refreshed = orchestrator.generateReport().getJSONObject("device_info");
        assertThat(refreshed.getString("model")).isEqualTo("AFTKA");
        assertThat(refreshed.getInt("api_level")).isEqualTo(30);

        // an empty answer keeps the last known values
        device.deviceInfo = null;
        assertThat(orchestrator.generateReport().getJSONObject("device_info").getString("model"))
                .isEqualTo("AFTKA");
    }

    // ---- emergency recovery ----

    @Test
    void shouldRunEmergencyRecoveryOnDevicePool() throws Exception {
        newOrchestrator();

        assertThat(orchestrator.emergencyRecovery().get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(device.calls()).contains("forceStopApp", "ensureConnection", "startApp");
    }

    @Test
    void shouldRejectEmergencyRecoveryWhenDisabled() {
        props.setEnableEmergencyRecovery(false);
        newOrchestrator();

        assertThatThrownBy(() -> orchestrator.emergencyRecovery())
                .isInstanceOf(EmergencyRecoveryDisabledException.class);
        assertThat(device.calls()).isEmpty();
    }
}
