package com.phillippitts.kioskwatch.service.orchestration;

import com.phillippitts.kioskwatch.config.properties.DeviceProperties;
import com.phillippitts.kioskwatch.config.properties.MonitorProperties;
import com.phillippitts.kioskwatch.domain.DetectedError;
import com.phillippitts.kioskwatch.domain.DeviceInfo;
import com.phillippitts.kioskwatch.domain.MemoryUsage;
import com.phillippitts.kioskwatch.domain.MonitorStatus;
import com.phillippitts.kioskwatch.domain.RemediationOutcome;
import com.phillippitts.kioskwatch.exception.EmergencyRecoveryDisabledException;
import com.phillippitts.kioskwatch.exception.MonitorStartupException;
import com.phillippitts.kioskwatch.service.detect.ErrorClassifier;
import com.phillippitts.kioskwatch.service.device.DeviceLink;
import com.phillippitts.kioskwatch.service.device.LogStream;
import com.phillippitts.kioskwatch.service.metrics.RemediationMetrics;
import com.phillippitts.kioskwatch.service.remediate.PendingFix;
import com.phillippitts.kioskwatch.service.remediate.RemediationPlan;
import com.phillippitts.kioskwatch.service.remediate.Remediator;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs the detect, classify and remediate loop against one device.
 *
 * <p><b>Activities:</b>
 * <ul>
 *   <li>stream tailer: drains the device log into a rolling buffer and the classifier</li>
 *   <li>health loop: connection, app state, memory and UI checks, one stage at a time</li>
 *   <li>maintenance loop: device upkeep, report persistence and history trimming</li>
 * </ul>
 *
 * <p><b>Threading:</b> a single-threaded scheduler (the monitor loop) owns every piece of
 * mutable state: statistics, log buffer, classifier and remediator histories, cooldowns.
 * Device calls never run on it, closing the log stream included; they go to the
 * {@code deviceExecutor} pool and their
 * results are handed back with {@code *Async(..., loop)}. Callers on other threads read
 * state through {@link #status()} and {@link #generateReport()}, which hop onto the loop.
 *
 * <p><b>Lifecycle:</b> {@code INITIALIZING → STARTING → MONITORING → STOPPING → STOPPED}.
 * Only a failed startup is fatal ({@link MonitorStartupException}); everything afterwards
 * is logged and retried on the next tick.
 */
@Component
public class MonitorOrchestrator implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(MonitorOrchestrator.class);

    static final Duration RATE_LIMIT_WINDOW = Duration.ofHours(1);
    static final Duration STATUS_RECENT_WINDOW = Duration.ofMinutes(5);
    static final int MAX_LINES_PER_DRAIN = 500;

    private static final String ACTIVITY = "activity";
    private static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);

    private final DeviceLink device;
    private final ErrorClassifier classifier;
    private final Remediator remediator;
    private final RemediationMetrics metrics;
    private final MonitorProperties props;
    private final String deviceId;
    private final Executor deviceExecutor;
    private final ScheduledExecutorService loop;
    private final StatusReportWriter reportWriter;
    private final MonitorStateMachine state = new MonitorStateMachine();

    // Monitor loop only
    private final MonitoringStats stats = new MonitoringStats();
    private final Deque<String> logBuffer = new ArrayDeque<>();
    private LogStream logStream;
    private ScheduledFuture<?> tailerTask;
    private ScheduledFuture<?> healthTask;
    private ScheduledFuture<?> maintenanceTask;
    private volatile int fixesInFlight;

    private volatile DeviceInfo deviceInfo;

    @Autowired
    public MonitorOrchestrator(DeviceLink device,
                               ErrorClassifier classifier,
                               Remediator remediator,
                               RemediationMetrics metrics,
                               MonitorProperties props,
                               DeviceProperties deviceProps,
                               @Qualifier("deviceExecutor") Executor deviceExecutor) {
        this(device, classifier, remediator, metrics, props, deviceProps.deviceId(), deviceExecutor,
                newLoop());
    }

    private static ScheduledThreadPoolExecutor newLoop() {
        ScheduledThreadPoolExecutor loop =
                new ScheduledThreadPoolExecutor(1, new CustomizableThreadFactory("monitor-loop-"));
        loop.setRemoveOnCancelPolicy(true);
        return loop;
    }

    MonitorOrchestrator(DeviceLink device,
                        ErrorClassifier classifier,
                        Remediator remediator,
                        RemediationMetrics metrics,
                        MonitorProperties props,
                        String deviceId,
                        Executor deviceExecutor,
                        ScheduledExecutorService loop) {
        this.device = Objects.requireNonNull(device, "device must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.remediator = Objects.requireNonNull(remediator, "remediator must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId must not be null");
        this.deviceExecutor = Objects.requireNonNull(deviceExecutor, "deviceExecutor must not be null");
        this.loop = Objects.requireNonNull(loop, "loop must not be null");
        this.reportWriter = new StatusReportWriter(Path.of(props.getReportFile()));
    }

    // ---- lifecycle --------------------------------------------------------------------

    /**
     * Connects, verifies the app is installed and schedules the three activities.
     *
     * @throws MonitorStartupException if the device cannot be reached or the app is missing
     * @throws IllegalStateException   if the monitor has already been stopped
     */
    @Override
    public void start() {
        if (!state.transition(MonitorStatus.INITIALIZING, MonitorStatus.STARTING)) {
            if (state.isShuttingDown()) {
                throw new IllegalStateException("Monitor already stopped; create a new instance");
            }
            LOG.debug("start() called while {}; ignoring", state.current().tag());
            return;
        }
        LOG.info("Starting kiosk monitor for {}", deviceId);
        try {
            if (!device.connect()) {
                throw startupFailure("Failed to connect to device", null);
            }
            deviceInfo = device.getDeviceInfo().orElse(null);
            if (deviceInfo != null) {
                LOG.info("Connected to device: {}", deviceInfo.toJson());
            }
            if (!device.isAppInstalled()) {
                throw startupFailure("Monitored app is not installed", null);
            }
        } catch (MonitorStartupException e) {
            throw e;
        } catch (RuntimeException e) {
            throw startupFailure("Device check failed during startup", e);
        }

        Instant startedAt = Instant.now();
        if (!state.transition(MonitorStatus.STARTING, MonitorStatus.MONITORING)) {
            LOG.info("Stop requested during startup; not scheduling activities");
            awaitQuietly(offload(device::disconnect), props.getShutdownTimeout().toMillis(), "disconnect");
            return;
        }
        loop.execute(() -> {
            stats.markStarted(startedAt);
            tailerTask = loop.schedule(this::tailLog, 0, TimeUnit.MILLISECONDS);
            healthTask = loop.schedule(this::runHealthCheck, 0, TimeUnit.MILLISECONDS);
            long maintenanceMillis = props.getMaintenanceInterval().toMillis();
            maintenanceTask = loop.scheduleWithFixedDelay(this::runMaintenance,
                    maintenanceMillis, maintenanceMillis, TimeUnit.MILLISECONDS);
        });
        LOG.info("Monitor started");
    }

    private MonitorStartupException startupFailure(String message, Throwable cause) {
        state.advanceTo(MonitorStatus.STOPPING);
        state.advanceTo(MonitorStatus.STOPPED);
        LOG.error("Startup failed for {}: {}", deviceId, message);
        return cause == null
                ? new MonitorStartupException(message, deviceId)
                : new MonitorStartupException(message, deviceId, cause);
    }

    /**
     * Cancels the activities, writes a final report and disconnects. Safe to call more
     * than once and before {@link #start()}.
     */
    @Override
    public void stop() {
        MonitorStatus before = state.current();
        if (before == MonitorStatus.STOPPING || before == MonitorStatus.STOPPED) {
            return;
        }
        if (before != MonitorStatus.MONITORING) {
            state.advanceTo(MonitorStatus.STOPPING);
            state.advanceTo(MonitorStatus.STOPPED);
            if (before == MonitorStatus.STARTING) {
                // connect() may already have run
                awaitQuietly(offload(device::disconnect), props.getShutdownTimeout().toMillis(), "disconnect");
            }
            LOG.info("Monitor stopped before it started");
            return;
        }
        if (!state.transition(MonitorStatus.MONITORING, MonitorStatus.STOPPING)) {
            return;
        }
        LOG.info("Stopping monitor");
        long timeoutMillis = props.getShutdownTimeout().toMillis();
        awaitQuietly(refreshDeviceInfo(), timeoutMillis, "device info");
        try {
            awaitQuietly(loop.submit(this::shutdownOnLoop), timeoutMillis, "final report");
        } catch (RejectedExecutionException e) {
            LOG.warn("Monitor loop already shut down; skipping final report");
        }
        awaitQuietly(offload(device::disconnect), timeoutMillis, "disconnect");
        state.advanceTo(MonitorStatus.STOPPED);
        LOG.info("Monitor stopped");
    }

    private void shutdownOnLoop() {
        cancel(tailerTask);
        cancel(healthTask);
        cancel(maintenanceTask);
        closeStream();
        writeReport();
    }

    @PreDestroy
    void shutdown() {
        stop();
        loop.shutdownNow();
        try {
            if (!loop.awaitTermination(props.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Monitor loop did not terminate within {}", props.getShutdownTimeout());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public boolean isRunning() {
        return state.is(MonitorStatus.MONITORING);
    }

    @Override
    public boolean isAutoStartup() {
        return props.isAutoStart();
    }

    public MonitorStatus currentStatus() {
        return state.current();
    }

    // ---- stream tailer ----------------------------------------------------------------

    private void tailLog() {
        if (!state.is(MonitorStatus.MONITORING)) {
            return;
        }
        if (logStream == null) {
            openStream();
            return;
        }
        int drained = 0;
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put(ACTIVITY, "stream")) {
            Optional<String> line;
            while (drained < MAX_LINES_PER_DRAIN && (line = logStream.poll(Duration.ZERO)).isPresent()) {
                drained++;
                processLogLine(line.get());
            }
            if (drained == 0 && logStream.isFinished()) {
                LOG.warn("Log stream ended; reopening in {}", props.getLogReopenDelay());
                closeStream();
                scheduleTailer(props.getLogReopenDelay());
                return;
            }
        } catch (RuntimeException e) {
            LOG.error("Error in log stream tailer: {}", e.toString());
        }
        scheduleTailer(drained >= MAX_LINES_PER_DRAIN ? Duration.ZERO : props.getLogPollTimeout());
    }

    private void openStream() {
        offload(device::openLogStream).whenCompleteAsync((stream, err) -> {
            if (err != null) {
                LOG.error("Could not open log stream: {}", rootMessage(err));
                scheduleTailer(props.getLogReopenDelay());
                return;
            }
            if (!state.is(MonitorStatus.MONITORING)) {
                closeOffLoop(stream);
                return;
            }
            logStream = stream;
            scheduleTailer(Duration.ZERO);
        }, loop);
    }

    private void processLogLine(String line) {
        logBuffer.addLast(line);
        trimLogBuffer(props.getLogBufferSize());
        for (DetectedError error : classifier.analyzeLogLine(line)) {
            handleError(error);
        }
    }

    private void scheduleTailer(Duration delay) {
        if (!state.is(MonitorStatus.MONITORING)) {
            return;
        }
        try {
            tailerTask = loop.schedule(this::tailLog, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.debug("Tailer not rescheduled: loop is shut down");
        }
    }

    /** Detaches the current stream; the blocking close runs on the device pool. */
    private void closeStream() {
        if (logStream != null) {
            LogStream old = logStream;
            logStream = null;
            closeOffLoop(old);
        }
    }

    private CompletableFuture<Void> closeOffLoop(LogStream stream) {
        return offload(() -> {
            stream.close();
            return (Void) null;
        }).exceptionally(err -> {
            LOG.warn("Could not close log stream: {}", rootMessage(err));
            return null;
        });
    }

    private void trimLogBuffer(int retained) {
        while (logBuffer.size() > Math.max(0, retained)) {
            logBuffer.removeFirst();
        }
    }

    // ---- health loop ------------------------------------------------------------------

    private void runHealthCheck() {
        if (!state.is(MonitorStatus.MONITORING)) {
            return;
        }
        offload(device::ensureConnection)
                .thenComposeAsync(connected -> {
                    if (!Boolean.TRUE.equals(connected)) {
                        inActivity("health", () -> LOG.error("Device connection lost; skipping health check"));
                        return DONE;
                    }
                    return stage("app state", this::checkAppState)
                            .thenCompose(v -> stage("memory", this::checkMemory))
                            .thenCompose(v -> stage("ui", this::checkUi));
                }, loop)
                .whenCompleteAsync((v, err) -> {
                    if (err != null) {
                        inActivity("health", () -> LOG.error("Health check failed: {}", rootMessage(err)));
                    }
                    scheduleHealthCheck();
                }, loop);
    }

    private void scheduleHealthCheck() {
        if (!state.is(MonitorStatus.MONITORING)) {
            return;
        }
        try {
            healthTask = loop.schedule(this::runHealthCheck,
                    props.getHealthCheckInterval().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.debug("Health check not rescheduled: loop is shut down");
        }
    }

    /**
     * Runs one health stage; a failure is logged and does not stop the following stages.
     */
    private CompletableFuture<Void> stage(String name, Supplier<CompletableFuture<Void>> check) {
        if (!state.is(MonitorStatus.MONITORING)) {
            return DONE;
        }
        return check.get().exceptionally(err -> {
            LOG.error("Health stage '{}' failed: {}", name, rootMessage(err));
            return null;
        });
    }

    private record AppProbe(boolean running, String activity) {}

    private CompletableFuture<Void> checkAppState() {
        return offload(() -> new AppProbe(device.isAppRunning(), device.getCurrentActivity().orElse(null)))
                .thenComposeAsync(probe -> handleAll(
                        classifier.analyzeAppState(probe.running(), probe.activity())), loop);
    }

    private CompletableFuture<Void> checkMemory() {
        return offload(device::getMemoryUsage)
                .thenComposeAsync(usage -> {
                    MemoryUsage sample = usage.orElse(null);
                    return sample == null ? DONE : handleAll(classifier.analyzeMemoryUsage(sample));
                }, loop);
    }

    private CompletableFuture<Void> checkUi() {
        return offload(device::getScreenDump)
                .thenComposeAsync(dump -> dump.map(d -> handleAll(classifier.analyzeUiDump(d))).orElse(DONE), loop);
    }

    /** Handles errors one after another; each remediation finishes before the next starts. */
    private CompletableFuture<Void> handleAll(List<DetectedError> errors) {
        CompletableFuture<Void> chain = DONE;
        for (DetectedError error : errors) {
            chain = chain.thenCompose(v -> withActivity("health", () -> handleError(error)));
        }
        return chain;
    }

    // ---- maintenance ------------------------------------------------------------------

    private void runMaintenance() {
        if (!state.is(MonitorStatus.MONITORING)) {
            return;
        }
        offload(remediator::scheduledMaintenance)
                .thenCompose(ok -> refreshDeviceInfo())
                .whenCompleteAsync((v, err) -> inActivity("maintenance", () -> finishMaintenance(err)), loop);
    }

    private void finishMaintenance(Throwable err) {
        if (err != null) {
            LOG.error("Scheduled maintenance failed: {}", rootMessage(err));
        }
        writeReport();
        classifier.trimHistory(props.getErrorHistoryRetained());
        remediator.trimHistory(props.getRemediationHistorySize());
        trimLogBuffer(props.getLogBufferSize());
        LOG.info("Maintenance complete (errors={}, fixes={}, logLines={})",
                classifier.historySize(), remediator.history().size(), logBuffer.size());
    }

    // ---- error handling path ----------------------------------------------------------

    /**
     * Records an error and, if every gate admits it, dispatches a remediation.
     * Must run on the monitor loop.
     *
     * @return completes (on the loop) once the remediation outcome has been recorded, or
     *         immediately when nothing was dispatched
     */
    CompletableFuture<Void> handleError(DetectedError error) {
        try (CloseableThreadContext.Instance ignored =
                     CloseableThreadContext.put("errorKind", error.kind().tag())) {
            stats.errorDetected(error.timestamp());
            classifier.record(error);
            metrics.recordDetected(error);

            if (!props.isEnableAutoFix()) {
                metrics.recordSkipped("disabled");
                return DONE;
            }
            if (!classifier.shouldEscalate(error)) {
                LOG.debug("Not escalating {} ({})", error.kind().tag(), error.severity().tag());
                metrics.recordSkipped("not_escalated");
                return DONE;
            }
            int used = remediator.attemptsWithin(RATE_LIMIT_WINDOW) + fixesInFlight;
            if (used >= props.getMaxFixAttemptsPerHour()) {
                LOG.info("Fix rate limit reached ({} in the last hour); skipping {}", used, error.kind().tag());
                metrics.recordSkipped("rate_limited");
                return DONE;
            }
            Optional<PendingFix> admitted = remediator.beginAttempt(error);
            if (admitted.isEmpty()) {
                boolean unsupported = RemediationPlan.forKind(error.kind()) == RemediationPlan.NONE;
                metrics.recordSkipped(unsupported ? "no_strategy" : "cooldown");
                return DONE;
            }
            PendingFix fix = admitted.get();
            stats.fixAttempted(fix.startedAt());
            fixesInFlight++;
            metrics.recordAttempt(RemediationOutcome.actionFor(error.kind()));

            return offload(() -> remediator.execute(fix))
                    .handleAsync((outcome, err) -> {
                        fixesInFlight--;
                        if (err != null) {
                            LOG.error("Remediation of {} did not run: {}", error.kind().tag(), rootMessage(err));
                            stats.fixFailed();
                            return null;
                        }
                        remediator.record(outcome);
                        metrics.recordOutcome(outcome);
                        if (outcome.isSuccess()) {
                            stats.fixSucceeded();
                        } else {
                            stats.fixFailed();
                        }
                        return null;
                    }, loop);
        }
    }

    // ---- reporting --------------------------------------------------------------------

    public MonitorStatusSnapshot status() {
        return onLoop(this::buildStatus);
    }

    /**
     * Builds a report with device info read now; the last known info is kept if the
     * read fails.
     */
    public JSONObject generateReport() {
        awaitQuietly(refreshDeviceInfo(), props.getShutdownTimeout().toMillis(), "device info");
        return onLoop(this::buildReport);
    }

    private CompletableFuture<Void> refreshDeviceInfo() {
        return offload(device::getDeviceInfo)
                .thenAccept(info -> info.ifPresent(fresh -> deviceInfo = fresh))
                .exceptionally(err -> {
                    LOG.warn("Could not read device info: {}", rootMessage(err));
                    return null;
                });
    }

    /** Remediations dispatched to the device pool and not yet recorded. */
    public int fixesInFlight() {
        return fixesInFlight;
    }

    /** Tasks waiting on the monitor loop, or 0 if the loop does not expose its queue. */
    public int pendingLoopTasks() {
        return loop instanceof ThreadPoolExecutor executor ? executor.getQueue().size() : 0;
    }

    /**
     * Runs emergency recovery on the device pool.
     *
     * @throws EmergencyRecoveryDisabledException if {@code monitor.enable-emergency-recovery} is false
     */
    public CompletableFuture<Boolean> emergencyRecovery() {
        if (!props.isEnableEmergencyRecovery()) {
            throw new EmergencyRecoveryDisabledException();
        }
        return offload(remediator::emergencyRecovery);
    }

    private MonitorStatusSnapshot buildStatus() {
        Instant start = stats.startTime();
        long uptime = start == null ? 0 : Duration.between(start, Instant.now()).toSeconds();
        return new MonitorStatusSnapshot(state.is(MonitorStatus.MONITORING),
                stats.snapshot(state.current()), uptime,
                classifier.recentErrors(STATUS_RECENT_WINDOW).size(), logBuffer.size());
    }

    JSONObject buildReport() {
        Instant now = Instant.now();
        Instant start = stats.startTime();
        JSONObject report = new JSONObject();
        report.put("timestamp", now.toString());
        report.put("uptime_seconds", start == null ? 0 : Duration.between(start, now).toSeconds());
        report.put("statistics", stats.snapshot(state.current()).toJson());
        report.put("error_summary", classifier.summary().toJson());
        report.put("fix_statistics", remediator.statistics().toJson());
        DeviceInfo info = deviceInfo;
        report.put("device_info", info == null ? JSONObject.NULL : info.toJson());
        return report;
    }

    private void writeReport() {
        try {
            reportWriter.write(buildReport());
        } catch (UncheckedIOException e) {
            LOG.error("Could not persist status report: {}", e.getMessage());
        }
    }

    /**
     * Runs {@code task} on the monitor loop and waits for it. Once the loop has shut down
     * nothing else mutates state, so the task runs on the caller.
     */
    private <T> T onLoop(Callable<T> task) {
        Future<T> future;
        try {
            future = loop.submit(task);
        } catch (RejectedExecutionException e) {
            return callDirectly(task);
        }
        try {
            return future.get(props.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted waiting for monitor loop", e);
        } catch (TimeoutException e) {
            future.cancel(false);
            throw new IllegalStateException("Monitor loop did not respond within " + props.getShutdownTimeout(), e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException(e.getCause());
        }
    }

    private static <T> T callDirectly(Callable<T> task) {
        try {
            return task.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    // ---- helpers ----------------------------------------------------------------------

    private <T> CompletableFuture<T> offload(Supplier<T> call) {
        try {
            return CompletableFuture.supplyAsync(call, deviceExecutor);
        } catch (RejectedExecutionException e) {
            LOG.warn("Device pool rejected task: {}", e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
    }

    private static void inActivity(String activity, Runnable body) {
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put(ACTIVITY, activity)) {
            body.run();
        }
    }

    private static <T> T withActivity(String activity, Supplier<T> body) {
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put(ACTIVITY, activity)) {
            return body.get();
        }
    }

    private static void cancel(Future<?> task) {
        if (task != null) {
            task.cancel(false);
        }
    }

    private static void awaitQuietly(Future<?> future, long timeoutMillis, String what) {
        try {
            future.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted waiting for {}", what);
        } catch (TimeoutException e) {
            LOG.warn("Timed out after {}ms waiting for {}", timeoutMillis, what);
        } catch (ExecutionException e) {
            LOG.warn("{} failed: {}", what, rootMessage(e));
        }
    }

    private static String rootMessage(Throwable err) {
        Throwable t = err;
        while (t.getCause() != null && t.getCause() != t) {
            t = t.getCause();
        }
        return t.toString();
    }
}
