package com.phillippitts.kioskwatch.service.remediate;

import com.phillippitts.kioskwatch.config.properties.MonitorProperties;
import com.phillippitts.kioskwatch.config.properties.RemediationProperties;
import com.phillippitts.kioskwatch.domain.AppState;
import com.phillippitts.kioskwatch.domain.DetectedError;
import com.phillippitts.kioskwatch.domain.ErrorKind;
import com.phillippitts.kioskwatch.domain.RemediationOutcome;
import com.phillippitts.kioskwatch.domain.RemediationResult;
import com.phillippitts.kioskwatch.service.detect.ErrorClassifier;
import com.phillippitts.kioskwatch.service.device.DeviceLink;
import com.phillippitts.kioskwatch.service.device.KeyCodes;
import com.phillippitts.kioskwatch.util.TimeUtils;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Maps an error kind to a short device script and runs it, subject to a per-kind cooldown.
 *
 * <p>An attempt has three phases so the monitor loop can keep ownership of shared state:
 * <ol>
 *   <li>{@link #beginAttempt} checks and stamps the cooldown (monitor loop)</li>
 *   <li>{@link #execute} runs the script against the device; touches no shared state
 *       (device pool)</li>
 *   <li>{@link #record} appends the outcome to the history (monitor loop)</li>
 * </ol>
 * {@link #attemptFix} runs all three on the calling thread.
 *
 * <p>Outcomes are not re-verified beyond what each script checks itself: a {@code partial}
 * or {@code success} result does not always mean the problem is gone.
 */
@Component
public class Remediator {

    private static final Logger LOG = LogManager.getLogger(Remediator.class);

    static final String TRIM_MEMORY_BROADCAST = "am broadcast -a android.intent.action.TRIM_MEMORY";
    static final Duration STATS_RECENT_WINDOW = Duration.ofHours(1);

    private final DeviceLink device;
    private final RemediationProperties props;
    private final Pauser pauser;
    private final int historyCapacity;

    private final Map<ErrorKind, Instant> lastAttempt = new EnumMap<>(ErrorKind.class);
    private final Deque<RemediationOutcome> history = new ArrayDeque<>();

    @Autowired
    public Remediator(DeviceLink device, RemediationProperties props, MonitorProperties monitorProps) {
        this(device, props, monitorProps, Pauser.sleeping());
    }

    public Remediator(DeviceLink device, RemediationProperties props, MonitorProperties monitorProps,
                      Pauser pauser) {
        this.device = Objects.requireNonNull(device, "device");
        this.props = Objects.requireNonNull(props, "props");
        this.pauser = Objects.requireNonNull(pauser, "pauser");
        this.historyCapacity = monitorProps.getRemediationHistorySize();
    }

    // ---- dispatch ---------------------------------------------------------------------

    /**
     * Runs a complete attempt on the calling thread.
     *
     * @return the outcome, or empty if the kind is in cooldown or has no strategy
     */
    public Optional<RemediationOutcome> attemptFix(DetectedError error) {
        return beginAttempt(error).map(fix -> {
            RemediationOutcome outcome = execute(fix);
            record(outcome);
            return outcome;
        });
    }

    /**
     * Admits an attempt: the kind must have a strategy and be out of cooldown. Admission
     * stamps the cooldown; a rejection changes nothing.
     */
    public Optional<PendingFix> beginAttempt(DetectedError error) {
        ErrorKind kind = error.kind();
        RemediationPlan plan = RemediationPlan.forKind(kind);
        if (plan == RemediationPlan.NONE) {
            LOG.warn("No fix strategy for error type: {}", kind.tag());
            return Optional.empty();
        }
        Instant now = Instant.now();
        if (!canAttempt(kind, now)) {
            LOG.info("Fix for {} is in cooldown", kind.tag());
            return Optional.empty();
        }
        lastAttempt.put(kind, now);
        Instant startedAt = now.isBefore(error.timestamp()) ? error.timestamp() : now;
        return Optional.of(new PendingFix(error, plan, startedAt));
    }

    public boolean canAttempt(ErrorKind kind) {
        return canAttempt(kind, Instant.now());
    }

    private boolean canAttempt(ErrorKind kind, Instant now) {
        Instant last = lastAttempt.get(kind);
        return last == null || Duration.between(last, now).compareTo(props.getCooldown()) >= 0;
    }

    /**
     * Runs the script for an admitted attempt. A failure inside the script becomes a
     * {@code failed} outcome.
     */
    public RemediationOutcome execute(PendingFix fix) {
        DetectedError error = fix.error();
        String action = RemediationOutcome.actionFor(error.kind());
        long start = System.nanoTime();
        try (CloseableThreadContext.Instance ignored =
                     CloseableThreadContext.put("errorKind", error.kind().tag())) {
            LOG.info("Attempting to fix {} ({})", error.kind().tag(), fix.plan());
            try {
                RemediationResult result = run(fix.plan(), error);
                LOG.info("Fix result for {}: {}", error.kind().tag(), result.tag());
                return new RemediationOutcome(action, result, "Fix attempt for " + error.kind().tag(),
                        Map.of(RemediationOutcome.ORIGINAL_ERROR, error),
                        fix.startedAt(), Duration.ofMillis(TimeUtils.elapsedMillis(start)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return failed(fix, action, "interrupted", start);
            } catch (RuntimeException e) {
                LOG.error("Fix failed for {}: {}", error.kind().tag(), e.toString());
                return failed(fix, action, String.valueOf(e.getMessage()), start);
            }
        }
    }

    private static RemediationOutcome failed(PendingFix fix, String action, String description, long start) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("error", description);
        details.put(RemediationOutcome.ORIGINAL_ERROR, fix.error());
        return new RemediationOutcome(action, RemediationResult.FAILED, "Fix failed: " + description,
                details, fix.startedAt(), Duration.ofMillis(TimeUtils.elapsedMillis(start)));
    }

    /** Appends to the bounded history. */
    public void record(RemediationOutcome outcome) {
        history.addLast(outcome);
        while (history.size() > historyCapacity) {
            history.removeFirst();
        }
    }

    // ---- scripts ----------------------------------------------------------------------

    private RemediationResult run(RemediationPlan plan, DetectedError error) throws InterruptedException {
        return switch (plan) {
            case RESTART_APP -> restartApp();
            case DISMISS_AND_RESTART -> dismissAndRestart();
            case RELIEVE_MEMORY -> relieveMemory();
            case RESTART_FOR_MEMORY -> restartForMemory();
            case REFRESH_PAGE -> refreshPage();
            case REFRESH_OR_RESTART -> refreshOrRestart();
            case OPEN_PROFILES -> openProfiles();
            case RESET_APP_DATA -> resetAppData();
            case RESET_FOCUS -> resetFocus();
            case ESTABLISH_FOCUS -> establishFocus();
            case RECOVER_UI_ELEMENT -> recoverUiElement(error);
            case LAUNCH_APP -> launchApp();
            case NAVIGATE_BACK -> navigateBack();
            case NONE -> throw new IllegalStateException("No script for " + error.kind().tag());
        };
    }

    private RemediationResult restartApp() throws InterruptedException {
        LOG.info("Restarting app");
        if (!device.forceStopApp()) {
            return RemediationResult.FAILED;
        }
        pause(2_000);
        return launchApp();
    }

    private RemediationResult dismissAndRestart() throws InterruptedException {
        LOG.info("Dismissing possible ANR dialog and restarting app");
        device.sendKeyEvent(KeyCodes.BACK);
        pause(1_000);
        if (!device.forceStopApp()) {
            return RemediationResult.FAILED;
        }
        pause(3_000);
        return launchApp();
    }

    private RemediationResult relieveMemory() throws InterruptedException {
        if (device.isAppRunning()) {
            LOG.info("Requesting in-app memory trim");
            device.runCommand(TRIM_MEMORY_BROADCAST);
            pause(2_000);
            return RemediationResult.PARTIAL;
        }
        return restartForMemory();
    }

    private RemediationResult restartForMemory() throws InterruptedException {
        LOG.info("Restarting app with cache trim");
        device.forceStopApp();
        pause(2_000);
        // Cache only; app data (and stored profiles) is kept
        device.runCommand("pm trim-caches " + props.getMemoryTrimBudget());
        pause(2_000);
        if (device.startApp()) {
            pause(5_000);
            return RemediationResult.SUCCESS;
        }
        return RemediationResult.FAILED;
    }

    private RemediationResult refreshPage() throws InterruptedException {
        if (!device.isAppRunning()) {
            return RemediationResult.FAILED;
        }
        LOG.info("Refreshing page via toolbar");
        device.sendKeyEvent(KeyCodes.DPAD_UP);
        pause(500);
        device.sendKeyEvent(KeyCodes.DPAD_RIGHT);
        pause(500);
        device.sendKeyEvent(KeyCodes.DPAD_RIGHT);
        pause(500);
        device.sendKeyEvent(KeyCodes.DPAD_CENTER);
        return RemediationResult.SUCCESS;
    }

    private RemediationResult refreshOrRestart() throws InterruptedException {
        if (refreshPage() == RemediationResult.SUCCESS) {
            return RemediationResult.SUCCESS;
        }
        return restartApp();
    }

    private RemediationResult openProfiles() throws InterruptedException {
        if (!device.isAppRunning()) {
            return RemediationResult.FAILED;
        }
        LOG.info("Opening profiles screen");
        device.sendKeyEvent(KeyCodes.DPAD_UP);
        pause(500);
        for (int i = 0; i < 5; i++) {
            device.sendKeyEvent(KeyCodes.DPAD_RIGHT);
            pause(300);
        }
        device.sendKeyEvent(KeyCodes.DPAD_CENTER);
        return RemediationResult.PARTIAL;
    }

    private RemediationResult resetAppData() throws InterruptedException {
        LOG.warn("Clearing app data; stored profiles will be lost");
        device.forceStopApp();
        pause(2_000);
        if (device.clearAppData()) {
            pause(3_000);
            if (device.startApp()) {
                pause(5_000);
                return RemediationResult.SUCCESS;
            }
        }
        return RemediationResult.FAILED;
    }

    private RemediationResult resetFocus() throws InterruptedException {
        if (!device.isAppRunning()) {
            return RemediationResult.FAILED;
        }
        device.sendKeyEvent(KeyCodes.BACK);
        pause(1_000);
        device.sendKeyEvent(KeyCodes.DPAD_CENTER);
        return RemediationResult.PARTIAL;
    }

    private RemediationResult establishFocus() throws InterruptedException {
        if (!device.isAppRunning()) {
            return RemediationResult.FAILED;
        }
        device.sendKeyEvent(KeyCodes.DPAD_DOWN);
        pause(500);
        device.sendKeyEvent(KeyCodes.DPAD_UP);
        pause(500);
        device.sendKeyEvent(KeyCodes.DPAD_CENTER);
        return RemediationResult.PARTIAL;
    }

    private RemediationResult recoverUiElement(DetectedError error) throws InterruptedException {
        String element = Objects.requireNonNullElse(error.detail("missing_element"), "unknown");
        AppState state = AppState.fromTag(error.detail("app_state")).orElse(AppState.UNKNOWN);
        LOG.info("Fixing missing UI element: {} in state: {}", element, state.tag());

        if (!device.isAppRunning()) {
            LOG.warn("App not running, cannot fix missing UI element");
            return RemediationResult.FAILED;
        }
        boolean coreElement = ErrorClassifier.CORE_UI_ELEMENTS.contains(element);
        if (coreElement && (state == AppState.SETTINGS || state == AppState.LOADING
                || state == AppState.ERROR_WELCOME)) {
            LOG.info("Missing browser elements in {} state is expected", state.tag());
            return RemediationResult.SUCCESS;
        }
        if (coreElement && state == AppState.BROWSING) {
            LOG.warn("Browser elements missing in browsing state; returning to main content");
            device.sendKeyEvent(KeyCodes.BACK);
            pause(500);
            device.sendKeyEvent(KeyCodes.HOME);
            pause(1_000);
            device.sendKeyEvent(KeyCodes.DPAD_CENTER);
            pause(500);
            return RemediationResult.PARTIAL;
        }
        LOG.info("Attempting gentle navigation recovery");
        device.sendKeyEvent(KeyCodes.DPAD_DOWN);
        pause(300);
        device.sendKeyEvent(KeyCodes.DPAD_UP);
        pause(300);
        return RemediationResult.PARTIAL;
    }

    private RemediationResult launchApp() throws InterruptedException {
        if (device.startApp()) {
            pause(5_000);
            if (device.isAppRunning()) {
                return RemediationResult.SUCCESS;
            }
        }
        return RemediationResult.FAILED;
    }

    private RemediationResult navigateBack() throws InterruptedException {
        for (int i = 0; i < 3; i++) {
            device.sendKeyEvent(KeyCodes.BACK);
            pause(1_000);
        }
        return RemediationResult.PARTIAL;
    }

    private void pause(long millis) throws InterruptedException {
        pauser.pause(Duration.ofMillis(millis));
    }

    // ---- explicit procedures ----------------------------------------------------------

    /**
     * Heavy recovery that ignores cooldowns: stop, trim caches, reconnect, start and verify.
     *
     * @return true if the app is running afterwards
     */
    public boolean emergencyRecovery() {
        LOG.warn("Initiating emergency recovery procedure");
        try {
            device.forceStopApp();
            pause(3_000);
            device.runCommand("pm trim-caches " + props.getEmergencyTrimBudget());
            pause(2_000);
            if (!device.ensureConnection()) {
                LOG.error("Emergency recovery failed: device not reachable");
                return false;
            }
            if (!device.startApp()) {
                LOG.error("Emergency recovery failed: app did not start");
                return false;
            }
            pause(10_000);
            if (device.isAppRunning()) {
                LOG.info("Emergency recovery successful");
                return true;
            }
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.error("Emergency recovery interrupted");
            return false;
        } catch (RuntimeException e) {
            LOG.error("Emergency recovery failed: {}", e.toString());
            return false;
        }
    }

    /**
     * Passive upkeep independent of any error: device cache trim and an in-app memory trim.
     */
    public boolean scheduledMaintenance() {
        LOG.info("Performing scheduled maintenance");
        try {
            device.runCommand("pm trim-caches " + props.getMaintenanceTrimBudget());
            device.runCommand(TRIM_MEMORY_BROADCAST);
            return true;
        } catch (RuntimeException e) {
            LOG.error("Maintenance failed: {}", e.toString());
            return false;
        }
    }

    // ---- history ----------------------------------------------------------------------

    public List<RemediationOutcome> history() {
        return List.copyOf(history);
    }

    /** Number of recorded attempts whose timestamp falls within {@code window}. */
    public int attemptsWithin(Duration window) {
        Instant now = Instant.now();
        return (int) history.stream()
                .filter(o -> TimeUtils.within(o.timestamp(), window, now))
                .count();
    }

    public void trimHistory(int retained) {
        while (history.size() > Math.max(0, retained)) {
            history.removeFirst();
        }
    }

    public RemediationStatistics statistics() {
        int total = history.size();
        int successful = 0;
        Map<String, int[]> counts = new TreeMap<>();
        for (RemediationOutcome outcome : history) {
            int[] c = counts.computeIfAbsent(outcome.action(), a -> new int[2]);
            c[0]++;
            if (outcome.isSuccess()) {
                c[1]++;
                successful++;
            }
        }
        Map<String, RemediationStatistics.ActionCounts> fixTypes = new LinkedHashMap<>();
        counts.forEach((action, c) -> fixTypes.put(action, new RemediationStatistics.ActionCounts(c[0], c[1])));
        double rate = total == 0 ? 0.0 : successful * 100.0 / total;
        return new RemediationStatistics(total, rate, fixTypes, attemptsWithin(STATS_RECENT_WINDOW));
    }
}
