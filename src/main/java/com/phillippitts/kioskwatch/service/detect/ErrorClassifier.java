package com.phillippitts.kioskwatch.service.detect;

import com.phillippitts.kioskwatch.config.properties.DeviceProperties;
import com.phillippitts.kioskwatch.config.properties.MonitorProperties;
import com.phillippitts.kioskwatch.config.properties.UiMonitoringProperties;
import com.phillippitts.kioskwatch.domain.AppState;
import com.phillippitts.kioskwatch.domain.DetectedError;
import com.phillippitts.kioskwatch.domain.ErrorKind;
import com.phillippitts.kioskwatch.domain.ErrorSource;
import com.phillippitts.kioskwatch.domain.MemoryUsage;
import com.phillippitts.kioskwatch.domain.Severity;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw device signals into typed {@link DetectedError}s and keeps the error history the
 * escalation policy reads.
 *
 * <p>Signals:
 * <ul>
 *   <li>log lines, matched against an ordered rule list; every matching rule fires</li>
 *   <li>process state (running flag and foreground activity)</li>
 *   <li>memory counters, including a single-sample leak comparison</li>
 *   <li>UI hierarchy dumps (expected elements and focus)</li>
 * </ul>
 *
 * <p>Classification never throws: an input that fails to classify is logged at WARN and
 * yields no errors.
 *
 * <p>Not thread-safe. The history and the previous memory sample are owned by the monitor
 * loop, which is the only caller.
 */
@Component
public class ErrorClassifier {

    private static final Logger LOG = LogManager.getLogger(ErrorClassifier.class);

    /** Browser elements that are always on screen while a page is shown. */
    public static final List<String> CORE_UI_ELEMENTS = List.of("profilesButton", "webView", "browserToolbar");

    static final long HIGH_MEMORY_THRESHOLD_KB = 500_000L;
    static final Duration SUMMARY_WINDOW = Duration.ofHours(1);

    private static final List<String> RELEVANCE_KEYWORDS = List.of("fatal", "error", "exception", "crash", "anr");
    private static final String FOCUSED_MARKER = "focused=\"true\"";
    private static final int CRASH_TRACE_MAX_LINES = 20;

    private final String appPackage;
    private final UiMonitoringProperties uiProps;
    private final List<ErrorPattern> patterns;
    private final List<String> expectedActivities;
    private final ErrorHistory history;

    private Long previousTotalPssKb;

    public ErrorClassifier(DeviceProperties deviceProps,
                           UiMonitoringProperties uiProps,
                           MonitorProperties monitorProps) {
        this.appPackage = deviceProps.getAppPackage();
        this.uiProps = uiProps;
        this.patterns = buildPatterns(appPackage);
        this.expectedActivities = List.of(
                appPackage + ".MainActivity",
                appPackage + ".SettingsActivity",
                appPackage + ".ProfilesActivity",
                appPackage + ".ProfileEditActivity");
        this.history = new ErrorHistory(monitorProps.getErrorHistorySize());
        LOG.info("Classifier initialized: package={}, rules={}, historyCap={}",
                appPackage, patterns.size(), history.capacity());
    }

    private static List<ErrorPattern> buildPatterns(String pkg) {
        String quoted = Pattern.quote(pkg);
        List<ErrorPattern> list = new ArrayList<>();
        list.add(ErrorPattern.of(ErrorKind.APP_CRASH, "FATAL EXCEPTION.*" + quoted,
                Severity.CRITICAL, ErrorClassifier::extractCrash));
        list.add(ErrorPattern.of(ErrorKind.ANR, "ANR in " + quoted,
                Severity.HIGH, (m, text) -> details("anr_text", m.group(), "reason", "Application not responding")));
        list.add(ErrorPattern.of(ErrorKind.OUT_OF_MEMORY,
                "OutOfMemoryError|OOM|Low memory|GC_FOR_ALLOC", Severity.HIGH));
        list.add(ErrorPattern.of(ErrorKind.NETWORK_ERROR,
                "NetworkOnMainThreadException|ConnectException|SocketException|UnknownHostException",
                Severity.MEDIUM, (m, text) -> details("network_error", m.group(), "error_type", "connectivity")));
        list.add(ErrorPattern.of(ErrorKind.WEBVIEW_ERROR,
                "WebView.*error|onReceivedError|ERR_|Failed to load|net::ERR_",
                Severity.MEDIUM, (m, text) -> details("webview_error", m.group(), "component", "webview")));
        list.add(ErrorPattern.of(ErrorKind.PROFILE_ERROR,
                "ProfileManager.*error|Failed to.*profile|Profile.*not found", Severity.MEDIUM));
        list.add(ErrorPattern.of(ErrorKind.PREFERENCES_ERROR,
                "SharedPreferences.*error|Failed to save|Gson.*error", Severity.LOW));
        list.add(ErrorPattern.of(ErrorKind.FOCUS_ERROR,
                "Focus.*error|IllegalStateException.*focus|Unable to focus", Severity.LOW));
        list.add(ErrorPattern.of(ErrorKind.LIFECYCLE_ERROR,
                quoted + ".*IllegalStateException|Activity.*destroyed|Fragment.*destroyed", Severity.MEDIUM));
        list.add(ErrorPattern.of(ErrorKind.PERMISSION_ERROR,
                "SecurityException|Permission denied|ACCESS_DENIED", Severity.MEDIUM));
        list.add(ErrorPattern.of(ErrorKind.RESOURCE_ERROR,
                "ResourceNotFoundException|Unable to find resource|Resources\\$NotFoundException", Severity.LOW));
        return List.copyOf(list);
    }

    // ---- log source -------------------------------------------------------------------

    /**
     * Classifies one log line (or a short multi-line excerpt).
     *
     * <p>Only text that mentions the app package or one of the relevance keywords is matched
     * against the rules.
     */
    public List<DetectedError> analyzeLogLine(String line) {
        return safely("log line", () -> {
            if (line == null || !isRelevant(line)) {
                return List.of();
            }
            List<DetectedError> found = new ArrayList<>();
            Instant now = Instant.now();
            for (ErrorPattern pattern : patterns) {
                pattern.match(line).ifPresent(details -> found.add(new DetectedError(
                        pattern.kind(), pattern.severity(), pattern.kind().title() + " detected",
                        details, now, ErrorSource.LOG)));
            }
            return found;
        });
    }

    private boolean isRelevant(String line) {
        if (line.contains(appPackage)) {
            return true;
        }
        String lower = line.toLowerCase(Locale.ROOT);
        return RELEVANCE_KEYWORDS.stream().anyMatch(lower::contains);
    }

    /** Up to 20 non-blank lines from the first FATAL EXCEPTION marker, plus the exception class. */
    private static Map<String, Object> extractCrash(Matcher matcher, String text) {
        String[] lines = text.split("\n");
        int start = 0;
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].contains("FATAL EXCEPTION")) {
                start = i;
                break;
            }
        }
        List<String> trace = new ArrayList<>();
        for (int i = start; i < Math.min(start + CRASH_TRACE_MAX_LINES, lines.length); i++) {
            if (!lines[i].isBlank()) {
                trace.add(lines[i]);
            }
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("crash_trace", List.copyOf(trace));
        details.put("exception_type", exceptionType(trace));
        return details;
    }

    /** Class name before the first {@code Exception:} / {@code Error:} colon, or null. */
    static String exceptionType(List<String> trace) {
        for (String line : trace) {
            if (line.contains("Exception:") || line.contains("Error:")) {
                String[] parts = line.split(":");
                if (parts.length >= 2) {
                    String[] tokens = parts[0].trim().split("\\s+");
                    if (tokens.length > 0 && !tokens[tokens.length - 1].isEmpty()) {
                        return tokens[tokens.length - 1];
                    }
                }
            }
        }
        return null;
    }

    // ---- process source ---------------------------------------------------------------

    /**
     * Checks the process signal: a stopped app, or a foreground activity that is none of the
     * app's known screens.
     */
    public List<DetectedError> analyzeAppState(boolean running, String currentActivity) {
        return safely("app state", () -> {
            List<DetectedError> found = new ArrayList<>();
            Instant now = Instant.now();
            if (!running) {
                found.add(new DetectedError(ErrorKind.APP_NOT_RUNNING, Severity.HIGH,
                        "App is not running when it should be",
                        details("expected_state", "running", "actual_state", "stopped"),
                        now, ErrorSource.APP_STATE));
            }
            if (currentActivity != null && !currentActivity.isEmpty()
                    && expectedActivities.stream().noneMatch(currentActivity::contains)) {
                found.add(new DetectedError(ErrorKind.UNEXPECTED_ACTIVITY, Severity.LOW,
                        "App in unexpected activity: " + currentActivity,
                        details("current_activity", currentActivity, "expected_activities", expectedActivities),
                        now, ErrorSource.APP_STATE));
            }
            return found;
        });
    }

    // ---- memory source ----------------------------------------------------------------

    /**
     * Checks memory counters against the fixed threshold and against the previous sample.
     * The previous-sample slot is updated on every sample that carries a total PSS.
     *
     * @param usage counters, may be null when the probe failed
     */
    public List<DetectedError> analyzeMemoryUsage(MemoryUsage usage) {
        return safely("memory usage", () -> {
            if (usage == null || usage.totalPssKb() == null) {
                return List.of();
            }
            long total = usage.totalPssKb();
            List<DetectedError> found = new ArrayList<>();
            Instant now = Instant.now();
            if (total > HIGH_MEMORY_THRESHOLD_KB) {
                found.add(new DetectedError(ErrorKind.HIGH_MEMORY_USAGE, Severity.MEDIUM,
                        "High memory usage detected: " + total + "KB",
                        details("memory_usage_kb", total, "threshold_kb", HIGH_MEMORY_THRESHOLD_KB),
                        now, ErrorSource.MEMORY));
            }
            Long previous = previousTotalPssKb;
            // new > 1.5 x previous, in integer arithmetic
            if (previous != null && previous > 0 && total * 2 > previous * 3) {
                double increase = (total - previous) * 100.0 / previous;
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("previous_usage_kb", previous);
                details.put("current_usage_kb", total);
                details.put("increase_percentage", increase);
                found.add(new DetectedError(ErrorKind.POTENTIAL_MEMORY_LEAK, Severity.HIGH,
                        "Potential memory leak: " + previous + "KB -> " + total + "KB",
                        details, now, ErrorSource.MEMORY));
            }
            previousTotalPssKb = total;
            return found;
        });
    }

    // ---- UI source --------------------------------------------------------------------

    public AppState inferAppState(String dump) {
        return AppStateInference.infer(dump);
    }

    /**
     * Checks a UI dump for missing expected elements and a missing focus marker.
     */
    public List<DetectedError> analyzeUiDump(String dump) {
        return safely("UI dump", () -> {
            if (dump == null || dump.isEmpty()) {
                return List.of();
            }
            AppState state = inferAppState(dump);
            List<String> expected = expectedElements(state);
            List<DetectedError> found = new ArrayList<>();
            Instant now = Instant.now();
            for (String element : expected) {
                if (!dump.contains(element)) {
                    Map<String, Object> details = new LinkedHashMap<>();
                    details.put("missing_element", element);
                    details.put("app_state", state.tag());
                    details.put("expected_elements", expected);
                    found.add(new DetectedError(ErrorKind.MISSING_UI_ELEMENT, Severity.LOW,
                            "Missing UI element: " + element + " (state: " + state.tag() + ")",
                            details, now, ErrorSource.UI));
                }
            }
            UiMonitoringProperties.FocusMonitoring focus = uiProps.getFocusMonitoring();
            if (focus.isEnabled() && !focus.getIgnoreInStates().contains(state.tag())
                    && !dump.contains(FOCUSED_MARKER)) {
                found.add(new DetectedError(ErrorKind.NO_FOCUSED_ELEMENT, Severity.LOW,
                        "No focused UI element detected (state: " + state.tag() + ")",
                        details("app_state", state.tag()), now, ErrorSource.UI));
            }
            return found;
        });
    }

    /**
     * Elements expected on screen for a state.
     *
     * <p>With state-aware checking off, the three core elements. Otherwise the configured list
     * for the state (nothing if unconfigured), emptied for ignored states, and forced to the
     * core elements for {@code browsing} in strict mode.
     */
    public List<String> expectedElements(AppState state) {
        if (!uiProps.isStateAwareChecking()) {
            return CORE_UI_ELEMENTS;
        }
        List<String> expected = uiProps.getExpectedElementsByState().getOrDefault(state.tag(), List.of());
        if (uiProps.getIgnoreMissingElementsInStates().contains(state.tag())) {
            expected = List.of();
        }
        if (uiProps.isStrictElementChecking() && state == AppState.BROWSING) {
            expected = CORE_UI_ELEMENTS;
        }
        return List.copyOf(expected);
    }

    // ---- history ----------------------------------------------------------------------

    /** Appends to the bounded history. */
    public void record(DetectedError error) {
        history.add(error);
        LOG.error("Detected {} error: {} - {}", error.severity().tag(), error.kind().tag(), error.message());
    }

    /** Escalation gate; {@code error} is expected to be recorded already. */
    public boolean shouldEscalate(DetectedError error) {
        return EscalationPolicy.shouldEscalate(error, history, Instant.now());
    }

    public List<DetectedError> recentErrors(Duration window) {
        return history.recent(window, Instant.now());
    }

    public int historySize() {
        return history.size();
    }

    public void trimHistory(int retained) {
        int before = history.size();
        history.trimTo(retained);
        if (before != history.size()) {
            LOG.debug("Error history trimmed {} -> {}", before, history.size());
        }
    }

    /** Totals plus last-hour counts by kind and by severity. */
    public ErrorSummary summary() {
        List<DetectedError> recent = recentErrors(SUMMARY_WINDOW);
        Map<String, Integer> byKind = new TreeMap<>();
        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        for (Severity s : Severity.values()) {
            bySeverity.put(s, 0);
        }
        for (DetectedError e : recent) {
            byKind.merge(e.kind().tag(), 1, Integer::sum);
            bySeverity.merge(e.severity(), 1, Integer::sum);
        }
        Map<String, Integer> severityCounts = new LinkedHashMap<>();
        bySeverity.forEach((s, n) -> severityCounts.put(s.tag(), n));
        return new ErrorSummary(history.size(), recent.size(), byKind, severityCounts);
    }

    // ---- helpers ----------------------------------------------------------------------

    private List<DetectedError> safely(String input, Supplier<List<DetectedError>> classification) {
        try {
            return classification.get();
        } catch (RuntimeException e) {
            LOG.warn("Failed to classify {}; dropping it: {}", input, e.toString());
            return List.of();
        }
    }

    private static Map<String, Object> details(String k1, Object v1, String k2, Object v2) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(k1, v1);
        map.put(k2, v2);
        return map;
    }

    private static Map<String, Object> details(String k1, Object v1) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(k1, v1);
        return map;
    }
}
