package com.phillippitts.kioskwatch.service.detect;

import com.phillippitts.kioskwatch.domain.AppState;

import java.util.Locale;

/**
 * Infers the app's screen state from a UI hierarchy dump.
 *
 * <p>Checks run in priority order and the first hit wins: settings, loading, error_welcome,
 * browsing, unknown. A dump with settings markers is {@code settings} even when it also
 * contains loading or browsing markers.
 */
final class AppStateInference {

    private static final String HIDDEN = "visibility=\"gone\"";

    private AppStateInference() {
    }

    static AppState infer(String dump) {
        if (dump == null || dump.isEmpty()) {
            return AppState.UNKNOWN;
        }
        if (dump.contains("SettingsActivity") || dump.contains("ProfilesActivity")
                || dump.contains("ProfileEditActivity")) {
            return AppState.SETTINGS;
        }
        String lower = dump.toLowerCase(Locale.ROOT);
        if (lower.contains("loading") || lower.contains("progress")) {
            return AppState.LOADING;
        }
        if (dump.contains("welcomeContainer") && !dump.contains(HIDDEN)) {
            return AppState.ERROR_WELCOME;
        }
        if (dump.contains("webViewCard") && !dump.contains(HIDDEN)) {
            return AppState.BROWSING;
        }
        return AppState.UNKNOWN;
    }
}
