package com.phillippitts.kioskwatch.service.remediate;

import com.phillippitts.kioskwatch.domain.ErrorKind;

/**
 * Corrective script chosen for an error kind. {@link #NONE} means no strategy is registered.
 */
public enum RemediationPlan {
    RESTART_APP,
    DISMISS_AND_RESTART,
    RELIEVE_MEMORY,
    RESTART_FOR_MEMORY,
    REFRESH_PAGE,
    REFRESH_OR_RESTART,
    OPEN_PROFILES,
    RESET_APP_DATA,
    RESET_FOCUS,
    ESTABLISH_FOCUS,
    RECOVER_UI_ELEMENT,
    LAUNCH_APP,
    NAVIGATE_BACK,
    NONE;

    public static RemediationPlan forKind(ErrorKind kind) {
        return switch (kind) {
            case APP_CRASH, LIFECYCLE_ERROR -> RESTART_APP;
            case ANR -> DISMISS_AND_RESTART;
            case HIGH_MEMORY_USAGE -> RELIEVE_MEMORY;
            case OUT_OF_MEMORY, POTENTIAL_MEMORY_LEAK -> RESTART_FOR_MEMORY;
            case NETWORK_ERROR -> REFRESH_PAGE;
            case WEBVIEW_ERROR -> REFRESH_OR_RESTART;
            case PROFILE_ERROR -> OPEN_PROFILES;
            case PREFERENCES_ERROR -> RESET_APP_DATA;
            case FOCUS_ERROR -> RESET_FOCUS;
            case NO_FOCUSED_ELEMENT -> ESTABLISH_FOCUS;
            case MISSING_UI_ELEMENT -> RECOVER_UI_ELEMENT;
            case APP_NOT_RUNNING -> LAUNCH_APP;
            case UNEXPECTED_ACTIVITY -> NAVIGATE_BACK;
            case PERMISSION_ERROR, RESOURCE_ERROR -> NONE;
        };
    }
}
