package com.phillippitts.kioskwatch.service.device;

/**
 * Android key event codes used by remediation scripts.
 */
public final class KeyCodes {

    public static final int HOME = 3;
    public static final int BACK = 4;
    public static final int DPAD_UP = 19;
    public static final int DPAD_DOWN = 20;
    public static final int DPAD_RIGHT = 22;
    public static final int DPAD_CENTER = 23;

    private KeyCodes() {
    }
}
