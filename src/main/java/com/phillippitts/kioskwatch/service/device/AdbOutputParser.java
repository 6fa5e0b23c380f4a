package com.phillippitts.kioskwatch.service.device;

import com.phillippitts.kioskwatch.domain.DeviceInfo;
import com.phillippitts.kioskwatch.domain.MemoryUsage;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsers for adb command output. Malformed lines are skipped, never thrown.
 */
final class AdbOutputParser {

    private static final Pattern CURRENT_FOCUS = Pattern.compile("mCurrentFocus=.*\\{.*\\s([^\\s/]+)/([^\\s}]+)");

    private AdbOutputParser() {
    }

    /**
     * Parses {@code adb devices}: a header line followed by {@code <id>\t<state>} rows.
     */
    static List<DeviceInfo> parseDevices(String output) {
        List<DeviceInfo> devices = new ArrayList<>();
        if (output == null) {
            return devices;
        }
        String[] lines = output.strip().split("\n");
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i].strip();
            if (line.isEmpty()) {
                continue;
            }
            String[] parts = line.split("\t");
            if (parts.length == 2) {
                devices.add(DeviceInfo.of(parts[0].strip(), parts[1].strip()));
            }
        }
        return devices;
    }

    /** {@code adb connect} prints "connected to ..." or "already connected to ..." on success. */
    static boolean isConnectSuccess(String output) {
        return output != null && output.toLowerCase().contains("connected");
    }

    /**
     * Parses {@code dumpsys meminfo <package>}.
     *
     * <p>Total PSS is the first number on the line containing both {@code TOTAL} and
     * {@code PSS} (this covers both {@code TOTAL PSS: 123} and the older columnar
     * layout); native and dalvik heap come from the fourth column of their rows.
     *
     * @return counters, or empty when none could be read
     */
    static Optional<MemoryUsage> parseMemoryUsage(String output) {
        if (output == null || output.isBlank()) {
            return Optional.empty();
        }
        Long totalPss = null;
        Long nativeHeap = null;
        Long dalvikHeap = null;
        for (String line : output.split("\n")) {
            String[] parts = line.trim().split("\\s+");
            if (line.contains("TOTAL") && line.contains("PSS")) {
                totalPss = firstNumber(parts, totalPss);
            } else if (line.contains("Native Heap")) {
                nativeHeap = column(parts, 3, nativeHeap);
            } else if (line.contains("Dalvik Heap")) {
                dalvikHeap = column(parts, 3, dalvikHeap);
            }
        }
        MemoryUsage usage = new MemoryUsage(totalPss, nativeHeap, dalvikHeap);
        return usage.isEmpty() ? Optional.empty() : Optional.of(usage);
    }

    private static Long firstNumber(String[] parts, Long fallback) {
        for (int i = 1; i < parts.length; i++) {
            Long value = column(parts, i, null);
            if (value != null) {
                return value;
            }
        }
        return fallback;
    }

    private static Long column(String[] parts, int index, Long fallback) {
        if (parts.length <= index) {
            return fallback;
        }
        try {
            return Long.parseLong(parts[index]);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    /**
     * Extracts {@code package/activity} from the {@code mCurrentFocus} line of
     * {@code dumpsys window windows}.
     */
    static Optional<String> parseCurrentFocus(String output) {
        if (output == null) {
            return Optional.empty();
        }
        Matcher matcher = CURRENT_FOCUS.matcher(output);
        if (matcher.find()) {
            return Optional.of(matcher.group(1) + "/" + matcher.group(2));
        }
        return Optional.empty();
    }
}
