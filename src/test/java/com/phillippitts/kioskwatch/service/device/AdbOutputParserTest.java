package com.phillippitts.kioskwatch.service.device;

import com.phillippitts.kioskwatch.domain.DeviceInfo;
import com.phillippitts.kioskwatch.domain.MemoryUsage;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class AdbOutputParserTest {

    @Test
    void shouldParseDeviceRowsAndSkipHeader() {
        String out = "List of devices attached\n"
                + "10.0.0.5:5555\tdevice\n"
                + "emulator-5554\toffline\n"
                + "garbage line\n\n";

        List<DeviceInfo> devices = AdbOutputParser.parseDevices(out);

        assertThat(devices).extracting(DeviceInfo::deviceId).containsExactly("10.0.0.5:5555", "emulator-5554");
        assertThat(devices.get(0).isOnline()).isTrue();
        assertThat(devices.get(1).isOnline()).isFalse();
    }

    @Test
    void shouldReturnNoDevicesWhenOnlyHeaderPresent() {
        assertThat(AdbOutputParser.parseDevices("List of devices attached\n")).isEmpty();
        assertThat(AdbOutputParser.parseDevices(null)).isEmpty();
    }

    @Test
    void shouldRecognizeConnectSuccessMessages() {
        assertThat(AdbOutputParser.isConnectSuccess("connected to 10.0.0.5:5555")).isTrue();
        assertThat(AdbOutputParser.isConnectSuccess("already connected to 10.0.0.5:5555")).isTrue();
        assertThat(AdbOutputParser.isConnectSuccess("failed to connect to 10.0.0.5:5555")).isFalse();
        assertThat(AdbOutputParser.isConnectSuccess(null)).isFalse();
    }

    @Test
    void shouldParseMemoryCountersFromMeminfo() {
        String dump = """
                Applications Memory Usage (in Kilobytes):
                                   Pss  Private  Private  SwapPss     Heap     Heap     Heap
                                 Total    Dirty    Clean    Dirty     Size    Alloc     Free
                  Native Heap    12000    11000        0        0    40000    35000     5000
                  Dalvik Heap     8000     7000        0        0    16000    12000     4000
                         TOTAL PSS:   150000            TOTAL RSS:   210000
                """;

        Optional<MemoryUsage> usage = AdbOutputParser.parseMemoryUsage(dump);

        assertThat(usage).contains(new MemoryUsage(150000L, 35000L, 12000L));
    }

    @Test
    void shouldReturnEmptyWhenMeminfoHasNoCounters() {
        assertThat(AdbOutputParser.parseMemoryUsage("No process found for: com.example")).isEmpty();
        assertThat(AdbOutputParser.parseMemoryUsage("")).isEmpty();
    }

    @Test
    void shouldKeepPartialCountersWhenTotalMissing() {
        String dump = "  Native Heap    12000    11000        0        0    40000    35000     5000\n";

        assertThat(AdbOutputParser.parseMemoryUsage(dump)).contains(new MemoryUsage(null, 35000L, null));
    }

    @Test
    void shouldExtractPackageAndActivityFromCurrentFocus() {
        String out = "  mCurrentFocus=Window{3c1a2b u0 com.webviewer.firetv/com.webviewer.firetv.MainActivity}\n";

        assertThat(AdbOutputParser.parseCurrentFocus(out))
                .contains("com.webviewer.firetv/com.webviewer.firetv.MainActivity");
    }

    @Test
    void shouldReturnEmptyWhenNoFocusLine() {
        assertThat(AdbOutputParser.parseCurrentFocus("mFocusedApp=null")).isEmpty();
    }
}
