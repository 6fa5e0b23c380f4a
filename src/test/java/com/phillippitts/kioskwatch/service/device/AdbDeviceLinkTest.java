package com.phillippitts.kioskwatch.service.device;

import com.phillippitts.kioskwatch.config.properties.DeviceProperties;
import com.phillippitts.kioskwatch.domain.MemoryUsage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import static com.phillippitts.kioskwatch.service.device.DeviceTestDoubles.ProcessBehavior;
import static com.phillippitts.kioskwatch.service.device.DeviceTestDoubles.ScriptedProcessFactory;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class AdbDeviceLinkTest {

    private static final String DEVICE = "10.0.0.5:5555";
    private static final String ONLINE = "List of devices attached\n" + DEVICE + "\tdevice\n";
    private static final String NONE = "List of devices attached\n";

    private volatile String devicesOutput;
    private volatile String connectOutput;
    private final Map<String, ProcessBehavior> shell = new ConcurrentHashMap<>();
    private ScriptedProcessFactory factory;
    private AdbDeviceLink link;

    @BeforeEach
    void setUp() {
        devicesOutput = ONLINE;
        connectOutput = "connected to " + DEVICE;
        factory = new ScriptedProcessFactory(this::respond);
        DeviceProperties props = new DeviceProperties();
        props.setIp("10.0.0.5");
        props.setPort(5555);
        link = new AdbDeviceLink(new AdbCommandRunner(factory, "adb"), props);
    }

    private ProcessBehavior respond(List<String> cmd) {
        if (cmd.equals(List.of("adb", "devices"))) {
            return ProcessBehavior.ok(devicesOutput);
        }
        if (cmd.size() == 3 && cmd.get(1).equals("connect")) {
            if (connectOutput.startsWith("connected")) {
                devicesOutput = ONLINE;
            }
            return ProcessBehavior.ok(connectOutput);
        }
        if (cmd.size() == 5 && cmd.get(3).equals("shell")) {
            return shell.getOrDefault(cmd.get(4), ProcessBehavior.ok(""));
        }
        if (cmd.contains("logcat")) {
            return ProcessBehavior.ok("I/ActivityManager: start\nE/AndroidRuntime: FATAL EXCEPTION: main\n");
        }
        return ProcessBehavior.ok("");
    }

    private List<String> shellCommands() {
        return factory.commands().stream()
                .filter(c -> c.contains("shell"))
                .map(c -> c.get(c.size() - 1))
                .toList();
    }

    @Test
    void shouldReportConnectedWhenDeviceListedOnline() {
        assertThat(link.isConnected()).isTrue();

        devicesOutput = "List of devices attached\n" + DEVICE + "\toffline\n";
        assertThat(link.isConnected()).isFalse();
    }

    @Test
    void shouldFailConnectWhenAdbCannotReachDevice() {
        connectOutput = "failed to connect to '" + DEVICE + "': Connection refused";

        assertThat(link.connect()).isFalse();
    }

    @Test
    void shouldReconnectBeforeShellCommandWhenDeviceMissing() {
        // Arrange
        devicesOutput = NONE;
        shell.put("echo ok", ProcessBehavior.ok("ok"));

        // Act
        Optional<String> out = link.runCommand("echo ok", Duration.ofSeconds(2));

        // Assert
        assertThat(out).contains("ok");
        List<List<String>> commands = factory.commands();
        int connectIdx = commands.indexOf(List.of("adb", "connect", DEVICE));
        int shellIdx = commands.indexOf(List.of("adb", "-s", DEVICE, "shell", "echo ok"));
        assertThat(connectIdx).isNotNegative();
        assertThat(shellIdx).isGreaterThan(connectIdx);
    }

    @Test
    void shouldSkipShellCommandWhenReconnectFails() {
        devicesOutput = NONE;
        connectOutput = "failed to connect";

        assertThat(link.runCommand("echo ok")).isEmpty();
        assertThat(shellCommands()).isEmpty();
    }

    @Test
    void shouldReturnEmptyWhenShellCommandExitsNonZero() {
        shell.put("pm clear com.webviewer.firetv", ProcessBehavior.failing("boom", 255));

        assertThat(link.runCommand("pm clear com.webviewer.firetv")).isEmpty();
        assertThat(link.clearAppData()).isFalse();
    }

    @Test
    void shouldDetectRunningAppFromProcessList() {
        shell.put("ps | grep com.webviewer.firetv",
                ProcessBehavior.ok("u0_a42  1234  300  com.webviewer.firetv"));

        assertThat(link.isAppRunning()).isTrue();

        shell.put("ps | grep com.webviewer.firetv", ProcessBehavior.ok(""));
        assertThat(link.isAppRunning()).isFalse();
    }

    @Test
    void shouldStartAppWithConfiguredComponent() {
        shell.put("am start -n com.webviewer.firetv/com.webviewer.firetv.MainActivity",
                ProcessBehavior.ok("Starting: Intent { cmp=com.webviewer.firetv/.MainActivity }"));

        assertThat(link.startApp()).isTrue();
    }

    @Test
    void shouldRequireSuccessMarkerWhenClearingData() {
        shell.put("pm clear com.webviewer.firetv", ProcessBehavior.ok("Success"));

        assertThat(link.clearAppData()).isTrue();
    }

    @Test
    void shouldParseMemoryUsageFromDumpsys() {
        shell.put("dumpsys meminfo com.webviewer.firetv", ProcessBehavior.ok(
                "  Native Heap    12000    11000        0        0    40000    35000     5000\n"
                        + "  TOTAL PSS:   250000   TOTAL RSS:   300000\n"));

        Optional<MemoryUsage> usage = link.getMemoryUsage();

        assertThat(usage).isPresent();
        assertThat(usage.get().totalPssKb()).isEqualTo(250000L);
        assertThat(usage.get().nativeHeapKb()).isEqualTo(35000L);
    }

    @Test
    void shouldSendKeyAndTapAsInputCommands() {
        link.sendKeyEvent(KeyCodes.BACK);
        link.sendTap(100, 200);

        assertThat(shellCommands()).containsExactly("input keyevent 4", "input tap 100 200");
    }

    @Test
    void shouldReadCurrentActivityFromWindowDump() {
        shell.put("dumpsys window windows | grep mCurrentFocus", ProcessBehavior.ok(
                "  mCurrentFocus=Window{a1b2 u0 com.webviewer.firetv/com.webviewer.firetv.SettingsActivity}\n"));

        assertThat(link.getCurrentActivity()).contains("com.webviewer.firetv/com.webviewer.firetv.SettingsActivity");
    }

    @Test
    void shouldTreatBlankScreenDumpAsMissing() {
        shell.put("uiautomator dump /dev/stdout", ProcessBehavior.ok("   "));

        assertThat(link.getScreenDump()).isEmpty();
    }

    @Test
    void shouldStreamLogLinesUntilProcessEnds() {
        // Act
        LogStream stream = link.openLogStream();

        // Assert
        assertThat(stream.poll(Duration.ofSeconds(1))).contains("I/ActivityManager: start");
        assertThat(stream.poll(Duration.ofSeconds(1))).contains("E/AndroidRuntime: FATAL EXCEPTION: main");
        await().atMost(2, TimeUnit.SECONDS).until(stream::isFinished);
        assertThat(factory.lastCommand()).containsExactly("adb", "-s", DEVICE, "logcat");
        stream.close();
    }
}
