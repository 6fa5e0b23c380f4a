package com.phillippitts.kioskwatch.service.device;

import com.phillippitts.kioskwatch.config.properties.DeviceProperties;
import com.phillippitts.kioskwatch.domain.DeviceInfo;
import com.phillippitts.kioskwatch.domain.MemoryUsage;
import com.phillippitts.kioskwatch.exception.DeviceCommandException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link DeviceLink} that shells out to the {@code adb} binary.
 *
 * <p>Every shell command first makes sure the device is attached, reconnecting if it is
 * not. Process failures arrive as {@link DeviceCommandException} from
 * {@link AdbCommandRunner} and are logged and turned into {@code false}/empty here.
 */
@Component
public class AdbDeviceLink implements DeviceLink {

    private static final Logger LOG = LogManager.getLogger(AdbDeviceLink.class);

    private static final Duration SHORT_TIMEOUT = Duration.ofSeconds(5);

    private final AdbCommandRunner runner;
    private final DeviceProperties props;
    private final String deviceId;

    @Autowired
    public AdbDeviceLink(DeviceProperties props) {
        this(new AdbCommandRunner(new DefaultProcessFactory(), props.getAdbPath()), props);
    }

    AdbDeviceLink(AdbCommandRunner runner, DeviceProperties props) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.props = Objects.requireNonNull(props, "props");
        this.deviceId = props.deviceId();
    }

    @Override
    public boolean connect() {
        try {
            String out = runner.run(List.of("connect", deviceId), props.getConnectTimeout(), deviceId);
            if (AdbOutputParser.isConnectSuccess(out)) {
                LOG.info("Connected to {}", deviceId);
                return true;
            }
            LOG.error("Failed to connect to {}: {}", deviceId, out.strip());
            return false;
        } catch (DeviceCommandException e) {
            LOG.error("Connection error: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public boolean disconnect() {
        try {
            runner.run(List.of("disconnect", deviceId), SHORT_TIMEOUT, deviceId);
            LOG.info("Disconnected from {}", deviceId);
            return true;
        } catch (DeviceCommandException e) {
            LOG.error("Disconnect error: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public boolean isConnected() {
        return listDevices().stream()
                .anyMatch(d -> d.deviceId().equals(deviceId) && d.isOnline());
    }

    @Override
    public boolean ensureConnection() {
        if (isConnected()) {
            return true;
        }
        LOG.warn("Device {} not connected, attempting reconnection", deviceId);
        return connect();
    }

    @Override
    public List<DeviceInfo> listDevices() {
        try {
            return AdbOutputParser.parseDevices(runner.run(List.of("devices"), SHORT_TIMEOUT, deviceId));
        } catch (DeviceCommandException e) {
            LOG.error("Error listing devices: {}", e.getMessage());
            return List.of();
        }
    }

    @Override
    public Optional<DeviceInfo> getDeviceInfo() {
        if (!isConnected()) {
            return Optional.empty();
        }
        String model = runCommand("getprop ro.product.model").map(String::strip).orElse(null);
        String release = runCommand("getprop ro.build.version.release").map(String::strip).orElse(null);
        Integer apiLevel = runCommand("getprop ro.build.version.sdk")
                .map(String::strip)
                .filter(s -> !s.isEmpty() && s.chars().allMatch(Character::isDigit))
                .map(Integer::valueOf)
                .orElse(null);
        return Optional.of(new DeviceInfo(deviceId, "device", model, release, apiLevel));
    }

    @Override
    public Optional<String> runCommand(String command, Duration timeout) {
        if (!ensureConnection()) {
            return Optional.empty();
        }
        try {
            return Optional.of(runner.run(List.of("-s", deviceId, "shell", command), timeout, deviceId));
        } catch (DeviceCommandException e) {
            if (e.isTimedOut()) {
                LOG.error("Command timeout: {}", command);
            } else {
                LOG.error("Command failed: {}, error: {}", command, e.getMessage());
            }
            return Optional.empty();
        }
    }

    @Override
    public Optional<String> runCommand(String command) {
        return runCommand(command, props.getCommandTimeout());
    }

    @Override
    public boolean isAppInstalled() {
        return runCommand("pm list packages | grep " + props.getAppPackage())
                .filter(out -> out.contains(props.getAppPackage()))
                .isPresent();
    }

    @Override
    public boolean isAppRunning() {
        return runCommand("ps | grep " + props.getAppPackage())
                .filter(out -> out.contains(props.getAppPackage()))
                .isPresent();
    }

    @Override
    public boolean startApp() {
        String component = props.getAppPackage() + "/" + props.getAppActivity();
        return runCommand("am start -n " + component)
                .filter(out -> out.contains("Starting"))
                .isPresent();
    }

    @Override
    public boolean forceStopApp() {
        return runCommand("am force-stop " + props.getAppPackage()).isPresent();
    }

    @Override
    public boolean clearAppData() {
        return runCommand("pm clear " + props.getAppPackage())
                .filter(out -> out.contains("Success"))
                .isPresent();
    }

    @Override
    public boolean installPackage(Path apk) {
        try {
            String out = runner.run(List.of("-s", deviceId, "install", "-r", apk.toString()),
                    props.getInstallTimeout(), deviceId);
            return out.contains("Success");
        } catch (DeviceCommandException e) {
            LOG.error("Error installing {}: {}", apk, e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<MemoryUsage> getMemoryUsage() {
        return runCommand("dumpsys meminfo " + props.getAppPackage())
                .flatMap(AdbOutputParser::parseMemoryUsage);
    }

    @Override
    public boolean sendKeyEvent(int keyCode) {
        return runCommand("input keyevent " + keyCode).isPresent();
    }

    @Override
    public boolean sendTap(int x, int y) {
        return runCommand("input tap " + x + " " + y).isPresent();
    }

    @Override
    public Optional<String> getScreenDump() {
        return runCommand("uiautomator dump /dev/stdout")
                .filter(out -> !out.isBlank());
    }

    @Override
    public Optional<String> getCurrentActivity() {
        return runCommand("dumpsys window windows | grep mCurrentFocus")
                .flatMap(AdbOutputParser::parseCurrentFocus);
    }

    @Override
    public LogStream openLogStream() {
        Process process = runner.startStreaming(List.of("-s", deviceId, "logcat"), deviceId);
        LOG.info("Log stream opened for {}", deviceId);
        return new AdbLogStream(process, props.getLogQueueCapacity(), "logcat-reader");
    }
}
