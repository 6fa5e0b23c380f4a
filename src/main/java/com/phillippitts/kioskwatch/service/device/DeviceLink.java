package com.phillippitts.kioskwatch.service.device;

import com.phillippitts.kioskwatch.domain.DeviceInfo;
import com.phillippitts.kioskwatch.domain.MemoryUsage;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Capability interface over the device-management channel.
 *
 * <p>Every method blocks while the underlying command runs. Callers on the monitor loop must
 * off-load these calls to the device executor. Implementations never throw for transport
 * problems: failures surface as {@code false} or an empty result and are logged by the
 * implementation.
 *
 * <p>Implementations must be safe for concurrent use from the device pool threads.
 */
public interface DeviceLink {

    /** Connects to the configured device. */
    boolean connect();

    boolean disconnect();

    /** True when the device is attached and in the {@code device} state. */
    boolean isConnected();

    /**
     * Reconnects if the device is not connected.
     *
     * @return true if the device is connected afterwards
     */
    boolean ensureConnection();

    List<DeviceInfo> listDevices();

    /**
     * Device entry for the configured device, enriched with model and Android version.
     *
     * @return device info, or empty when the device is not attached
     */
    Optional<DeviceInfo> getDeviceInfo();

    /**
     * Runs a shell command on the device.
     *
     * @param command shell command line
     * @param timeout upper bound on the command's run time
     * @return stdout, or empty on failure, timeout or non-zero exit
     */
    Optional<String> runCommand(String command, Duration timeout);

    /** Runs a shell command with the configured default timeout. */
    Optional<String> runCommand(String command);

    boolean isAppInstalled();

    boolean isAppRunning();

    boolean startApp();

    boolean forceStopApp();

    /** Clears all app data. Destructive: stored profiles are removed too. */
    boolean clearAppData();

    boolean installPackage(Path apk);

    Optional<MemoryUsage> getMemoryUsage();

    boolean sendKeyEvent(int keyCode);

    boolean sendTap(int x, int y);

    /** UI hierarchy XML, or empty if the dump failed. */
    Optional<String> getScreenDump();

    /** Foreground window as {@code package/activity}, or empty if unknown. */
    Optional<String> getCurrentActivity();

    /**
     * Opens the device log stream. The caller owns the returned stream and must close it.
     *
     * @throws com.phillippitts.kioskwatch.exception.DeviceCommandException if the stream
     *         process cannot be started
     */
    LogStream openLogStream();
}
