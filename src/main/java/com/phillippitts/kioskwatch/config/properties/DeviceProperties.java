package com.phillippitts.kioskwatch.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Device and monitored-app coordinates (prefix {@code monitor.device}).
 */
@ConfigurationProperties(prefix = "monitor.device")
@Validated
public class DeviceProperties {

    @NotBlank
    private String ip = "192.168.4.94";

    @Positive
    @Max(65535)
    private int port = 5555;

    /** adb executable; resolved through PATH when not absolute. */
    @NotBlank
    private String adbPath = "adb";

    @NotBlank
    private String appPackage = "com.webviewer.firetv";

    @NotBlank
    private String appActivity = "com.webviewer.firetv.MainActivity";

    /** Default timeout for {@code adb shell} commands. */
    @NotNull
    private Duration commandTimeout = Duration.ofSeconds(30);

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(10);

    @NotNull
    private Duration installTimeout = Duration.ofSeconds(60);

    /** Lines buffered between the logcat reader thread and the tailer. */
    @Positive
    private int logQueueCapacity = 10_000;

    /** adb target id, {@code ip:port}. */
    public String deviceId() {
        return ip + ":" + port;
    }

    public String getIp() {
        return ip;
    }

    public void setIp(String ip) {
        this.ip = ip;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getAdbPath() {
        return adbPath;
    }

    public void setAdbPath(String adbPath) {
        this.adbPath = adbPath;
    }

    public String getAppPackage() {
        return appPackage;
    }

    public void setAppPackage(String appPackage) {
        this.appPackage = appPackage;
    }

    public String getAppActivity() {
        return appActivity;
    }

    public void setAppActivity(String appActivity) {
        this.appActivity = appActivity;
    }

    public Duration getCommandTimeout() {
        return commandTimeout;
    }

    public void setCommandTimeout(Duration commandTimeout) {
        this.commandTimeout = commandTimeout;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getInstallTimeout() {
        return installTimeout;
    }

    public void setInstallTimeout(Duration installTimeout) {
        this.installTimeout = installTimeout;
    }

    public int getLogQueueCapacity() {
        return logQueueCapacity;
    }

    public void setLogQueueCapacity(int logQueueCapacity) {
        this.logQueueCapacity = logQueueCapacity;
    }
}
