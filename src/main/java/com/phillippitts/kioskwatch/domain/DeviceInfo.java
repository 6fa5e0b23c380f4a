package com.phillippitts.kioskwatch.domain;

import org.json.JSONObject;

import java.util.Objects;

/**
 * A device as reported by {@code adb devices}, optionally enriched with build properties.
 *
 * @param deviceId       serial or {@code host:port}
 * @param state          adb state ({@code device}, {@code offline}, {@code unauthorized}, ...)
 * @param model          {@code ro.product.model}, may be null
 * @param androidVersion {@code ro.build.version.release}, may be null
 * @param apiLevel       {@code ro.build.version.sdk}, may be null
 */
public record DeviceInfo(
        String deviceId,
        String state,
        String model,
        String androidVersion,
        Integer apiLevel
) {

    public DeviceInfo {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(state, "state");
    }

    public static DeviceInfo of(String deviceId, String state) {
        return new DeviceInfo(deviceId, state, null, null, null);
    }

    public boolean isOnline() {
        return "device".equals(state);
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("device_id", deviceId);
        json.put("state", state);
        json.put("model", model == null ? JSONObject.NULL : model);
        json.put("android_version", androidVersion == null ? JSONObject.NULL : androidVersion);
        json.put("api_level", apiLevel == null ? JSONObject.NULL : apiLevel);
        return json;
    }
}
