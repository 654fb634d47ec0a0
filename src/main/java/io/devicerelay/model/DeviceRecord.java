package io.devicerelay.model;

import java.util.List;

public record DeviceRecord(
        String deviceId,
        String userId,
        String deviceName,
        String deviceType,
        String platform,
        boolean online,
        Long lastSeenAtMs,
        List<String> capabilities,
        long createdAtMs
) {
}
