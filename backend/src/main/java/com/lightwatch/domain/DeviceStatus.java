package com.lightwatch.domain;

import jakarta.annotation.Nullable;
import java.time.Instant;

public record DeviceStatus(long deviceId,
                           PowerState state,
                           boolean paused,
                           String timezone,
                           @Nullable Instant lastSeen,
                           @Nullable Instant lastChange) {

    public static DeviceStatus of(Device device) {
        return new DeviceStatus(
            device.id(),
            device.state(),
            device.paused(),
            device.timezone(),
            device.lastSeen(),
            device.lastChange()
        );
    }
}
