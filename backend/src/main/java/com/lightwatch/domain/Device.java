package com.lightwatch.domain;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.time.ZoneId;

public record Device(long id,
                     @Nullable Long ownerRef,
                     String secretHash,
                     byte[] encryptedSecret,
                     String timezone,
                     boolean paused,
                     PowerState state,
                     @Nullable Instant lastSeen,
                     @Nullable Instant lastChange,
                     Instant createdAt) {

    public ZoneId zone() {
        return ZoneId.of(timezone);
    }

    public boolean neverSeen() {
        return lastSeen == null;
    }
}
