package com.lightwatch.domain;

import jakarta.annotation.Nullable;

public record HeartbeatResult(Outcome outcome,
                              @Nullable Long deviceId,
                              boolean transitioned) {

    public enum Outcome {
        ACCEPTED,
        INVALID_KEY
    }

    public static HeartbeatResult accepted(long deviceId, boolean transitioned) {
        return new HeartbeatResult(Outcome.ACCEPTED, deviceId, transitioned);
    }

    public static HeartbeatResult invalidKey() {
        return new HeartbeatResult(Outcome.INVALID_KEY, null, false);
    }

    public boolean accepted() {
        return outcome == Outcome.ACCEPTED;
    }
}
