package com.lightwatch.domain;

import java.time.Instant;

public record HistoryEvent(long deviceId, PowerState state, Instant timestamp) {
}
