package com.lightwatch.domain;

import jakarta.annotation.Nullable;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

public record TransitionNotice(long deviceId,
                               Direction direction,
                               Instant occurredAt,
                               @Nullable Duration elapsedSincePriorChange,
                               @Nullable DailyStats dailyStats,
                               String timezone) {

    public enum Direction {
        RECOVERED,
        LOST
    }

    public Optional<Duration> elapsed() {
        return Optional.ofNullable(elapsedSincePriorChange);
    }

    public Optional<DailyStats> stats() {
        return Optional.ofNullable(dailyStats);
    }
}
