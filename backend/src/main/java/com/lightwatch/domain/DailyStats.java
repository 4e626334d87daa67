package com.lightwatch.domain;

import java.time.Duration;
import java.time.Instant;

public record DailyStats(Instant windowStart,
                         Instant asOf,
                         Duration uptime,
                         Duration downtime,
                         int outages) {

    public Duration window() {
        return Duration.between(windowStart, asOf);
    }
}
