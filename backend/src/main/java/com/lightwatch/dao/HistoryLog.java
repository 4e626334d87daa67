package com.lightwatch.dao;

import com.lightwatch.domain.HistoryEvent;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface HistoryLog {

    /**
     * Events with {@code from <= timestamp <= to}, oldest first.
     */
    List<HistoryEvent> between(long deviceId, Instant from, Instant to);

    Optional<HistoryEvent> lastBefore(long deviceId, Instant before);

    /**
     * Most recent first.
     */
    List<HistoryEvent> latest(long deviceId, int limit);

    /**
     * Oldest first.
     */
    List<HistoryEvent> all(long deviceId);
}
