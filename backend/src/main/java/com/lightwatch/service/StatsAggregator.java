package com.lightwatch.service;

import com.lightwatch.dao.HistoryLog;
import com.lightwatch.domain.DailyStats;
import com.lightwatch.domain.Device;
import com.lightwatch.domain.HistoryEvent;
import com.lightwatch.domain.PowerState;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import ru.tinkoff.kora.common.Component;

@Component
public final class StatsAggregator {
    private final HistoryLog historyLog;

    public StatsAggregator(HistoryLog historyLog) {
        this.historyLog = historyLog;
    }

    public Optional<DailyStats> dailyStats(Device device, Instant asOf) {
        Instant midnight = localMidnight(asOf, device.zone());
        List<HistoryEvent> today = historyLog.between(device.id(), midnight, asOf);
        Optional<HistoryEvent> carried = historyLog.lastBefore(device.id(), midnight);

        if (today.isEmpty() && carried.isEmpty() && device.lastChange() == null) {
            return Optional.empty();
        }

        PowerState opening = carried
            .map(HistoryEvent::state)
            .orElseGet(() -> today.isEmpty() ? device.state() : PowerState.UNKNOWN);

        Duration uptime = Duration.ZERO;
        Duration downtime = Duration.ZERO;
        int outages = opening == PowerState.OFF ? 1 : 0;

        PowerState current = opening;
        Instant cursor = midnight;
        for (HistoryEvent event : today) {
            Duration span = span(cursor, event.timestamp());
            if (current == PowerState.ON) {
                uptime = uptime.plus(span);
                if (event.state() == PowerState.OFF) {
                    outages++;
                }
            } else {
                downtime = downtime.plus(span);
            }
            current = event.state();
            cursor = event.timestamp();
        }

        Duration trailing = span(cursor, asOf);
        if (current == PowerState.ON) {
            uptime = uptime.plus(trailing);
        } else {
            downtime = downtime.plus(trailing);
        }

        return Optional.of(new DailyStats(midnight, asOf, uptime, downtime, outages));
    }

    public static Instant localMidnight(Instant asOf, ZoneId zone) {
        return asOf.atZone(zone).toLocalDate().atStartOfDay(zone).toInstant();
    }

    private static Duration span(Instant from, Instant to) {
        return to.isAfter(from) ? Duration.between(from, to) : Duration.ZERO;
    }
}
