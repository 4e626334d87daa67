package com.lightwatch.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.lightwatch.dao.InMemoryDeviceStore;
import com.lightwatch.domain.DailyStats;
import com.lightwatch.domain.Device;
import com.lightwatch.domain.PowerState;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class StatsAggregatorTest {
    private static final ZoneId KYIV = ZoneId.of("Europe/Kiev");

    private final InMemoryDeviceStore store = new InMemoryDeviceStore();
    private final StatsAggregator aggregator = new StatsAggregator(store);

    @Test
    void deviceWithoutAnyHeartbeatHasNoStats() {
        Device device = store.put(InMemoryDeviceStore.device(1, "h", PowerState.UNKNOWN, null, null));

        assertThat(aggregator.dailyStats(device, local("2024-06-15T12:00"))).isEmpty();
    }

    @Test
    void outageCarriedOverMidnightCountsAsOneOutage() {
        store.log(1, PowerState.ON, local("2024-06-13T09:00"));
        store.log(1, PowerState.OFF, local("2024-06-14T18:00"));
        store.log(1, PowerState.ON, local("2024-06-15T10:00"));
        Device device = store.put(InMemoryDeviceStore.device(1, "h", PowerState.ON,
            local("2024-06-15T10:00"), local("2024-06-15T10:00")));

        DailyStats stats = aggregator.dailyStats(device, local("2024-06-15T10:00")).orElseThrow();

        assertThat(stats.downtime()).isEqualTo(Duration.ofHours(10));
        assertThat(stats.uptime()).isEqualTo(Duration.ZERO);
        assertThat(stats.outages()).isEqualTo(1);
        assertThat(stats.windowStart()).isEqualTo(local("2024-06-15T00:00"));
    }

    @Test
    void shortOutageInsideLongUptimeKeepsTheWindowBalanced() {
        store.log(1, PowerState.ON, local("2024-06-13T12:00"));
        store.log(1, PowerState.OFF, local("2024-06-15T08:00"));
        store.log(1, PowerState.ON, local("2024-06-15T08:10"));
        Device device = store.put(InMemoryDeviceStore.device(1, "h", PowerState.ON,
            local("2024-06-15T08:59"), local("2024-06-15T08:10")));

        DailyStats stats = aggregator.dailyStats(device, local("2024-06-15T09:00")).orElseThrow();

        assertThat(stats.uptime()).isEqualTo(Duration.ofHours(8).plusMinutes(50));
        assertThat(stats.downtime()).isEqualTo(Duration.ofMinutes(10));
        assertThat(stats.outages()).isEqualTo(1);
        assertThat(stats.uptime().plus(stats.downtime())).isEqualTo(stats.window());
    }

    @Test
    void deviceSilentlyOnForDaysIsUpForTheWholeWindow() {
        store.log(1, PowerState.ON, local("2024-06-12T07:30"));
        Device device = store.put(InMemoryDeviceStore.device(1, "h", PowerState.ON,
            local("2024-06-15T13:59"), local("2024-06-12T07:30")));

        DailyStats stats = aggregator.dailyStats(device, local("2024-06-15T14:00")).orElseThrow();

        assertThat(stats.uptime()).isEqualTo(Duration.ofHours(14));
        assertThat(stats.downtime()).isEqualTo(Duration.ZERO);
        assertThat(stats.outages()).isZero();
    }

    @Test
    void firstEverEventTodayTreatsTheMorningAsDowntimeWithoutOutage() {
        store.log(1, PowerState.ON, local("2024-06-15T06:00"));
        Device device = store.put(InMemoryDeviceStore.device(1, "h", PowerState.ON,
            local("2024-06-15T07:59"), local("2024-06-15T06:00")));

        DailyStats stats = aggregator.dailyStats(device, local("2024-06-15T08:00")).orElseThrow();

        assertThat(stats.downtime()).isEqualTo(Duration.ofHours(6));
        assertThat(stats.uptime()).isEqualTo(Duration.ofHours(2));
        assertThat(stats.outages()).isZero();
    }

    @Test
    void everyOnToOffChangeTodayIsCounted() {
        store.log(1, PowerState.ON, local("2024-06-14T20:00"));
        store.log(1, PowerState.OFF, local("2024-06-15T01:00"));
        store.log(1, PowerState.ON, local("2024-06-15T02:00"));
        store.log(1, PowerState.OFF, local("2024-06-15T05:00"));
        store.log(1, PowerState.ON, local("2024-06-15T05:30"));
        store.log(1, PowerState.OFF, local("2024-06-15T11:00"));
        Device device = store.put(InMemoryDeviceStore.device(1, "h", PowerState.OFF,
            local("2024-06-15T10:56"), local("2024-06-15T11:00")));

        DailyStats stats = aggregator.dailyStats(device, local("2024-06-15T12:00")).orElseThrow();

        assertThat(stats.outages()).isEqualTo(3);
        assertThat(stats.uptime()).isEqualTo(Duration.ofHours(1).plusHours(3).plusMinutes(330));
        assertThat(stats.downtime()).isEqualTo(Duration.ofHours(1).plusMinutes(30).plusHours(1));
        assertThat(stats.uptime().plus(stats.downtime())).isEqualTo(Duration.ofHours(12));
    }

    @Test
    void windowFollowsLocalMidnightAcrossDaylightSavingShift() {
        store.log(1, PowerState.ON, local("2024-03-29T10:00"));
        Device device = store.put(InMemoryDeviceStore.device(1, "h", PowerState.ON,
            local("2024-03-31T11:59"), local("2024-03-29T10:00")));

        DailyStats stats = aggregator.dailyStats(device, local("2024-03-31T12:00")).orElseThrow();

        assertThat(stats.uptime()).isEqualTo(Duration.ofHours(11));
        assertThat(stats.window()).isEqualTo(Duration.ofHours(11));
    }

    @Test
    void statsDoNotChangeWhenOnlyAsOfIsRepeated() {
        store.log(1, PowerState.ON, local("2024-06-14T10:00"));
        store.log(1, PowerState.OFF, local("2024-06-15T03:00"));
        Device device = store.put(InMemoryDeviceStore.device(1, "h", PowerState.OFF,
            local("2024-06-15T03:00"), local("2024-06-15T03:00")));
        Instant asOf = local("2024-06-15T04:00");

        Optional<DailyStats> first = aggregator.dailyStats(device, asOf);
        Optional<DailyStats> second = aggregator.dailyStats(device, asOf);

        assertThat(first).isEqualTo(second);
    }

    @Test
    void localMidnightUsesDeviceZone() {
        Instant asOf = Instant.parse("2024-06-15T22:30:00Z");

        assertThat(StatsAggregator.localMidnight(asOf, KYIV)).isEqualTo(Instant.parse("2024-06-15T21:00:00Z"));
        assertThat(StatsAggregator.localMidnight(asOf, ZoneId.of("UTC"))).isEqualTo(Instant.parse("2024-06-15T00:00:00Z"));
    }

    private static Instant local(String dateTime) {
        return LocalDateTime.parse(dateTime).atZone(KYIV).toInstant();
    }
}
