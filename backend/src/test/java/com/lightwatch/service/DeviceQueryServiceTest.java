package com.lightwatch.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lightwatch.dao.InMemoryDeviceStore;
import com.lightwatch.domain.ChannelApi;
import com.lightwatch.domain.PowerState;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class DeviceQueryServiceTest {
    private static final Instant T0 = Instant.parse("2024-06-15T07:00:00Z");

    private final InMemoryDeviceStore store = new InMemoryDeviceStore();
    private final DeviceQueryService service = new DeviceQueryService(store, store, new StatsAggregator(store));

    @Test
    void neverSeenChannelIsUnknownWithoutStats() {
        store.put(InMemoryDeviceStore.device(1, "h1", PowerState.UNKNOWN, null, null));

        assertThat(service.currentState(1).state()).isEqualTo(PowerState.UNKNOWN);
        assertThat(service.dailyStats(1, T0)).isEmpty();
        assertThat(service.status(1, T0).today()).isNull();
    }

    @Test
    void historyIsNewestFirstWithDurations() {
        seedOutage();

        List<ChannelApi.HistoryRecord> history = service.history(1, null);

        assertThat(history).extracting(ChannelApi.HistoryRecord::state).containsExactly("ON", "OFF", "ON");
        assertThat(history.get(0).durationSec()).isNull();
        assertThat(history.get(1).durationSec()).isEqualTo(Duration.ofMinutes(10).getSeconds());
        assertThat(history.get(2).durationSec()).isEqualTo(Duration.ofHours(2).getSeconds());
        assertThat(service.history(1, 1)).hasSize(1);
        assertThat(service.history(1, 0)).hasSize(1);
    }

    @Test
    void exportAppendsTheOpenPeriod() {
        seedOutage();

        List<ChannelApi.ExportRecord> export = service.export(1, T0.plus(Duration.ofMinutes(20)));

        assertThat(export).hasSize(4);
        assertThat(export.get(0).durationSec()).isEqualTo(7200L);
        assertThat(export.get(2).durationSec()).isNull();
        ChannelApi.ExportRecord open = export.get(3);
        assertThat(open.synthetic()).isTrue();
        assertThat(open.state()).isEqualTo("ON");
        assertThat(open.durationSec()).isEqualTo(Duration.ofMinutes(20).getSeconds());
        assertThat(open.timestamp()).isEqualTo(T0);
        assertThat(open.timestamp().plusSeconds(open.durationSec())).isEqualTo(T0.plus(Duration.ofMinutes(20)));
    }

    @Test
    void exportOfNeverSeenChannelHasOpenRecordWithoutDuration() {
        store.put(InMemoryDeviceStore.device(1, "h1", PowerState.UNKNOWN, null, null));

        List<ChannelApi.ExportRecord> export = service.export(1, T0);

        assertThat(export).hasSize(1);
        assertThat(export.get(0).state()).isEqualTo("UNKNOWN");
        assertThat(export.get(0).timestamp()).isEqualTo(T0);
        assertThat(export.get(0).durationSec()).isNull();
        assertThat(export.get(0).synthetic()).isTrue();
    }

    @Test
    void overviewGroupsChannelsByState() {
        store.put(InMemoryDeviceStore.device(1, "h1", PowerState.ON, T0, T0));
        store.put(InMemoryDeviceStore.device(2, "h2", PowerState.OFF, T0.minusSeconds(900), T0.minusSeconds(900)));
        store.put(InMemoryDeviceStore.device(3, "h3", PowerState.UNKNOWN, null, null));

        ChannelApi.OverviewResponse overview = service.overview(1, T0.plusSeconds(60));

        assertThat(overview.total()).isEqualTo(3);
        assertThat(overview.online()).extracting(ChannelApi.OverviewItem::channelId).containsExactly(1L);
        assertThat(overview.online().get(0).secondsSinceLastSeen()).isEqualTo(60L);
        assertThat(overview.offline()).extracting(ChannelApi.OverviewItem::channelId).containsExactly(2L);
        assertThat(overview.noData()).extracting(ChannelApi.OverviewItem::channelId).containsExactly(3L);
    }

    @Test
    void missingChannelIsReported() {
        assertThatThrownBy(() -> service.status(9, T0)).hasMessageContaining("device_not_found");
    }

    private void seedOutage() {
        Instant on = T0.minus(Duration.ofHours(2)).minus(Duration.ofMinutes(10));
        store.log(1, PowerState.ON, on);
        store.log(1, PowerState.OFF, T0.minus(Duration.ofMinutes(10)));
        store.log(1, PowerState.ON, T0);
        store.put(InMemoryDeviceStore.device(1, "h1", PowerState.ON, T0.plusSeconds(60), T0));
    }
}
