package com.lightwatch.service;

import com.lightwatch.dao.DeviceStore;
import com.lightwatch.dao.HistoryLog;
import com.lightwatch.domain.ChannelApi;
import com.lightwatch.domain.DailyStats;
import com.lightwatch.domain.Device;
import com.lightwatch.domain.DeviceStatus;
import com.lightwatch.domain.HistoryEvent;
import com.lightwatch.domain.PowerState;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import ru.tinkoff.kora.common.Component;

@Component
public final class DeviceQueryService {
    public static final int DEFAULT_HISTORY_LIMIT = 10;
    public static final int MAX_HISTORY_LIMIT = 200;

    private final DeviceStore deviceStore;
    private final HistoryLog historyLog;
    private final StatsAggregator statsAggregator;

    public DeviceQueryService(DeviceStore deviceStore, HistoryLog historyLog, StatsAggregator statsAggregator) {
        this.deviceStore = deviceStore;
        this.historyLog = historyLog;
        this.statsAggregator = statsAggregator;
    }

    public DeviceStatus currentState(long deviceId) {
        return DeviceStatus.of(requireDevice(deviceId));
    }

    public Optional<DailyStats> dailyStats(long deviceId, Instant asOf) {
        return statsAggregator.dailyStats(requireDevice(deviceId), asOf);
    }

    public ChannelApi.StatusResponse status(long deviceId, Instant asOf) {
        Device device = requireDevice(deviceId);
        ChannelApi.DailyStatsRecord today = statsAggregator.dailyStats(device, asOf)
            .map(ChannelApi.DailyStatsRecord::of)
            .orElse(null);
        return new ChannelApi.StatusResponse(
            device.id(),
            device.state().name(),
            device.paused(),
            device.timezone(),
            device.lastSeen(),
            device.lastChange(),
            today
        );
    }

    public List<ChannelApi.HistoryRecord> history(long deviceId, Integer limit) {
        requireDevice(deviceId);
        int bounded = limit == null ? DEFAULT_HISTORY_LIMIT : Math.max(1, Math.min(limit, MAX_HISTORY_LIMIT));

        List<ChannelApi.HistoryRecord> records = new ArrayList<>();
        Instant newer = null;
        for (HistoryEvent event : historyLog.latest(deviceId, bounded)) {
            Long duration = newer == null ? null : Duration.between(event.timestamp(), newer).getSeconds();
            records.add(new ChannelApi.HistoryRecord(event.state().name(), event.timestamp(), duration));
            newer = event.timestamp();
        }
        return records;
    }

    public List<ChannelApi.ExportRecord> export(long deviceId, Instant asOf) {
        Device device = requireDevice(deviceId);
        List<HistoryEvent> events = historyLog.all(deviceId);

        List<ChannelApi.ExportRecord> records = new ArrayList<>(events.size() + 1);
        for (int i = 0; i < events.size(); i++) {
            HistoryEvent event = events.get(i);
            Long duration = i + 1 < events.size()
                ? Duration.between(event.timestamp(), events.get(i + 1).timestamp()).getSeconds()
                : null;
            records.add(new ChannelApi.ExportRecord(event.state().name(), event.timestamp(), duration, false));
        }

        Instant openedAt = device.lastChange();
        if (openedAt == null) {
            records.add(new ChannelApi.ExportRecord(device.state().name(), asOf, null, true));
        } else {
            long openFor = Duration.between(openedAt, asOf).getSeconds();
            records.add(new ChannelApi.ExportRecord(device.state().name(), openedAt, openFor, true));
        }
        return records;
    }

    public ChannelApi.OverviewResponse overview(long ownerRef, Instant asOf) {
        List<Device> devices = deviceStore.findByOwner(ownerRef);
        List<ChannelApi.OverviewItem> online = new ArrayList<>();
        List<ChannelApi.OverviewItem> offline = new ArrayList<>();
        List<ChannelApi.OverviewItem> noData = new ArrayList<>();

        for (Device device : devices) {
            if (device.neverSeen()) {
                noData.add(new ChannelApi.OverviewItem(device.id(), device.timezone(), null));
                continue;
            }
            long since = Duration.between(device.lastSeen(), asOf).getSeconds();
            var item = new ChannelApi.OverviewItem(device.id(), device.timezone(), since);
            if (device.state() == PowerState.ON) {
                online.add(item);
            } else {
                offline.add(item);
            }
        }
        return new ChannelApi.OverviewResponse(devices.size(), online, offline, noData);
    }

    private Device requireDevice(long deviceId) {
        return deviceStore.findById(deviceId).orElseThrow(ApiException::deviceNotFound);
    }
}
