package com.lightwatch.domain;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.List;
import ru.tinkoff.kora.json.common.annotation.Json;

public final class ChannelApi {
    private ChannelApi() {
    }

    @Json
    public record CreateChannelRequest(long channelId, long ownerRef, @Nullable String secretKey) {
    }

    @Json
    public record ChannelKeyResponse(long channelId, String secretKey, String pingUrl) {
    }

    @Json
    public record ReplaceKeyRequest(String secretKey) {
    }

    @Json
    public record TimezoneRequest(String timezone) {
    }

    @Json
    public record PausedRequest(boolean paused) {
    }

    @Json
    public record TransferRequest(long ownerRef) {
    }

    @Json
    public record DailyStatsRecord(Instant windowStart,
                                   Instant asOf,
                                   long uptimeSec,
                                   long downtimeSec,
                                   int outages) {

        public static DailyStatsRecord of(DailyStats stats) {
            return new DailyStatsRecord(
                stats.windowStart(),
                stats.asOf(),
                stats.uptime().getSeconds(),
                stats.downtime().getSeconds(),
                stats.outages()
            );
        }
    }

    @Json
    public record StatusResponse(long channelId,
                                 String state,
                                 boolean paused,
                                 String timezone,
                                 @Nullable Instant lastSeen,
                                 @Nullable Instant lastChange,
                                 @Nullable DailyStatsRecord today) {
    }

    @Json
    public record HistoryRecord(String state, Instant timestamp, @Nullable Long durationSec) {
    }

    @Json
    public record ExportRecord(String state, Instant timestamp, @Nullable Long durationSec, boolean synthetic) {
    }

    @Json
    public record OverviewItem(long channelId, String timezone, @Nullable Long secondsSinceLastSeen) {
    }

    @Json
    public record OverviewResponse(int total,
                                   List<OverviewItem> online,
                                   List<OverviewItem> offline,
                                   List<OverviewItem> noData) {
    }

    @Json
    public record MessageResponse(String message) {
    }
}
