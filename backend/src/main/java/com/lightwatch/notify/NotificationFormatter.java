package com.lightwatch.notify;

import com.lightwatch.domain.DailyStats;
import com.lightwatch.domain.TransitionNotice;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

public final class NotificationFormatter {
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm");
    private static final String UNKNOWN = "невідомо";

    private NotificationFormatter() {
    }

    public static String format(TransitionNotice notice) {
        String time = notice.occurredAt().atZone(ZoneId.of(notice.timezone())).format(TIME);
        String elapsed = notice.elapsed().map(DurationFormatter::format).orElse(UNKNOWN);

        StringBuilder text = new StringBuilder();
        if (notice.direction() == TransitionNotice.Direction.RECOVERED) {
            text.append("🟢 ").append(time).append(" Світло з'явилося\n")
                .append("🕓 Його не було ").append(elapsed);
        } else {
            text.append("🔴 ").append(time).append(" Світло зникло\n")
                .append("🕓 Воно було ").append(elapsed);
        }
        notice.stats().ifPresent(stats -> text.append('\n').append(summary(stats)));
        return text.toString();
    }

    static String summary(DailyStats stats) {
        return "📊 Сьогодні: світло було " + DurationFormatter.format(stats.uptime())
            + ", не було " + DurationFormatter.format(stats.downtime())
            + ", відключень: " + stats.outages();
    }
}
