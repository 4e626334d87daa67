package com.lightwatch.notify;

import java.time.Duration;

public final class DurationFormatter {
    private DurationFormatter() {
    }

    public static String format(Duration duration) {
        long seconds = Math.max(0, duration.getSeconds());
        if (seconds < 60) {
            return seconds + "с";
        }
        if (seconds < 3600) {
            long mins = seconds / 60;
            long secs = seconds % 60;
            return secs > 0 ? mins + "хв " + secs + "с" : mins + "хв";
        }
        long hours = seconds / 3600;
        long mins = (seconds % 3600) / 60;
        return mins > 0 ? hours + "год " + mins + "хв" : hours + "год";
    }
}
