package com.company.anomaly.util;

import com.company.anomaly.domain.PeriodOfWeek;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.time.temporal.ChronoUnit;

public class TimeUtils {

    public static final Duration WINDOW = Duration.ofMinutes(PeriodOfWeek.MINUTES_PER_PERIOD);
    public static final Duration WEEK = Duration.ofDays(7);

    /**
     * Start of the quarter hour containing the instant
     */
    public static Instant alignToWindow(Instant instant) {
        if (instant == null) return null;

        Instant minute = instant.truncatedTo(ChronoUnit.MINUTES);
        long minuteOfHour = minute.atZone(ZoneOffset.UTC).getMinute();
        return minute.minus(Duration.ofMinutes(minuteOfHour % PeriodOfWeek.MINUTES_PER_PERIOD));
    }

    /**
     * Start of the most recent window that has fully closed at {@code now}
     */
    public static Instant lastCompleteWindowStart(Instant now) {
        if (now == null) return null;
        return alignToWindow(now).minus(WINDOW);
    }

    public static Instant windowEnd(Instant windowStart) {
        if (windowStart == null) return null;
        return windowStart.plus(WINDOW);
    }

    /**
     * Start of the window {@code periods} quarter hours earlier
     */
    public static Instant windowsBefore(Instant windowStart, int periods) {
        return windowStart.minus(WINDOW.multipliedBy(periods));
    }

    public static boolean isAligned(Instant instant) {
        return instant != null && instant.equals(alignToWindow(instant));
    }

    /**
     * Up to {@code count} earlier windows on the same local day as {@code windowStart}, nearest first,
     * each mapped to the period it falls in. Walks real instants, so clock changes skip or repeat
     * local periods instead of shifting them.
     */
    public static Map<Instant, PeriodOfWeek> sameDayWindowsBefore(Instant windowStart, int count, ZoneId zone) {
        Map<Instant, PeriodOfWeek> windows = new LinkedHashMap<>();
        LocalDate day = windowStart.atZone(zone).toLocalDate();
        for (int i = 1; i <= count; i++) {
            Instant earlier = windowsBefore(windowStart, i);
            if (!earlier.atZone(zone).toLocalDate().equals(day)) {
                break;
            }
            windows.put(earlier, PeriodOfWeek.at(earlier, zone));
        }
        return windows;
    }
}
