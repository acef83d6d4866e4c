package com.company.anomaly.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Quarter-hour position within a week. Monday is day 0.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PeriodOfWeek implements Comparable<PeriodOfWeek> {

    public static final int MINUTES_PER_PERIOD = 15;
    public static final int PERIODS_PER_HOUR = 4;
    public static final int PERIODS_PER_DAY = 24 * PERIODS_PER_HOUR;
    public static final int PERIODS_PER_WEEK = 7 * PERIODS_PER_DAY;

    int dayOfWeek;
    int hour;
    int quarter;

    public static PeriodOfWeek of(int dayOfWeek, int hour, int quarter) {
        if (dayOfWeek < 0 || dayOfWeek > 6) {
            throw new IllegalArgumentException("dayOfWeek out of range [0..6]: " + dayOfWeek);
        }
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("hour out of range [0..23]: " + hour);
        }
        if (quarter < 0 || quarter > 3) {
            throw new IllegalArgumentException("quarter out of range [0..3]: " + quarter);
        }
        return new PeriodOfWeek(dayOfWeek, hour, quarter);
    }

    public static PeriodOfWeek ofIndex(int index) {
        if (index < 0 || index >= PERIODS_PER_WEEK) {
            throw new IllegalArgumentException("period index out of range: " + index);
        }
        int day = index / PERIODS_PER_DAY;
        int minuteOfDay = (index % PERIODS_PER_DAY) * MINUTES_PER_PERIOD;
        return new PeriodOfWeek(day, minuteOfDay / 60, (minuteOfDay % 60) / MINUTES_PER_PERIOD);
    }

    /**
     * Period containing the given instant, evaluated in the given zone
     */
    public static PeriodOfWeek at(Instant instant, ZoneId zone) {
        ZonedDateTime local = instant.atZone(zone);
        return new PeriodOfWeek(
                local.getDayOfWeek().getValue() - 1,
                local.getHour(),
                local.getMinute() / MINUTES_PER_PERIOD);
    }

    public int index() {
        return dayOfWeek * PERIODS_PER_DAY + hour * PERIODS_PER_HOUR + quarter;
    }

    public int minuteOfDay() {
        return hour * 60 + quarter * MINUTES_PER_PERIOD;
    }

    /**
     * Up to {@code count} preceding periods of the same day, nearest first.
     * Never crosses midnight, so the list is shorter early in the day.
     */
    public List<PeriodOfWeek> sameDayPredecessors(int count) {
        if (count <= 0) {
            return Collections.emptyList();
        }
        List<PeriodOfWeek> result = new ArrayList<>(count);
        int dayStart = dayOfWeek * PERIODS_PER_DAY;
        for (int i = 1; i <= count; i++) {
            int candidate = index() - i;
            if (candidate < dayStart) {
                break;
            }
            result.add(ofIndex(candidate));
        }
        return result;
    }

    @Override
    public int compareTo(PeriodOfWeek other) {
        return Integer.compare(index(), other.index());
    }

    @Override
    public String toString() {
        return String.format("%s %02d:%02d", DayOfWeek.of(dayOfWeek + 1), hour, quarter * MINUTES_PER_PERIOD);
    }
}
