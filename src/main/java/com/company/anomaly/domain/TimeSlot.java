package com.company.anomaly.domain;

import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Coordinate every statistic is indexed by
 */
@Value(staticConstructor = "of")
public class TimeSlot {

    @NonNull
    String categoryKey;

    @NonNull
    PeriodOfWeek period;

    public static TimeSlot at(String categoryKey, Instant instant, ZoneId zone) {
        return of(categoryKey, PeriodOfWeek.at(instant, zone));
    }

    public TimeSlot withPeriod(PeriodOfWeek otherPeriod) {
        return of(categoryKey, otherPeriod);
    }

    @Override
    public String toString() {
        return categoryKey + "@" + period;
    }
}
