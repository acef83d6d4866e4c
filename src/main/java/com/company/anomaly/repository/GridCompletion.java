package com.company.anomaly.repository;

import com.company.anomaly.domain.PeriodOfWeek;
import com.company.anomaly.domain.TimeSlot;

import java.util.*;

/**
 * Which slots must exist so that references of the observed slots never hit a gap
 */
public final class GridCompletion {

    private GridCompletion() {
    }

    /**
     * Every category seen crossed with every period seen plus its same-day predecessors
     */
    public static Set<TimeSlot> expectedSlots(Collection<TimeSlot> slotsSeen, int sameDayWindowCount) {
        SortedSet<String> categories = new TreeSet<>();
        SortedSet<PeriodOfWeek> periods = new TreeSet<>();

        for (TimeSlot slot : slotsSeen) {
            categories.add(slot.getCategoryKey());
            periods.add(slot.getPeriod());
            periods.addAll(slot.getPeriod().sameDayPredecessors(sameDayWindowCount));
        }

        Set<TimeSlot> expected = new LinkedHashSet<>();
        for (String category : categories) {
            for (PeriodOfWeek period : periods) {
                expected.add(TimeSlot.of(category, period));
            }
        }
        return expected;
    }

    public static double completenessPercent(long records, long categories) {
        if (categories == 0) {
            return 100.0;
        }
        return Math.min(100.0, records * 100.0 / (categories * PeriodOfWeek.PERIODS_PER_WEEK));
    }
}
