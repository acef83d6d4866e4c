package com.company.anomaly.repository;

import com.company.anomaly.domain.BaselineRecord;
import com.company.anomaly.domain.PeriodOfWeek;
import com.company.anomaly.domain.TimeSlot;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class GridCompletionTest {

    private static final Instant AT = Instant.parse("2024-01-08T09:00:00Z");

    @Test
    void everyCategoryGetsEveryPeriodSeen() {
        Set<TimeSlot> expected = GridCompletion.expectedSlots(List.of(
                TimeSlot.of("checkout-api", PeriodOfWeek.of(0, 10, 0)),
                TimeSlot.of("payments", PeriodOfWeek.of(0, 0, 1))), 2);

        // periods: 10:00, 09:45, 09:30, 00:15, 00:00
        assertThat(expected).hasSize(10);
        assertThat(expected).contains(
                TimeSlot.of("payments", PeriodOfWeek.of(0, 9, 3)),
                TimeSlot.of("checkout-api", PeriodOfWeek.of(0, 0, 0)));
    }

    @Test
    void completionIsIdempotentAndKeepsRealRecords() {
        InMemoryBaselineStore store = new InMemoryBaselineStore();
        TimeSlot observed = TimeSlot.of("checkout-api", PeriodOfWeek.of(0, 10, 0));
        store.upsert(observed, 42.0, 1, AT);

        int first = store.ensureGridComplete(List.of(observed), 3, AT);
        int second = store.ensureGridComplete(List.of(observed), 3, AT.plusSeconds(900));

        assertThat(first).isEqualTo(3);
        assertThat(second).isZero();
        BaselineRecord real = store.get(observed).orElseThrow();
        assertThat(real.getMean()).isEqualTo(42.0);
        assertThat(real.isPlaceholder()).isFalse();
    }

    @Test
    void firstRealValueReplacesPlaceholder() {
        InMemoryBaselineStore store = new InMemoryBaselineStore();
        TimeSlot observed = TimeSlot.of("checkout-api", PeriodOfWeek.of(0, 10, 0));
        store.ensureGridComplete(List.of(observed), 1, AT);

        store.upsert(observed, 8.0, 1, AT.plusSeconds(900));

        BaselineRecord record = store.get(observed).orElseThrow();
        assertThat(record.getMean()).isEqualTo(8.0);
        assertThat(record.getSampleCount()).isEqualTo(1);
        assertThat(record.isPlaceholder()).isFalse();
    }

    @Test
    void completenessIsMeasuredAgainstTheFullWeek() {
        assertThat(GridCompletion.completenessPercent(0, 0)).isEqualTo(100.0);
        assertThat(GridCompletion.completenessPercent(PeriodOfWeek.PERIODS_PER_WEEK, 1)).isEqualTo(100.0);
        assertThat(GridCompletion.completenessPercent(PeriodOfWeek.PERIODS_PER_WEEK, 2)).isEqualTo(50.0);
    }
}
