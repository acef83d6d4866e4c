package com.company.anomaly.repository;

import com.company.anomaly.domain.PeriodOfWeek;
import com.company.anomaly.domain.TimeSlot;
import com.company.anomaly.exception.StoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JdbcBaselineStoreTest {

    private static final Instant AT = Instant.parse("2024-01-08T09:00:00Z");
    private static final TimeSlot SLOT = TimeSlot.of("checkout-api", PeriodOfWeek.of(0, 10, 0));

    @Mock
    private JdbcTemplate jdbcTemplate;

    private JdbcBaselineStore store;

    @BeforeEach
    void setUp() {
        store = new JdbcBaselineStore(jdbcTemplate);
    }

    @Test
    void upsertIsASingleAtomicStatement() {
        store.upsert(SLOT, 15.0, 1, AT);

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(jdbcTemplate).update(sql.capture(), eq("checkout-api"), eq(0), eq(10), eq(0),
                eq(15.0), eq(1L), eq(Timestamp.from(AT)));
        assertThat(sql.getValue())
                .contains("ON CONFLICT (category_key, day_of_week, hour_of_day, quarter_hour)")
                .contains("DO UPDATE SET")
                .contains("WHEN baseline_records.placeholder THEN EXCLUDED.mean")
                .contains("ELSE " + JdbcBaselineStore.UPDATED_MEAN)
                .contains("ELSE " + JdbcBaselineStore.UPDATED_STDDEV);
    }

    @Test
    void upsertRejectsInvalidInput() {
        assertThatThrownBy(() -> store.upsert(SLOT, 15.0, 0, AT)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.upsert(SLOT, Double.NaN, 1, AT)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.upsert(SLOT, -1.0, 1, AT)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    void databaseFailureIsWrapped() {
        when(jdbcTemplate.update(anyString(), any(), any(), any(), any(), any(), any(), any()))
                .thenThrow(new QueryTimeoutException("statement timeout"));

        assertThatThrownBy(() -> store.upsert(SLOT, 15.0, 1, AT))
                .isInstanceOf(StoreException.class)
                .hasCauseInstanceOf(QueryTimeoutException.class);
    }

    @Test
    void gridCompletionCountsOnlyInsertedRows() {
        when(jdbcTemplate.batchUpdate(anyString(), anyList())).thenReturn(new int[]{1, 0, 1, 1});

        int inserted = store.ensureGridComplete(List.of(SLOT), 3, AT);

        assertThat(inserted).isEqualTo(3);
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(jdbcTemplate).batchUpdate(sql.capture(), anyList());
        assertThat(sql.getValue()).contains("ON CONFLICT").contains("DO NOTHING");
    }

    @Test
    void emptyGridNeedsNoStatement() {
        assertThat(store.ensureGridComplete(List.of(), 3, AT)).isZero();
        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    void completenessComesFromRecordAndCategoryCounts() {
        when(jdbcTemplate.queryForMap(anyString())).thenReturn(Map.of("records", 1008L, "categories", 3L));

        assertThat(store.gridCompleteness()).isEqualTo(50.0);
    }
}
