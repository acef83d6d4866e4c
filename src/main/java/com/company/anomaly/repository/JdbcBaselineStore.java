package com.company.anomaly.repository;

import com.company.anomaly.domain.BaselineRecord;
import com.company.anomaly.domain.BaselineSample;
import com.company.anomaly.domain.PeriodOfWeek;
import com.company.anomaly.domain.TimeSlot;
import com.company.anomaly.exception.StoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.*;

/**
 * PostgreSQL baseline store. Every write is a single statement, so concurrent cycles
 * are serialized by the row lock of {@code ON CONFLICT}.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class JdbcBaselineStore implements BaselineStore {

    private static final int SLOT_CHUNK_SIZE = 500;

    private static final String RECORD_COLUMNS = """
            category_key, day_of_week, hour_of_day, quarter_hour,
            mean, stddev, sample_count, placeholder, last_updated
            """;

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Optional<BaselineRecord> get(TimeSlot slot) {
        String sql = "SELECT " + RECORD_COLUMNS + """
            FROM baseline_records
            WHERE category_key = ? AND day_of_week = ? AND hour_of_day = ? AND quarter_hour = ?
            """;

        try {
            List<BaselineRecord> results = jdbcTemplate.query(sql, new BaselineRecordRowMapper(),
                    slot.getCategoryKey(), slot.getPeriod().getDayOfWeek(),
                    slot.getPeriod().getHour(), slot.getPeriod().getQuarter());
            return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
        } catch (DataAccessException e) {
            log.error("Failed to read baseline record for slot {}", slot, e);
            throw new StoreException("Failed to read baseline record", e);
        }
    }

    @Override
    public List<BaselineRecord> findAll(Collection<TimeSlot> slots) {
        List<BaselineRecord> results = new ArrayList<>();
        for (List<TimeSlot> chunk : chunks(slots)) {
            String sql = "SELECT " + RECORD_COLUMNS
                    + " FROM baseline_records WHERE (category_key, day_of_week, hour_of_day, quarter_hour) IN ("
                    + tuplePlaceholders(chunk.size()) + ")";
            try {
                results.addAll(jdbcTemplate.query(sql, new BaselineRecordRowMapper(), slotParams(chunk)));
            } catch (DataAccessException e) {
                log.error("Failed to read {} baseline records", chunk.size(), e);
                throw new StoreException("Failed to read baseline records", e);
            }
        }
        return results;
    }

    @Override
    public List<BaselineRecord> findByCategory(String categoryKey) {
        String sql = "SELECT " + RECORD_COLUMNS + """
            FROM baseline_records
            WHERE category_key = ?
            ORDER BY day_of_week, hour_of_day, quarter_hour
            """;

        try {
            return jdbcTemplate.query(sql, new BaselineRecordRowMapper(), categoryKey);
        } catch (DataAccessException e) {
            log.error("Failed to read baseline records for category {}", categoryKey, e);
            throw new StoreException("Failed to read baseline records", e);
        }
    }

    @Override
    public List<BaselineRecord> findUpdatedBetween(Instant from, Instant to) {
        String sql = "SELECT " + RECORD_COLUMNS + """
            FROM baseline_records
            WHERE last_updated >= ? AND last_updated < ?
            ORDER BY last_updated DESC
            """;

        try {
            return jdbcTemplate.query(sql, new BaselineRecordRowMapper(),
                    Timestamp.from(from), Timestamp.from(to));
        } catch (DataAccessException e) {
            log.error("Failed to read baseline records updated between {} and {}", from, to, e);
            throw new StoreException("Failed to read baseline records", e);
        }
    }

    // Weighted Welford step over the old row and the EXCLUDED row. Every SET expression sees
    // the old row, so the updated mean is inlined where the stddev needs it.
    static final String UPDATED_MEAN = """
            baseline_records.mean
                            + EXCLUDED.sample_count * (EXCLUDED.mean - baseline_records.mean)
                              / (baseline_records.sample_count + EXCLUDED.sample_count)""";

    static final String UPDATED_STDDEV = """
            SQRT(GREATEST(0, (
                            baseline_records.stddev * baseline_records.stddev * baseline_records.sample_count
                            + EXCLUDED.sample_count * (EXCLUDED.mean - baseline_records.mean)
                              * (EXCLUDED.mean - (%s))
                        ) / (baseline_records.sample_count + EXCLUDED.sample_count)))""".formatted(UPDATED_MEAN);

    /**
     * Single statement, so concurrent writers serialize on the row lock. A placeholder row
     * is replaced outright.
     */
    @Override
    public void upsert(TimeSlot slot, double value, int sampleWeight, Instant at) {
        if (sampleWeight < 1) {
            throw new IllegalArgumentException("sampleWeight must be >= 1");
        }
        if (value < 0 || Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("baseline value must be a finite number >= 0: " + value);
        }

        String sql = """
            INSERT INTO baseline_records (
                category_key, day_of_week, hour_of_day, quarter_hour,
                mean, stddev, sample_count, placeholder, last_updated
            ) VALUES (?, ?, ?, ?, ?, 0, ?, FALSE, ?)
            ON CONFLICT (category_key, day_of_week, hour_of_day, quarter_hour)
            DO UPDATE SET
                mean = CASE WHEN baseline_records.placeholder THEN EXCLUDED.mean
                    ELSE %s
                    END,
                stddev = CASE WHEN baseline_records.placeholder THEN 0
                    ELSE %s
                    END,
                sample_count = CASE WHEN baseline_records.placeholder THEN EXCLUDED.sample_count
                    ELSE baseline_records.sample_count + EXCLUDED.sample_count
                    END,
                placeholder = FALSE,
                last_updated = GREATEST(baseline_records.last_updated, EXCLUDED.last_updated)
            """.formatted(UPDATED_MEAN, UPDATED_STDDEV);

        try {
            jdbcTemplate.update(sql,
                    slot.getCategoryKey(),
                    slot.getPeriod().getDayOfWeek(),
                    slot.getPeriod().getHour(),
                    slot.getPeriod().getQuarter(),
                    value,
                    (long) sampleWeight,
                    Timestamp.from(at));
        } catch (DataAccessException e) {
            log.error("Failed to upsert baseline for slot {}", slot, e);
            throw new StoreException("Failed to update baseline record", e);
        }
    }

    @Override
    public void appendSample(TimeSlot slot, Instant windowStart, double value) {
        String sql = """
            INSERT INTO baseline_samples (
                category_key, day_of_week, hour_of_day, quarter_hour, window_start, sample_value
            ) VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT (category_key, window_start) DO NOTHING
            """;

        try {
            jdbcTemplate.update(sql,
                    slot.getCategoryKey(),
                    slot.getPeriod().getDayOfWeek(),
                    slot.getPeriod().getHour(),
                    slot.getPeriod().getQuarter(),
                    Timestamp.from(windowStart),
                    value);
        } catch (DataAccessException e) {
            log.error("Failed to append sample for slot {} at {}", slot, windowStart, e);
            throw new StoreException("Failed to append baseline sample", e);
        }
    }

    @Override
    public List<BaselineSample> findSamples(Collection<TimeSlot> slots, Instant since) {
        List<BaselineSample> results = new ArrayList<>();
        for (List<TimeSlot> chunk : chunks(slots)) {
            String sql = """
                SELECT category_key, day_of_week, hour_of_day, quarter_hour, window_start, sample_value
                FROM baseline_samples
                WHERE window_start >= ?
                AND (category_key, day_of_week, hour_of_day, quarter_hour) IN (%s)
                ORDER BY window_start DESC
                """.formatted(tuplePlaceholders(chunk.size()));

            Object[] slotParams = slotParams(chunk);
            Object[] params = new Object[slotParams.length + 1];
            params[0] = Timestamp.from(since);
            System.arraycopy(slotParams, 0, params, 1, slotParams.length);

            try {
                results.addAll(jdbcTemplate.query(sql, new BaselineSampleRowMapper(), params));
            } catch (DataAccessException e) {
                log.error("Failed to read baseline samples since {}", since, e);
                throw new StoreException("Failed to read baseline samples", e);
            }
        }
        return results;
    }

    @Override
    public int ensureGridComplete(Collection<TimeSlot> slotsSeen, int sameDayWindowCount, Instant at) {
        Set<TimeSlot> expected = GridCompletion.expectedSlots(slotsSeen, sameDayWindowCount);
        if (expected.isEmpty()) {
            return 0;
        }

        String sql = """
            INSERT INTO baseline_records (
                category_key, day_of_week, hour_of_day, quarter_hour,
                mean, stddev, sample_count, placeholder, last_updated
            ) VALUES (?, ?, ?, ?, 0, 0, 1, TRUE, ?)
            ON CONFLICT (category_key, day_of_week, hour_of_day, quarter_hour) DO NOTHING
            """;

        List<Object[]> batch = new ArrayList<>(expected.size());
        Timestamp timestamp = Timestamp.from(at);
        for (TimeSlot slot : expected) {
            batch.add(new Object[]{
                    slot.getCategoryKey(),
                    slot.getPeriod().getDayOfWeek(),
                    slot.getPeriod().getHour(),
                    slot.getPeriod().getQuarter(),
                    timestamp
            });
        }

        try {
            int inserted = 0;
            for (int count : jdbcTemplate.batchUpdate(sql, batch)) {
                if (count > 0) {
                    inserted += count;
                }
            }
            if (inserted > 0) {
                log.info("Grid completion inserted {} placeholders ({} slots checked)", inserted, expected.size());
            }
            return inserted;
        } catch (DataAccessException e) {
            log.error("Failed to complete baseline grid for {} slots", expected.size(), e);
            throw new StoreException("Failed to complete baseline grid", e);
        }
    }

    @Override
    public Set<String> knownCategories() {
        try {
            return new TreeSet<>(jdbcTemplate.queryForList(
                    "SELECT DISTINCT category_key FROM baseline_records", String.class));
        } catch (DataAccessException e) {
            log.error("Failed to list known categories", e);
            throw new StoreException("Failed to list known categories", e);
        }
    }

    @Override
    public double gridCompleteness() {
        String sql = """
            SELECT COUNT(*) AS records, COUNT(DISTINCT category_key) AS categories
            FROM baseline_records
            """;

        try {
            Map<String, Object> row = jdbcTemplate.queryForMap(sql);
            return GridCompletion.completenessPercent(
                    ((Number) row.get("records")).longValue(),
                    ((Number) row.get("categories")).longValue());
        } catch (DataAccessException e) {
            log.error("Failed to compute grid completeness", e);
            throw new StoreException("Failed to compute grid completeness", e);
        }
    }

    @Override
    public int purgeSamplesBefore(Instant cutoff) {
        try {
            return jdbcTemplate.update("DELETE FROM baseline_samples WHERE window_start < ?",
                    Timestamp.from(cutoff));
        } catch (DataAccessException e) {
            log.error("Failed to purge baseline samples before {}", cutoff, e);
            throw new StoreException("Failed to purge baseline samples", e);
        }
    }

    @Override
    public int purgeRecordsNotUpdatedSince(Instant cutoff) {
        try {
            return jdbcTemplate.update("DELETE FROM baseline_records WHERE last_updated < ?",
                    Timestamp.from(cutoff));
        } catch (DataAccessException e) {
            log.error("Failed to purge baseline records not updated since {}", cutoff, e);
            throw new StoreException("Failed to purge baseline records", e);
        }
    }

    private static List<List<TimeSlot>> chunks(Collection<TimeSlot> slots) {
        List<TimeSlot> distinct = new ArrayList<>(new LinkedHashSet<>(slots));
        List<List<TimeSlot>> chunks = new ArrayList<>();
        for (int i = 0; i < distinct.size(); i += SLOT_CHUNK_SIZE) {
            chunks.add(distinct.subList(i, Math.min(distinct.size(), i + SLOT_CHUNK_SIZE)));
        }
        return chunks;
    }

    private static String tuplePlaceholders(int count) {
        return String.join(",", Collections.nCopies(count, "(?, ?, ?, ?)"));
    }

    private static Object[] slotParams(List<TimeSlot> slots) {
        Object[] params = new Object[slots.size() * 4];
        for (int i = 0; i < slots.size(); i++) {
            TimeSlot slot = slots.get(i);
            params[i * 4] = slot.getCategoryKey();
            params[i * 4 + 1] = slot.getPeriod().getDayOfWeek();
            params[i * 4 + 2] = slot.getPeriod().getHour();
            params[i * 4 + 3] = slot.getPeriod().getQuarter();
        }
        return params;
    }

    static TimeSlot mapSlot(ResultSet rs) throws SQLException {
        return TimeSlot.of(rs.getString("category_key"), PeriodOfWeek.of(
                rs.getInt("day_of_week"), rs.getInt("hour_of_day"), rs.getInt("quarter_hour")));
    }

    private static class BaselineRecordRowMapper implements RowMapper<BaselineRecord> {
        @Override
        public BaselineRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            return BaselineRecord.builder()
                    .slot(mapSlot(rs))
                    .mean(rs.getDouble("mean"))
                    .stddev(rs.getDouble("stddev"))
                    .sampleCount(rs.getLong("sample_count"))
                    .placeholder(rs.getBoolean("placeholder"))
                    .lastUpdated(rs.getTimestamp("last_updated").toInstant())
                    .build();
        }
    }

    private static class BaselineSampleRowMapper implements RowMapper<BaselineSample> {
        @Override
        public BaselineSample mapRow(ResultSet rs, int rowNum) throws SQLException {
            return BaselineSample.builder()
                    .slot(mapSlot(rs))
                    .windowStart(rs.getTimestamp("window_start").toInstant())
                    .value(rs.getDouble("sample_value"))
                    .build();
        }
    }
}
