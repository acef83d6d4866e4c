package com.company.anomaly.repository;

import com.company.anomaly.domain.CycleRun;
import com.company.anomaly.domain.enums.CycleStatus;
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
import java.util.List;
import java.util.Optional;

/**
 * Ledger of processed windows. A window is applied to the baseline at most once.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class CycleRunRepository {

    private static final String COLUMNS = """
            window_start, window_end, cycle_id, status, observations, skipped_categories,
            anomalies, known_anomalies, new_anomalies, total_hits, returned_hits,
            failure_reason, started_at, completed_at
            """;

    private final JdbcTemplate jdbcTemplate;

    /**
     * Claim a window inside the caller's transaction. The row lock taken here makes an
     * overlapping run of the same window wait, then see COMPLETED and back off.
     *
     * @return false when the window was already committed
     */
    public boolean claim(Instant windowStart, Instant windowEnd, String cycleId, Instant startedAt) {
        String sql = """
            INSERT INTO ingestion_cycles (window_start, window_end, cycle_id, status, started_at)
            VALUES (?, ?, ?, 'RUNNING', ?)
            ON CONFLICT (window_start)
            DO UPDATE SET
                cycle_id = EXCLUDED.cycle_id,
                status = 'RUNNING',
                failure_reason = NULL,
                started_at = EXCLUDED.started_at,
                completed_at = NULL
            WHERE ingestion_cycles.status <> 'COMPLETED'
            """;

        try {
            return jdbcTemplate.update(sql,
                    Timestamp.from(windowStart), Timestamp.from(windowEnd), cycleId, Timestamp.from(startedAt)) == 1;
        } catch (DataAccessException e) {
            log.error("Failed to claim window {}", windowStart, e);
            throw new StoreException("Failed to claim ingestion window", e);
        }
    }

    public void complete(CycleRun run) {
        String sql = """
            UPDATE ingestion_cycles
            SET status = 'COMPLETED',
                observations = ?,
                skipped_categories = ?,
                anomalies = ?,
                known_anomalies = ?,
                new_anomalies = ?,
                total_hits = ?,
                returned_hits = ?,
                completed_at = ?
            WHERE window_start = ? AND cycle_id = ?
            """;

        try {
            int updated = jdbcTemplate.update(sql,
                    run.getObservations(),
                    run.getSkippedCategories(),
                    run.getAnomalies(),
                    run.getKnownAnomalies(),
                    run.getNewAnomalies(),
                    run.getTotalHits(),
                    run.getReturnedHits(),
                    Timestamp.from(run.getCompletedAt()),
                    Timestamp.from(run.getWindowStart()),
                    run.getCycleId());
            if (updated != 1) {
                throw new IllegalStateException("Cycle " + run.getCycleId() + " lost its claim on " + run.getWindowStart());
            }
        } catch (DataAccessException e) {
            log.error("Failed to complete window {}", run.getWindowStart(), e);
            throw new StoreException("Failed to complete ingestion window", e);
        }
    }

    /**
     * Runs outside the failed transaction. Never overwrites a committed window.
     */
    public void markAborted(Instant windowStart, Instant windowEnd, String cycleId, String reason) {
        String sql = """
            INSERT INTO ingestion_cycles (window_start, window_end, cycle_id, status, failure_reason, started_at, completed_at)
            VALUES (?, ?, ?, 'ABORTED', ?, ?, ?)
            ON CONFLICT (window_start)
            DO UPDATE SET
                cycle_id = EXCLUDED.cycle_id,
                status = 'ABORTED',
                failure_reason = EXCLUDED.failure_reason,
                completed_at = EXCLUDED.completed_at
            WHERE ingestion_cycles.status <> 'COMPLETED'
            """;

        Timestamp now = Timestamp.from(Instant.now());
        try {
            jdbcTemplate.update(sql,
                    Timestamp.from(windowStart), Timestamp.from(windowEnd), cycleId, reason, now, now);
        } catch (DataAccessException e) {
            log.error("Failed to record abort of window {}: {}", windowStart, reason, e);
            throw new StoreException("Failed to record aborted ingestion window", e);
        }
    }

    public boolean isCompleted(Instant windowStart) {
        try {
            Integer count = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM ingestion_cycles WHERE window_start = ? AND status = 'COMPLETED'",
                    Integer.class, Timestamp.from(windowStart));
            return count != null && count > 0;
        } catch (DataAccessException e) {
            log.error("Failed to check ledger for window {}", windowStart, e);
            throw new StoreException("Failed to read ingestion ledger", e);
        }
    }

    public Optional<CycleRun> findByWindow(Instant windowStart) {
        String sql = "SELECT " + COLUMNS + " FROM ingestion_cycles WHERE window_start = ?";

        try {
            List<CycleRun> results = jdbcTemplate.query(sql, new CycleRunRowMapper(), Timestamp.from(windowStart));
            return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
        } catch (DataAccessException e) {
            log.error("Failed to read ledger for window {}", windowStart, e);
            throw new StoreException("Failed to read ingestion ledger", e);
        }
    }

    public List<CycleRun> findBetween(Instant from, Instant to) {
        String sql = "SELECT " + COLUMNS + """
            FROM ingestion_cycles
            WHERE window_start >= ? AND window_start < ?
            ORDER BY window_start DESC
            """;

        try {
            return jdbcTemplate.query(sql, new CycleRunRowMapper(), Timestamp.from(from), Timestamp.from(to));
        } catch (DataAccessException e) {
            log.error("Failed to read ledger between {} and {}", from, to, e);
            throw new StoreException("Failed to read ingestion ledger", e);
        }
    }

    private static class CycleRunRowMapper implements RowMapper<CycleRun> {
        @Override
        public CycleRun mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp completedAt = rs.getTimestamp("completed_at");
            return CycleRun.builder()
                    .windowStart(rs.getTimestamp("window_start").toInstant())
                    .windowEnd(rs.getTimestamp("window_end").toInstant())
                    .cycleId(rs.getString("cycle_id"))
                    .status(CycleStatus.fromString(rs.getString("status")))
                    .observations(rs.getInt("observations"))
                    .skippedCategories(rs.getInt("skipped_categories"))
                    .anomalies(rs.getInt("anomalies"))
                    .knownAnomalies(rs.getInt("known_anomalies"))
                    .newAnomalies(rs.getInt("new_anomalies"))
                    .totalHits(rs.getObject("total_hits", Long.class))
                    .returnedHits(rs.getObject("returned_hits", Long.class))
                    .failureReason(rs.getString("failure_reason"))
                    .startedAt(rs.getTimestamp("started_at").toInstant())
                    .completedAt(completedAt != null ? completedAt.toInstant() : null)
                    .build();
        }
    }
}
