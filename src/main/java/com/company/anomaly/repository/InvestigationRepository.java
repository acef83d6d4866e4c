package com.company.anomaly.repository;

import com.company.anomaly.domain.AnomalyEvidence;
import com.company.anomaly.domain.InvestigationRecord;
import com.company.anomaly.domain.TimeSlot;
import com.company.anomaly.domain.enums.AnomalyState;
import com.company.anomaly.domain.enums.InvestigationStatus;
import com.company.anomaly.exception.StoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
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
 * Append-only audit of anomalous observations, one row per (window, category)
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class InvestigationRepository {

    private static final TypeReference<List<AnomalyEvidence>> EVIDENCE_TYPE = new TypeReference<>() {
    };

    private static final String COLUMNS = """
            investigation_id, category_key, day_of_week, hour_of_day, quarter_hour, window_start,
            original_value, reference_value, replacement_value, ratio, anomaly_state, evidence,
            problem_key, known_problem, status, resolution_notes, created_at, updated_at
            """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    /**
     * Idempotent insert. A replayed window finds the existing row and leaves it untouched.
     *
     * @return the record with its generated id, or empty when the row already existed
     */
    public Optional<InvestigationRecord> insertIfAbsent(InvestigationRecord record) {
        Instant now = record.getCreatedAt() != null ? record.getCreatedAt() : Instant.now();
        record.setCreatedAt(now);
        record.setUpdatedAt(now);
        if (record.getStatus() == null) {
            record.setStatus(InvestigationStatus.NEW);
        }

        String sql = """
            INSERT INTO investigation_records (
                category_key, day_of_week, hour_of_day, quarter_hour, window_start,
                original_value, reference_value, replacement_value, ratio, anomaly_state, evidence,
                problem_key, known_problem, status, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?)
            ON CONFLICT (window_start, category_key) DO NOTHING
            RETURNING investigation_id
            """;

        TimeSlot slot = record.getSlot();
        try {
            List<Long> ids = jdbcTemplate.queryForList(sql, Long.class,
                    slot.getCategoryKey(),
                    slot.getPeriod().getDayOfWeek(),
                    slot.getPeriod().getHour(),
                    slot.getPeriod().getQuarter(),
                    Timestamp.from(record.getWindowStart()),
                    record.getOriginalValue(),
                    record.getReferenceValue(),
                    record.getReplacementValue(),
                    record.getRatio(),
                    record.getState().name(),
                    writeEvidence(record.getEvidence()),
                    record.getProblemKey(),
                    record.isKnownProblem(),
                    record.getStatus().name(),
                    Timestamp.from(now),
                    Timestamp.from(now));

            if (ids.isEmpty()) {
                log.debug("Investigation for {} at {} already recorded", slot, record.getWindowStart());
                return Optional.empty();
            }
            record.setInvestigationId(ids.get(0));
            return Optional.of(record);
        } catch (DataAccessException e) {
            log.error("Failed to insert investigation for slot {} at {}", slot, record.getWindowStart(), e);
            throw new StoreException("Failed to insert investigation record", e);
        }
    }

    public Optional<InvestigationRecord> findById(Long investigationId) {
        String sql = "SELECT " + COLUMNS + " FROM investigation_records WHERE investigation_id = ?";

        try {
            List<InvestigationRecord> results = jdbcTemplate.query(sql, new InvestigationRowMapper(), investigationId);
            return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
        } catch (DataAccessException e) {
            log.error("Failed to read investigation {}", investigationId, e);
            throw new StoreException("Failed to read investigation record", e);
        }
    }

    public List<InvestigationRecord> findBySlot(TimeSlot slot, int limit) {
        String sql = "SELECT " + COLUMNS + """
            FROM investigation_records
            WHERE category_key = ? AND day_of_week = ? AND hour_of_day = ? AND quarter_hour = ?
            ORDER BY window_start DESC
            LIMIT ?
            """;

        try {
            return jdbcTemplate.query(sql, new InvestigationRowMapper(),
                    slot.getCategoryKey(), slot.getPeriod().getDayOfWeek(),
                    slot.getPeriod().getHour(), slot.getPeriod().getQuarter(), limit);
        } catch (DataAccessException e) {
            log.error("Failed to read investigations for slot {}", slot, e);
            throw new StoreException("Failed to read investigation records", e);
        }
    }

    public List<InvestigationRecord> findBetween(Instant from, Instant to) {
        String sql = "SELECT " + COLUMNS + """
            FROM investigation_records
            WHERE window_start >= ? AND window_start < ?
            ORDER BY window_start DESC, category_key
            """;

        try {
            return jdbcTemplate.query(sql, new InvestigationRowMapper(), Timestamp.from(from), Timestamp.from(to));
        } catch (DataAccessException e) {
            log.error("Failed to read investigations between {} and {}", from, to, e);
            throw new StoreException("Failed to read investigation records", e);
        }
    }

    public List<InvestigationRecord> findByProblemKey(String problemKey, int limit) {
        String sql = "SELECT " + COLUMNS + """
            FROM investigation_records
            WHERE problem_key = ?
            ORDER BY window_start DESC
            LIMIT ?
            """;

        try {
            return jdbcTemplate.query(sql, new InvestigationRowMapper(), problemKey, limit);
        } catch (DataAccessException e) {
            log.error("Failed to read investigations for problem {}", problemKey, e);
            throw new StoreException("Failed to read investigation records", e);
        }
    }

    /**
     * Conditional on the current status, so two operators cannot both move the same record
     *
     * @return true when the row moved
     */
    public boolean updateStatus(Long investigationId, InvestigationStatus expected,
                                InvestigationStatus target, String notes) {
        String sql = """
            UPDATE investigation_records
            SET status = ?,
                resolution_notes = COALESCE(?, resolution_notes),
                updated_at = ?
            WHERE investigation_id = ? AND status = ?
            """;

        try {
            return jdbcTemplate.update(sql, target.name(), notes, Timestamp.from(Instant.now()),
                    investigationId, expected.name()) == 1;
        } catch (DataAccessException e) {
            log.error("Failed to update status of investigation {}", investigationId, e);
            throw new StoreException("Failed to update investigation status", e);
        }
    }

    public long countByStatus(InvestigationStatus status) {
        try {
            Long count = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM investigation_records WHERE status = ?", Long.class, status.name());
            return count != null ? count : 0L;
        } catch (DataAccessException e) {
            log.error("Failed to count investigations in status {}", status, e);
            throw new StoreException("Failed to count investigation records", e);
        }
    }

    private String writeEvidence(List<AnomalyEvidence> evidence) {
        try {
            return objectMapper.writeValueAsString(evidence != null ? evidence : List.of());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize anomaly evidence", e);
        }
    }

    private List<AnomalyEvidence> readEvidence(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, EVIDENCE_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize anomaly evidence", e);
        }
    }

    private class InvestigationRowMapper implements RowMapper<InvestigationRecord> {
        @Override
        public InvestigationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            return InvestigationRecord.builder()
                    .investigationId(rs.getLong("investigation_id"))
                    .slot(JdbcBaselineStore.mapSlot(rs))
                    .windowStart(rs.getTimestamp("window_start").toInstant())
                    .originalValue(rs.getLong("original_value"))
                    .referenceValue(rs.getObject("reference_value", Double.class))
                    .replacementValue(rs.getDouble("replacement_value"))
                    .ratio(rs.getObject("ratio", Double.class))
                    .state(AnomalyState.fromString(rs.getString("anomaly_state")))
                    .evidence(readEvidence(rs.getString("evidence")))
                    .problemKey(rs.getString("problem_key"))
                    .knownProblem(rs.getBoolean("known_problem"))
                    .status(InvestigationStatus.fromString(rs.getString("status")))
                    .resolutionNotes(rs.getString("resolution_notes"))
                    .createdAt(rs.getTimestamp("created_at").toInstant())
                    .updatedAt(rs.getTimestamp("updated_at").toInstant())
                    .build();
        }
    }
}
