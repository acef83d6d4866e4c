package com.company.anomaly.repository;

import com.company.anomaly.domain.ProblemKey;
import com.company.anomaly.domain.ProblemRegistryEntry;
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

@Repository
@RequiredArgsConstructor
@Slf4j
public class ProblemRegistryRepository {

    private static final String COLUMNS = """
            problem_key, category_key, signature, detection_type, first_seen, last_seen,
            occurrence_count, known, demoted_at_count, updated_at
            """;

    private final JdbcTemplate jdbcTemplate;

    public Optional<ProblemRegistryEntry> findByKey(String problemKey) {
        String sql = "SELECT " + COLUMNS + " FROM problem_registry WHERE problem_key = ?";

        try {
            List<ProblemRegistryEntry> results = jdbcTemplate.query(sql, new ProblemRegistryRowMapper(), problemKey);
            return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
        } catch (DataAccessException e) {
            log.error("Failed to read registry entry {}", problemKey, e);
            throw new StoreException("Failed to read problem registry", e);
        }
    }

    /**
     * Same category and detection type, different signature
     */
    public List<ProblemRegistryEntry> findSimilar(ProblemKey key) {
        String sql = "SELECT " + COLUMNS + """
            FROM problem_registry
            WHERE category_key = ? AND detection_type = ? AND problem_key <> ?
            ORDER BY last_seen DESC
            """;

        try {
            return jdbcTemplate.query(sql, new ProblemRegistryRowMapper(),
                    key.getCategoryKey(), key.getDetectionType(), key.asString());
        } catch (DataAccessException e) {
            log.error("Failed to search registry entries similar to {}", key, e);
            throw new StoreException("Failed to read problem registry", e);
        }
    }

    /**
     * Atomic create-or-increment. first_seen and last_seen only ever widen,
     * so out-of-order replays keep the bounds right.
     */
    public ProblemRegistryEntry recordOccurrence(ProblemKey key, Instant seenAt) {
        String sql = """
            INSERT INTO problem_registry (
                problem_key, category_key, signature, detection_type,
                first_seen, last_seen, occurrence_count, known, demoted_at_count, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, 1, FALSE, 0, ?)
            ON CONFLICT (problem_key)
            DO UPDATE SET
                occurrence_count = problem_registry.occurrence_count + 1,
                first_seen = LEAST(problem_registry.first_seen, EXCLUDED.first_seen),
                last_seen = GREATEST(problem_registry.last_seen, EXCLUDED.last_seen),
                updated_at = EXCLUDED.updated_at
            RETURNING\s""" + COLUMNS;

        Timestamp seen = Timestamp.from(seenAt);
        try {
            return jdbcTemplate.queryForObject(sql, new ProblemRegistryRowMapper(),
                    key.asString(), key.getCategoryKey(), key.getSignature(), key.getDetectionType(),
                    seen, seen, Timestamp.from(Instant.now()));
        } catch (DataAccessException e) {
            log.error("Failed to record occurrence of {}", key, e);
            throw new StoreException("Failed to update problem registry", e);
        }
    }

    public Optional<ProblemRegistryEntry> markKnown(String problemKey) {
        String sql = """
            UPDATE problem_registry
            SET known = TRUE, updated_at = ?
            WHERE problem_key = ?
            RETURNING\s""" + COLUMNS;

        try {
            List<ProblemRegistryEntry> results = jdbcTemplate.query(sql, new ProblemRegistryRowMapper(),
                    Timestamp.from(Instant.now()), problemKey);
            return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
        } catch (DataAccessException e) {
            log.error("Failed to mark {} as known", problemKey, e);
            throw new StoreException("Failed to update problem registry", e);
        }
    }

    /**
     * Back to new. Remembers the occurrence count so promotion needs fresh support.
     */
    public Optional<ProblemRegistryEntry> demote(String problemKey) {
        String sql = """
            UPDATE problem_registry
            SET known = FALSE, demoted_at_count = occurrence_count, updated_at = ?
            WHERE problem_key = ?
            RETURNING\s""" + COLUMNS;

        try {
            List<ProblemRegistryEntry> results = jdbcTemplate.query(sql, new ProblemRegistryRowMapper(),
                    Timestamp.from(Instant.now()), problemKey);
            return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
        } catch (DataAccessException e) {
            log.error("Failed to demote {}", problemKey, e);
            throw new StoreException("Failed to update problem registry", e);
        }
    }

    public List<ProblemRegistryEntry> findSeenBetween(Instant from, Instant to) {
        String sql = "SELECT " + COLUMNS + """
            FROM problem_registry
            WHERE last_seen >= ? AND first_seen < ?
            ORDER BY last_seen DESC
            """;

        try {
            return jdbcTemplate.query(sql, new ProblemRegistryRowMapper(), Timestamp.from(from), Timestamp.from(to));
        } catch (DataAccessException e) {
            log.error("Failed to read registry entries seen between {} and {}", from, to, e);
            throw new StoreException("Failed to read problem registry", e);
        }
    }

    public List<ProblemRegistryEntry> findByCategory(String categoryKey) {
        String sql = "SELECT " + COLUMNS + """
            FROM problem_registry
            WHERE category_key = ?
            ORDER BY last_seen DESC
            """;

        try {
            return jdbcTemplate.query(sql, new ProblemRegistryRowMapper(), categoryKey);
        } catch (DataAccessException e) {
            log.error("Failed to read registry entries for category {}", categoryKey, e);
            throw new StoreException("Failed to read problem registry", e);
        }
    }

    public long countKnown() {
        try {
            Long count = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM problem_registry WHERE known = TRUE", Long.class);
            return count != null ? count : 0L;
        } catch (DataAccessException e) {
            log.error("Failed to count known problems", e);
            throw new StoreException("Failed to count problem registry entries", e);
        }
    }

    private static class ProblemRegistryRowMapper implements RowMapper<ProblemRegistryEntry> {
        @Override
        public ProblemRegistryEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
            return ProblemRegistryEntry.builder()
                    .problemKey(rs.getString("problem_key"))
                    .categoryKey(rs.getString("category_key"))
                    .signature(rs.getString("signature"))
                    .detectionType(rs.getString("detection_type"))
                    .firstSeen(rs.getTimestamp("first_seen").toInstant())
                    .lastSeen(rs.getTimestamp("last_seen").toInstant())
                    .occurrenceCount(rs.getLong("occurrence_count"))
                    .known(rs.getBoolean("known"))
                    .demotedAtCount(rs.getLong("demoted_at_count"))
                    .updatedAt(rs.getTimestamp("updated_at").toInstant())
                    .build();
        }
    }
}
