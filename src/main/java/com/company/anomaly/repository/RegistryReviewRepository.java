package com.company.anomaly.repository;

import com.company.anomaly.domain.RegistryReviewItem;
import com.company.anomaly.domain.enums.ReviewStatus;
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
import java.util.Arrays;
import java.util.List;

/**
 * Manual-review queue for ambiguous registry matches
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class RegistryReviewRepository {

    private static final String CANDIDATE_SEPARATOR = "\n";

    private final JdbcTemplate jdbcTemplate;

    /**
     * @return false when the same problem was already filed for this window
     */
    public boolean saveIfAbsent(RegistryReviewItem item) {
        if (item.getCreatedAt() == null) {
            item.setCreatedAt(Instant.now());
        }
        if (item.getStatus() == null) {
            item.setStatus(ReviewStatus.OPEN);
        }

        String sql = """
            INSERT INTO registry_review_items (
                problem_key, candidate_keys, reason, window_start, status, created_at
            ) VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT (problem_key, window_start) DO NOTHING
            RETURNING review_id
            """;

        try {
            List<Long> ids = jdbcTemplate.queryForList(sql, Long.class,
                    item.getProblemKey(),
                    String.join(CANDIDATE_SEPARATOR, item.getCandidateKeys()),
                    item.getReason(),
                    Timestamp.from(item.getWindowStart()),
                    item.getStatus().name(),
                    Timestamp.from(item.getCreatedAt()));
            if (ids.isEmpty()) {
                return false;
            }
            item.setReviewId(ids.get(0));
            return true;
        } catch (DataAccessException e) {
            log.error("Failed to file review item for {}", item.getProblemKey(), e);
            throw new StoreException("Failed to file registry review item", e);
        }
    }

    public List<RegistryReviewItem> findOpen(int limit) {
        String sql = """
            SELECT review_id, problem_key, candidate_keys, reason, window_start, status, created_at
            FROM registry_review_items
            WHERE status = 'OPEN'
            ORDER BY created_at ASC
            LIMIT ?
            """;

        try {
            return jdbcTemplate.query(sql, new ReviewItemRowMapper(), limit);
        } catch (DataAccessException e) {
            log.error("Failed to read open review items", e);
            throw new StoreException("Failed to read registry review items", e);
        }
    }

    public boolean close(Long reviewId) {
        try {
            return jdbcTemplate.update(
                    "UPDATE registry_review_items SET status = 'CLOSED' WHERE review_id = ? AND status = 'OPEN'",
                    reviewId) == 1;
        } catch (DataAccessException e) {
            log.error("Failed to close review item {}", reviewId, e);
            throw new StoreException("Failed to close registry review item", e);
        }
    }

    public long countOpen() {
        try {
            Long count = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM registry_review_items WHERE status = 'OPEN'", Long.class);
            return count != null ? count : 0L;
        } catch (DataAccessException e) {
            log.error("Failed to count open review items", e);
            throw new StoreException("Failed to count registry review items", e);
        }
    }

    private static class ReviewItemRowMapper implements RowMapper<RegistryReviewItem> {
        @Override
        public RegistryReviewItem mapRow(ResultSet rs, int rowNum) throws SQLException {
            return RegistryReviewItem.builder()
                    .reviewId(rs.getLong("review_id"))
                    .problemKey(rs.getString("problem_key"))
                    .candidateKeys(Arrays.asList(rs.getString("candidate_keys").split(CANDIDATE_SEPARATOR)))
                    .reason(rs.getString("reason"))
                    .windowStart(rs.getTimestamp("window_start").toInstant())
                    .status(ReviewStatus.fromString(rs.getString("status")))
                    .createdAt(rs.getTimestamp("created_at").toInstant())
                    .build();
        }
    }
}
