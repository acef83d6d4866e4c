package com.company.anomaly.repository;

import com.company.anomaly.exception.StoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operator overrides for detection thresholds, re-read every cycle
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class DetectionParameterRepository {

    private final JdbcTemplate jdbcTemplate;

    public Map<String, String> findAll() {
        String sql = """
            SELECT param_name, param_value
            FROM detection_parameters
            ORDER BY param_name
            """;

        try {
            Map<String, String> params = new LinkedHashMap<>();
            jdbcTemplate.query(sql, rs -> {
                params.put(rs.getString("param_name"), rs.getString("param_value"));
            });
            return params;
        } catch (DataAccessException e) {
            log.error("Failed to load detection parameters", e);
            throw new StoreException("Failed to load detection parameters", e);
        }
    }

    public void upsert(String name, String value) {
        String sql = """
            INSERT INTO detection_parameters (param_name, param_value, updated_at)
            VALUES (?, ?, ?)
            ON CONFLICT (param_name)
            DO UPDATE SET param_value = EXCLUDED.param_value, updated_at = EXCLUDED.updated_at
            """;

        try {
            jdbcTemplate.update(sql, name, value, Timestamp.from(Instant.now()));
        } catch (DataAccessException e) {
            log.error("Failed to store detection parameter {}", name, e);
            throw new StoreException("Failed to store detection parameter " + name, e);
        }
    }
}
