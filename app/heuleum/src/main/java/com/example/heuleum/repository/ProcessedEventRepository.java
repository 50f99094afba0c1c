/*
 * Where: heuleum data access
 * What: Inserts and prunes idempotency keys in processed_events
 * Why: The ledger decides whether a delivery was already stored
 */
package com.example.heuleum.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ProcessedEventRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * @return true when the key was new, false when it was already recorded
   */
  public boolean insertIfAbsent(String idempotencyKey, Instant processedAt) {
    String sql = """
        INSERT INTO processed_events (idempotency_key, processed_at)
        VALUES (:idempotencyKey, :processedAt)
        ON CONFLICT (idempotency_key) DO NOTHING
        """;
    MapSqlParameterSource params = new MapSqlParameterSource()
        .addValue("idempotencyKey", idempotencyKey)
        .addValue("processedAt", toTimestamp(processedAt));
    return jdbcTemplate.update(sql, params) > 0;
  }

  public int deleteOlderThan(Instant threshold) {
    String sql = """
        DELETE FROM processed_events
        WHERE processed_at < :threshold
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource("threshold", toTimestamp(threshold)));
  }
}
