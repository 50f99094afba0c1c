/*
 * Where: heuleum data access
 * What: Persists tracked events
 * Why: tracked_events is the sink for every accepted message
 */
package com.example.heuleum.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.heuleum.model.TrackedEvent;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class TrackedEventRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * @return false when a row with the same idempotency key is already stored
   */
  public boolean insertIfAbsent(TrackedEvent event) {
    String sql = """
        INSERT INTO tracked_events (
          tracked_event_id, idempotency_key, event_type, occurred_at,
          version, properties, message_id, received_at
        ) VALUES (
          :trackedEventId, :idempotencyKey, :eventType, :occurredAt,
          :version, CAST(:properties AS jsonb), :messageId, :receivedAt
        )
        ON CONFLICT (idempotency_key) DO NOTHING
        """;
    MapSqlParameterSource params = new MapSqlParameterSource()
        .addValue("trackedEventId", UUID.randomUUID())
        .addValue("idempotencyKey", event.idempotencyKey())
        .addValue("eventType", event.eventType())
        .addValue("occurredAt", toTimestamp(event.occurredAt()))
        .addValue("version", event.version())
        .addValue("properties", event.propertiesJson())
        .addValue("messageId", event.messageId())
        .addValue("receivedAt", toTimestamp(event.receivedAt()));
    return jdbcTemplate.update(sql, params) > 0;
  }
}
