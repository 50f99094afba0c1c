/*
 * Where: heuleum data access
 * What: Stores stream_seq of messages reported by the max-deliver advisory
 * Why: The replayer fetches them from the stream until the dead-letter subject accepts them
 */
package com.example.heuleum.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.heuleum.model.StrandedMessage;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class StrandedMessageRepository {

  private static final RowMapper<StrandedMessage> ROW_MAPPER = (rs, rowNum) -> new StrandedMessage(
      rs.getString("stream"),
      rs.getLong("stream_seq"),
      rs.getInt("deliveries"),
      toInstant(rs.getTimestamp("recorded_at")));

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(String stream, long streamSeq, int deliveries, Instant recordedAt) {
    String sql = """
        INSERT INTO stranded_messages (stream, stream_seq, deliveries, recorded_at)
        VALUES (:stream, :streamSeq, :deliveries, :recordedAt)
        ON CONFLICT (stream, stream_seq) DO NOTHING
        """;
    MapSqlParameterSource params = new MapSqlParameterSource()
        .addValue("stream", stream)
        .addValue("streamSeq", streamSeq)
        .addValue("deliveries", deliveries)
        .addValue("recordedAt", toTimestamp(recordedAt));
    jdbcTemplate.update(sql, params);
  }

  public List<StrandedMessage> findOldest(int limit) {
    String sql = """
        SELECT stream, stream_seq, deliveries, recorded_at
        FROM stranded_messages
        ORDER BY recorded_at, stream_seq
        LIMIT :limit
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource("limit", limit), ROW_MAPPER);
  }

  public void delete(String stream, long streamSeq) {
    String sql = """
        DELETE FROM stranded_messages
        WHERE stream = :stream AND stream_seq = :streamSeq
        """;
    jdbcTemplate.update(sql, new MapSqlParameterSource()
        .addValue("stream", stream)
        .addValue("streamSeq", streamSeq));
  }
}
