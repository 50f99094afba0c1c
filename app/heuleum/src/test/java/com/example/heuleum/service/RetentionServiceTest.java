/*
 * Where: ledger retention tests
 * What: Cleanup removes only processed_events rows older than the window
 * Why: Stored tracked events must survive ledger pruning
 */
package com.example.heuleum.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.heuleum.AbstractPostgresContainerTest;
import com.example.heuleum.model.TrackedEvent;
import com.example.heuleum.repository.ProcessedEventRepository;
import com.example.heuleum.repository.TrackedEventRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest(properties = "heuleum.retention.retention-days=7")
@ActiveProfiles("test")
class RetentionServiceTest extends AbstractPostgresContainerTest {

    private static final Instant FIXED_NOW = Instant.parse("2026-03-10T00:00:00Z");

    @TestConfiguration
    static class FixedClockConfig {
        @Bean(name = "testClock")
        @Primary
        Clock clock() {
            return Clock.fixed(FIXED_NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private RetentionService retentionService;

    @Autowired
    private ProcessedEventRepository processedEventRepository;

    @Autowired
    private TrackedEventRepository trackedEventRepository;

    @Autowired
    private NamedParameterJdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanup() {
        jdbcTemplate.update("DELETE FROM tracked_events", new MapSqlParameterSource());
        jdbcTemplate.update("DELETE FROM processed_events", new MapSqlParameterSource());
    }

    @Test
    void cleanupDeletesOnlyExpiredLedgerRows() {
        Instant expired = FIXED_NOW.minus(Duration.ofDays(8));
        Instant recent = FIXED_NOW.minus(Duration.ofDays(1));
        processedEventRepository.insertIfAbsent("old", expired);
        processedEventRepository.insertIfAbsent("new", recent);
        trackedEventRepository.insertIfAbsent(new TrackedEvent("old", "signup", expired, "1", "{}", "events:1", expired));

        int deleted = retentionService.cleanup();

        assertThat(deleted).isEqualTo(1);
        assertThat(count("processed_events", "old")).isZero();
        assertThat(count("processed_events", "new")).isEqualTo(1);
        assertThat(count("tracked_events", "old")).isEqualTo(1);
    }

    private int count(String table, String idempotencyKey) {
        Integer result = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM " + table + " WHERE idempotency_key = :key",
                new MapSqlParameterSource("key", idempotencyKey), Integer.class);
        return result == null ? 0 : result;
    }
}
