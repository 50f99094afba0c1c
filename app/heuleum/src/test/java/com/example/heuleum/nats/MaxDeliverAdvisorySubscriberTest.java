/*
 * Where: heuleum NATS adapter tests
 * What: Max-deliver advisories are recorded by stream_seq, then acked or nacked
 * Why: A message the broker gave up on must end up in stranded_messages
 */
package com.example.heuleum.nats;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.heuleum.config.RecoveryProperties;
import com.example.heuleum.config.SubscriptionProperties;
import com.example.heuleum.repository.StrandedMessageRepository;
import com.example.heuleum.service.HeuleumMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.nats.client.Connection;
import io.nats.client.Message;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class MaxDeliverAdvisorySubscriberTest {

  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");
  private static final long STREAM_SEQ = 42L;

  @Mock private Connection connection;
  @Mock private StrandedMessageRepository strandedMessageRepository;

  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private MaxDeliverAdvisorySubscriber subscriber;

  @BeforeEach
  void setUp() {
    final SubscriptionProperties subscriptionProperties =
        new SubscriptionProperties(
            "heuleum.events", "events", "heuleum-tracker", Duration.ofSeconds(30), 5);
    final RecoveryProperties recoveryProperties =
        new RecoveryProperties(
            true, "heuleum-max-deliver-advisories", "heuleum-max-deliver", Duration.ofSeconds(30), 50);
    subscriber =
        new MaxDeliverAdvisorySubscriber(
            connection,
            subscriptionProperties,
            recoveryProperties,
            strandedMessageRepository,
            new HeuleumMetrics(registry),
            new ObjectMapper(),
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void advisorySubjectTargetsTheConsumer() {
    assertThat(MaxDeliverAdvisorySubscriber.advisorySubject("events", "heuleum-tracker"))
        .isEqualTo("$JS.EVENT.ADVISORY.CONSUMER.MAX_DELIVERIES.events.heuleum-tracker");
  }

  @Test
  void recordsStreamSeqAndAcks() {
    final Message message =
        advisory(
            """
            {
              "type": "io.nats.jetstream.advisory.v1.max_deliver",
              "stream": "events",
              "consumer": "heuleum-tracker",
              "stream_seq": %d,
              "deliveries": 6
            }
            """
                .formatted(STREAM_SEQ));

    subscriber.handleMessage(message);

    verify(strandedMessageRepository).insert("events", STREAM_SEQ, 6, NOW);
    verify(message).ack();
    verify(message, never()).nak();
    assertThat(registry.get("heuleum.stranded.total").tag("result", "recorded").counter().count())
        .isEqualTo(1.0d);
  }

  @Test
  void missingDeliveriesFallsBackToBrokerLimit() {
    final Message message = advisory("{\"stream_seq\": 7}");

    subscriber.handleMessage(message);

    verify(strandedMessageRepository).insert("events", 7L, 6, NOW);
    verify(message).ack();
  }

  @Test
  void ackWhenStreamSeqMissing() {
    final Message message = advisory("{\"stream\": \"events\", \"consumer\": \"heuleum-tracker\"}");

    subscriber.handleMessage(message);

    verifyNoInteractions(strandedMessageRepository);
    verify(message).ack();
    verify(message, never()).nak();
  }

  @Test
  void ackWhenPayloadIsNotJson() {
    final Message message = advisory("{not json");

    subscriber.handleMessage(message);

    verifyNoInteractions(strandedMessageRepository);
    verify(message).ack();
  }

  @Test
  void nakWhenDatabaseIsUnavailable() {
    final Message message = advisory("{\"stream_seq\": 42, \"deliveries\": 6}");
    doThrow(new DataAccessResourceFailureException("connection refused"))
        .when(strandedMessageRepository)
        .insert(anyString(), anyLong(), anyInt(), any());

    subscriber.handleMessage(message);

    verify(message).nak();
    verify(message, never()).ack();
  }

  private static Message advisory(String json) {
    final Message message = mock(Message.class);
    when(message.getData()).thenReturn(json.getBytes(StandardCharsets.UTF_8));
    return message;
  }
}
