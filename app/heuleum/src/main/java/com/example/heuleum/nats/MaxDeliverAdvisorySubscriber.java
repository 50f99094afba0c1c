/*
 * Where: heuleum NATS adapter
 * What: Subscribes to the consumer MAX_DELIVERIES advisory and records the stream_seq
 * Why: A message whose last delivery could not be dead-lettered is otherwise never seen again
 */
package com.example.heuleum.nats;

import com.example.heuleum.config.RecoveryProperties;
import com.example.heuleum.config.SubscriptionProperties;
import com.example.heuleum.repository.StrandedMessageRepository;
import com.example.heuleum.service.HeuleumMetrics;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.StreamConfiguration;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = {"nats.enabled", "heuleum.subscriber.enabled", "heuleum.recovery.enabled"},
    havingValue = "true",
    matchIfMissing = true)
public class MaxDeliverAdvisorySubscriber {

  private static final Logger logger = LoggerFactory.getLogger(MaxDeliverAdvisorySubscriber.class);
  private static final String ADVISORY_SUBJECT_PREFIX = "$JS.EVENT.ADVISORY.CONSUMER.MAX_DELIVERIES.";
  private static final int STREAM_NOT_FOUND_ERROR = 404;
  private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

  private final Connection connection;
  private final SubscriptionProperties subscriptionProperties;
  private final RecoveryProperties recoveryProperties;
  private final StrandedMessageRepository strandedMessageRepository;
  private final HeuleumMetrics metrics;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final AtomicBoolean started = new AtomicBoolean(false);
  private Dispatcher dispatcher;
  private JetStreamSubscription subscription;

  public MaxDeliverAdvisorySubscriber(Connection connection,
      SubscriptionProperties subscriptionProperties,
      RecoveryProperties recoveryProperties,
      StrandedMessageRepository strandedMessageRepository,
      HeuleumMetrics metrics,
      ObjectMapper objectMapper,
      Clock clock) {
    this.connection = connection;
    this.subscriptionProperties = subscriptionProperties;
    this.recoveryProperties = recoveryProperties;
    this.strandedMessageRepository = strandedMessageRepository;
    this.metrics = metrics;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  static String advisorySubject(String stream, String durable) {
    return ADVISORY_SUBJECT_PREFIX + stream + "." + durable;
  }

  @PostConstruct
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    String subject = advisorySubject(subscriptionProperties.stream(), subscriptionProperties.durable());
    try {
      ensureAdvisoryStream(subject);
      dispatcher = connection.createDispatcher();
      subscription = connection.jetStream().subscribe(
          subject, dispatcher, this::handleMessage, false, buildPushSubscribeOptions());
      logger.info("max-deliver advisory subscriber started subject={} stream={} durable={}",
          subject,
          recoveryProperties.advisoryStream(),
          recoveryProperties.advisoryDurable());
    } catch (IOException | JetStreamApiException ex) {
      started.set(false);
      throw new IllegalStateException("failed to start max-deliver advisory subscription", ex);
    }
  }

  @PreDestroy
  public void stop() {
    if (subscription != null) {
      try {
        subscription.unsubscribe();
      } catch (IllegalStateException ex) {
        logger.warn("failed to unsubscribe max-deliver advisory subscription", ex);
      }
      subscription = null;
    }
    if (dispatcher != null) {
      connection.closeDispatcher(dispatcher);
      dispatcher = null;
    }
  }

  @VisibleForTesting
  void handleMessage(Message message) {
    try {
      JsonNode payload = objectMapper.readTree(message.getData());
      OptionalLong streamSeq = positiveLong(payload, "stream_seq");
      if (streamSeq.isEmpty()) {
        // nothing to fetch without stream_seq
        logger.warn("advisory payload missing stream_seq stream={}", subscriptionProperties.stream());
        ackSilently(message);
        return;
      }
      int deliveries = (int) positiveLong(payload, "deliveries")
          .orElse(subscriptionProperties.brokerMaxDeliver());
      strandedMessageRepository.insert(
          subscriptionProperties.stream(), streamSeq.getAsLong(), deliveries, Instant.now(clock));
      metrics.recordStranded("recorded");
      logger.warn("message reached broker redelivery limit stream={} streamSeq={} deliveries={}",
          subscriptionProperties.stream(), streamSeq.getAsLong(), deliveries);
      message.ack();
    } catch (IOException ex) {
      // a malformed advisory stays malformed on redelivery
      logger.warn("failed to parse advisory payload stream={}", subscriptionProperties.stream(), ex);
      ackSilently(message);
    } catch (DataAccessException ex) {
      // redelivered once the database is back
      logger.warn("temporary failure while recording advisory stream={}",
          subscriptionProperties.stream(), ex);
      nakSilently(message);
    } catch (RuntimeException ex) {
      logger.warn("failed to handle advisory payload stream={}", subscriptionProperties.stream(), ex);
      nakSilently(message);
    }
  }

  private static OptionalLong positiveLong(JsonNode payload, String field) {
    JsonNode node = payload.get(field);
    if (node == null || !node.canConvertToLong() || node.asLong() <= 0L) {
      return OptionalLong.empty();
    }
    return OptionalLong.of(node.asLong());
  }

  private void ensureAdvisoryStream(String subject) throws IOException, JetStreamApiException {
    StreamConfiguration streamConfiguration = StreamConfiguration.builder()
        .name(recoveryProperties.advisoryStream())
        .subjects(subject)
        .build();
    JetStreamManagement jetStreamManagement = connection.jetStreamManagement();
    try {
      jetStreamManagement.updateStream(streamConfiguration);
    } catch (JetStreamApiException ex) {
      if (!isStreamNotFound(ex)) {
        throw ex;
      }
      jetStreamManagement.addStream(streamConfiguration);
    }
    logger.info("max-deliver advisory stream ensured stream={} subject={}",
        recoveryProperties.advisoryStream(), subject);
  }

  private boolean isStreamNotFound(JetStreamApiException ex) {
    return ex.getApiErrorCode() == STREAM_NOT_FOUND_API_ERROR
        || ex.getErrorCode() == STREAM_NOT_FOUND_ERROR;
  }

  // no maxDeliver: an advisory is redelivered until it has been recorded
  private PushSubscribeOptions buildPushSubscribeOptions() {
    ConsumerConfiguration consumerConfiguration = ConsumerConfiguration.builder()
        .ackPolicy(AckPolicy.Explicit)
        .ackWait(subscriptionProperties.ackWait())
        .build();
    return PushSubscribeOptions.builder()
        .stream(recoveryProperties.advisoryStream())
        .durable(recoveryProperties.advisoryDurable())
        .configuration(consumerConfiguration)
        .build();
  }

  private void nakSilently(Message message) {
    try {
      message.nak();
    } catch (IllegalStateException ex) {
      logger.warn("failed to nack advisory message", ex);
    }
  }

  private void ackSilently(Message message) {
    try {
      message.ack();
    } catch (IllegalStateException ex) {
      logger.warn("failed to ack advisory message", ex);
    }
  }
}
