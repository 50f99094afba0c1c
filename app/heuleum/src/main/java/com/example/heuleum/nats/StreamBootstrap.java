/*
 * Where: heuleum NATS adapter
 * What: Verifies or provisions the inbound and dead-letter streams before consuming
 * Why: Dead-lettering must never be the first place a missing stream is noticed
 */
package com.example.heuleum.nats;

import com.example.heuleum.config.BootstrapProperties;
import com.example.heuleum.config.DeadLetterProperties;
import com.example.heuleum.config.SubscriptionProperties;
import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.StreamConfiguration;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class StreamBootstrap {

  private static final Logger logger = LoggerFactory.getLogger(StreamBootstrap.class);
  private static final int STREAM_NOT_FOUND_ERROR = 404;
  private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

  private final Connection connection;
  private final SubscriptionProperties subscriptionProperties;
  private final DeadLetterProperties deadLetterProperties;
  private final BootstrapProperties bootstrapProperties;

  public StreamBootstrap(Connection connection,
      SubscriptionProperties subscriptionProperties,
      DeadLetterProperties deadLetterProperties,
      BootstrapProperties bootstrapProperties) {
    this.connection = connection;
    this.subscriptionProperties = subscriptionProperties;
    this.deadLetterProperties = deadLetterProperties;
    this.bootstrapProperties = bootstrapProperties;
  }

  @PostConstruct
  public void ensureStreams() {
    try {
      JetStreamManagement jetStreamManagement = connection.jetStreamManagement();
      ensureStream(jetStreamManagement, subscriptionProperties.stream(), subscriptionProperties.subject());
      ensureStream(jetStreamManagement, deadLetterProperties.stream(), deadLetterProperties.subject());
    } catch (IOException | JetStreamApiException ex) {
      throw new IllegalStateException("failed to prepare JetStream streams", ex);
    }
  }

  private void ensureStream(JetStreamManagement jetStreamManagement, String stream, String subject)
      throws IOException, JetStreamApiException {
    if (bootstrapProperties.provisionStreams()) {
      StreamConfiguration.Builder builder = StreamConfiguration.builder()
          .name(stream)
          .subjects(subject);
      if (bootstrapProperties.duplicateWindow() != null) {
        builder.duplicateWindow(bootstrapProperties.duplicateWindow());
      }
      upsertStream(jetStreamManagement, builder.build());
      logger.info("stream provisioned stream={} subject={}", stream, subject);
      return;
    }
    try {
      jetStreamManagement.getStreamInfo(stream);
      logger.info("stream verified stream={} subject={}", stream, subject);
    } catch (JetStreamApiException ex) {
      if (!isStreamNotFound(ex)) {
        throw ex;
      }
      throw new IllegalStateException("stream " + stream + " for subject " + subject
          + " does not exist; create it or set heuleum.bootstrap.provision-streams=true", ex);
    }
  }

  private void upsertStream(JetStreamManagement jetStreamManagement,
      StreamConfiguration streamConfiguration) throws IOException, JetStreamApiException {
    try {
      jetStreamManagement.updateStream(streamConfiguration);
    } catch (JetStreamApiException ex) {
      if (!isStreamNotFound(ex)) {
        throw ex;
      }
      jetStreamManagement.addStream(streamConfiguration);
    }
  }

  private boolean isStreamNotFound(JetStreamApiException ex) {
    return ex.getApiErrorCode() == STREAM_NOT_FOUND_API_ERROR
        || ex.getErrorCode() == STREAM_NOT_FOUND_ERROR;
  }
}
