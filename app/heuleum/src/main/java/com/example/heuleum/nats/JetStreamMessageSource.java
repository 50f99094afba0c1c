/*
 * Where: heuleum NATS adapter
 * What: Pulls batches from a durable JetStream pull consumer
 * Why: The subscriber loop decides when and how much to pull instead of a push callback
 */
package com.example.heuleum.nats;

import com.example.heuleum.config.SubscriptionProperties;
import com.example.heuleum.service.BrokerException;
import com.example.heuleum.worker.InboundMessage;
import com.example.heuleum.worker.MessageSource;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PullSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class JetStreamMessageSource implements MessageSource {

  private static final Logger logger = LoggerFactory.getLogger(JetStreamMessageSource.class);

  private final JetStream jetStream;
  private final SubscriptionProperties properties;
  private JetStreamSubscription subscription;

  public JetStreamMessageSource(JetStream jetStream, SubscriptionProperties properties) {
    this.jetStream = jetStream;
    this.properties = properties;
  }

  @Override
  public synchronized List<InboundMessage> pull(int maxMessages, Duration maxWait) {
    try {
      List<Message> messages = subscription().fetch(maxMessages, maxWait);
      List<InboundMessage> deliveries = new ArrayList<>(messages.size());
      for (Message message : messages) {
        // status and heartbeat messages carry no payload for us
        if (message.isJetStream()) {
          deliveries.add(new JetStreamInboundMessage(message));
        }
      }
      return deliveries;
    } catch (IOException | JetStreamApiException ex) {
      throw new BrokerException("failed to subscribe to " + properties.subject(), ex);
    } catch (IllegalStateException ex) {
      throw new BrokerException("failed to fetch from " + properties.subject(), ex);
    }
  }

  @Override
  public synchronized void reset() {
    unsubscribeSilently();
  }

  @Override
  public synchronized void close() {
    unsubscribeSilently();
  }

  private JetStreamSubscription subscription() throws IOException, JetStreamApiException {
    if (subscription == null) {
      subscription = jetStream.subscribe(properties.subject(), buildPullSubscribeOptions());
      logger.info("pull subscription created subject={} stream={} durable={}",
          properties.subject(),
          properties.stream(),
          properties.durable());
    }
    return subscription;
  }

  private PullSubscribeOptions buildPullSubscribeOptions() {
    ConsumerConfiguration consumerConfiguration = ConsumerConfiguration.builder()
        .ackPolicy(AckPolicy.Explicit)
        .ackWait(properties.ackWait())
        // one above max-attempts so the last attempt still reaches the dead-letter router
        .maxDeliver(properties.brokerMaxDeliver())
        .build();
    return PullSubscribeOptions.builder()
        .stream(properties.stream())
        .durable(properties.durable())
        .configuration(consumerConfiguration)
        .build();
  }

  private void unsubscribeSilently() {
    if (subscription == null) {
      return;
    }
    try {
      subscription.unsubscribe();
    } catch (IllegalStateException ex) {
      logger.warn("failed to unsubscribe pull subscription subject={}", properties.subject(), ex);
    } finally {
      subscription = null;
    }
  }
}
