/*
 * Where: heuleum configuration
 * What: Assembles the subscriber context and the JetStream backed loop
 * Why: The loop, tracker and router share one lifecycle tied to the application context
 */
package com.example.heuleum.config;

import com.example.heuleum.nats.JetStreamDeadLetterPublisher;
import com.example.heuleum.nats.JetStreamMessageSource;
import com.example.heuleum.nats.StreamBootstrap;
import com.example.heuleum.service.DeadLetterPublisher;
import com.example.heuleum.service.DeadLetterRouter;
import com.example.heuleum.service.DeliveryTracker;
import com.example.heuleum.service.EnvelopeDecoder;
import com.example.heuleum.service.HeuleumMetrics;
import com.example.heuleum.service.ProcessingPipeline;
import com.example.heuleum.worker.SubscriberContext;
import com.example.heuleum.worker.SubscriberLoop;
import io.nats.client.JetStream;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(
    name = {"nats.enabled", "heuleum.subscriber.enabled"},
    havingValue = "true",
    matchIfMissing = true)
public class SubscriberConfig {

  @Bean
  public DeliveryTracker deliveryTracker(DeliveryTrackerProperties properties) {
    return new DeliveryTracker(properties.maxEntries(), properties.expireAfter());
  }

  @Bean
  public DeadLetterPublisher deadLetterPublisher(JetStream jetStream) {
    return new JetStreamDeadLetterPublisher(jetStream);
  }

  @Bean
  public DeadLetterRouter deadLetterRouter(
      DeadLetterPublisher publisher,
      DeadLetterProperties properties,
      HeuleumMetrics metrics,
      Clock clock) {
    return new DeadLetterRouter(
        publisher, properties.subject(), properties.errorMessageMaxLength(), metrics, clock);
  }

  @Bean
  public JetStreamMessageSource jetStreamMessageSource(
      JetStream jetStream, SubscriptionProperties properties) {
    return new JetStreamMessageSource(jetStream, properties);
  }

  @Bean
  public SubscriberContext subscriberContext(
      EnvelopeDecoder decoder,
      ProcessingPipeline pipeline,
      DeliveryTracker tracker,
      DeadLetterRouter router,
      HeuleumMetrics metrics,
      SubscriptionProperties subscriptionProperties,
      SubscriberLoopProperties loopProperties) {
    return new SubscriberContext(
        decoder,
        pipeline,
        tracker,
        router,
        metrics,
        subscriptionProperties.maxAttempts(),
        loopProperties);
  }

  // StreamBootstrap is injected so both streams are checked before the first pull
  @Bean
  public SubscriberLoop subscriberLoop(
      JetStreamMessageSource source, SubscriberContext context, StreamBootstrap streamBootstrap) {
    return new SubscriberLoop(source, context);
  }
}
