package com.example.heuleum.worker;

import com.example.heuleum.config.SubscriberLoopProperties;
import com.example.heuleum.service.DeadLetterRouter;
import com.example.heuleum.service.DeliveryTracker;
import com.example.heuleum.service.EnvelopeDecoder;
import com.example.heuleum.service.HeuleumMetrics;
import com.example.heuleum.service.ProcessingPipeline;
import java.util.Objects;

/** Everything a running subscriber needs, assembled once at startup. */
public record SubscriberContext(
    EnvelopeDecoder decoder,
    ProcessingPipeline pipeline,
    DeliveryTracker tracker,
    DeadLetterRouter router,
    HeuleumMetrics metrics,
    int maxAttempts,
    SubscriberLoopProperties loop) {

  public SubscriberContext {
    Objects.requireNonNull(decoder, "decoder");
    Objects.requireNonNull(pipeline, "pipeline");
    Objects.requireNonNull(tracker, "tracker");
    Objects.requireNonNull(router, "router");
    Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(loop, "loop");
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
  }
}
