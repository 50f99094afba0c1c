package com.example.heuleum.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class HeuleumMetricsTest {

  @Test
  void recordsOutcomeDeadLetterAndInFlightMetrics() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final HeuleumMetrics metrics = new HeuleumMetrics(registry);

    metrics.recordOutcome("acked");
    metrics.recordOutcome("acked");
    metrics.recordOutcome("dead_lettered");
    metrics.recordDeadLetter("decode_error");
    metrics.recordSinkWrite("duplicate");
    metrics.recordBrokerError();
    metrics.recordSettleFailure("ack");
    metrics.recordProcessingDuration(Duration.ofMillis(12));
    metrics.updateInFlight(7);

    assertThat(registry.get("heuleum.messages.total").tag("outcome", "acked").counter().count())
        .isEqualTo(2.0d);
    assertThat(
            registry.get("heuleum.messages.total").tag("outcome", "dead_lettered").counter().count())
        .isEqualTo(1.0d);
    assertThat(
            registry.get("heuleum.deadletter.total").tag("reason", "decode_error").counter().count())
        .isEqualTo(1.0d);
    assertThat(registry.get("heuleum.sink.write.total").tag("result", "duplicate").counter().count())
        .isEqualTo(1.0d);
    assertThat(registry.get("heuleum.broker.error.total").counter().count()).isEqualTo(1.0d);
    assertThat(
            registry.get("heuleum.settle.failure.total").tag("operation", "ack").counter().count())
        .isEqualTo(1.0d);
    assertThat(registry.get("heuleum.processing.duration").timer().count()).isEqualTo(1L);
    assertThat(registry.get("heuleum.inflight.current").gauge().value()).isEqualTo(7.0d);
  }

  @Test
  void negativeInFlightIsClampedToZero() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final HeuleumMetrics metrics = new HeuleumMetrics(registry);

    metrics.updateInFlight(-3);

    assertThat(registry.get("heuleum.inflight.current").gauge().value()).isZero();
  }

  @Test
  void deadLetterFailuresAreSplitByFinalDelivery() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final HeuleumMetrics metrics = new HeuleumMetrics(registry);

    metrics.recordDeadLetterFailure("sink_unavailable", false);
    metrics.recordDeadLetterFailure("sink_unavailable", false);
    metrics.recordDeadLetterFailure("sink_unavailable", true);
    metrics.recordStranded("recorded");

    assertThat(
            registry
                .get("heuleum.deadletter.failure.total")
                .tags("reason", "sink_unavailable", "final_delivery", "false")
                .counter()
                .count())
        .isEqualTo(2.0d);
    assertThat(
            registry
                .get("heuleum.deadletter.failure.total")
                .tags("reason", "sink_unavailable", "final_delivery", "true")
                .counter()
                .count())
        .isEqualTo(1.0d);
    assertThat(registry.get("heuleum.stranded.total").tag("result", "recorded").counter().count())
        .isEqualTo(1.0d);
  }
}
