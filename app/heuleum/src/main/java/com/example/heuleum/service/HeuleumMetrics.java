/*
 * Where: heuleum service layer
 * What: Records message outcomes, dead letters, in-flight depth and sink results
 * Why: Consumer health is observed from Prometheus rather than from logs
 */
package com.example.heuleum.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring managed component and cannot be copied")
public class HeuleumMetrics {

  static final String METRIC_MESSAGES_TOTAL = "heuleum.messages.total";
  static final String METRIC_DEADLETTER_TOTAL = "heuleum.deadletter.total";
  static final String METRIC_INFLIGHT_CURRENT = "heuleum.inflight.current";
  static final String METRIC_PROCESSING_DURATION = "heuleum.processing.duration";
  static final String METRIC_BROKER_ERROR_TOTAL = "heuleum.broker.error.total";
  static final String METRIC_SINK_WRITE_TOTAL = "heuleum.sink.write.total";
  static final String METRIC_SETTLE_FAILURE_TOTAL = "heuleum.settle.failure.total";
  static final String METRIC_DEADLETTER_FAILURE_TOTAL = "heuleum.deadletter.failure.total";
  static final String METRIC_STRANDED_TOTAL = "heuleum.stranded.total";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger inFlight = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> outcomeCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> deadLetterCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> sinkWriteCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> settleFailureCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> deadLetterFailureCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> strandedCounters = new ConcurrentHashMap<>();
  private final Counter brokerErrorCounter;
  private final Timer processingTimer;

  public HeuleumMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_INFLIGHT_CURRENT, inFlight, AtomicInteger::get)
        .description("Messages pulled from the broker and not yet settled")
        .register(meterRegistry);
    this.brokerErrorCounter =
        Counter.builder(METRIC_BROKER_ERROR_TOTAL)
            .description("Failed pulls from the broker")
            .register(meterRegistry);
    this.processingTimer =
        Timer.builder(METRIC_PROCESSING_DURATION)
            .description("Time from dispatch to settlement of a single message")
            .register(meterRegistry);
  }

  public void recordOutcome(String outcome) {
    increment(outcomeCounters, METRIC_MESSAGES_TOTAL, "outcome", outcome, "Settled messages by outcome");
  }

  public void recordDeadLetter(String reason) {
    increment(deadLetterCounters, METRIC_DEADLETTER_TOTAL, "reason", reason, "Dead-lettered messages by reason");
  }

  public void recordSinkWrite(String result) {
    increment(sinkWriteCounters, METRIC_SINK_WRITE_TOTAL, "result", result, "Sink write results");
  }

  public void recordSettleFailure(String operation) {
    increment(
        settleFailureCounters,
        METRIC_SETTLE_FAILURE_TOTAL,
        "operation",
        operation,
        "Ack or nak calls rejected by the client");
  }

  public void recordDeadLetterFailure(String reason, boolean finalDelivery) {
    deadLetterFailureCounters
        .computeIfAbsent(
            reason + "|" + finalDelivery,
            ignored ->
                Counter.builder(METRIC_DEADLETTER_FAILURE_TOTAL)
                    .description("Dead-letter publishes that failed, by reason and broker delivery")
                    .tags(Tags.of("reason", reason, "final_delivery", Boolean.toString(finalDelivery)))
                    .register(meterRegistry))
        .increment();
  }

  public void recordStranded(String result) {
    increment(
        strandedCounters,
        METRIC_STRANDED_TOTAL,
        "result",
        result,
        "Messages past the broker redelivery limit by recovery step");
  }

  public void recordBrokerError() {
    brokerErrorCounter.increment();
  }

  public void recordProcessingDuration(Duration duration) {
    if (duration == null || duration.isNegative()) {
      return;
    }
    processingTimer.record(duration);
  }

  public void updateInFlight(int count) {
    inFlight.set(Math.max(count, 0));
  }

  private void increment(
      ConcurrentMap<String, Counter> counters,
      String name,
      String tagKey,
      String tagValue,
      String description) {
    counters
        .computeIfAbsent(
            tagValue,
            ignored ->
                Counter.builder(name)
                    .description(description)
                    .tags(Tags.of(tagKey, tagValue))
                    .register(meterRegistry))
        .increment();
  }
}
