package com.example.heuleum.worker;

import com.example.heuleum.model.RawMessage;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

final class FakeInboundMessage implements InboundMessage {

  private final RawMessage raw;
  private final AtomicInteger acks = new AtomicInteger();
  private final AtomicInteger nacks = new AtomicInteger();
  private final CountDownLatch settled = new CountDownLatch(1);

  FakeInboundMessage(RawMessage raw) {
    this.raw = raw;
  }

  static FakeInboundMessage of(String messageId, String json, int deliveryAttempt) {
    return new FakeInboundMessage(
        new RawMessage(
            messageId,
            json.getBytes(StandardCharsets.UTF_8),
            deliveryAttempt,
            Instant.parse("2026-03-01T00:00:00Z"),
            "heuleum.events",
            Map.of()));
  }

  @Override
  public RawMessage raw() {
    return raw;
  }

  @Override
  public void ack() {
    acks.incrementAndGet();
    settled.countDown();
  }

  @Override
  public void nack() {
    nacks.incrementAndGet();
    settled.countDown();
  }

  int acks() {
    return acks.get();
  }

  int nacks() {
    return nacks.get();
  }

  CountDownLatch settledLatch() {
    return settled;
  }
}
