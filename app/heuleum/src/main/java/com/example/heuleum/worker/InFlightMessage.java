/*
 * Where: heuleum worker
 * What: Wraps a delivery with a settle-once flag shared by workers and the shutdown path
 * Why: A message force-nacked during shutdown must never be acked afterwards
 */
package com.example.heuleum.worker;

import com.example.heuleum.model.RawMessage;
import com.example.heuleum.service.HeuleumMetrics;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class InFlightMessage {

  private static final Logger logger = LoggerFactory.getLogger(InFlightMessage.class);

  private final InboundMessage delivery;
  private final RawMessage raw;
  private final HeuleumMetrics metrics;
  private final AtomicBoolean settled = new AtomicBoolean(false);

  InFlightMessage(InboundMessage delivery, HeuleumMetrics metrics) {
    this.delivery = delivery;
    this.raw = delivery.raw();
    this.metrics = metrics;
  }

  RawMessage raw() {
    return raw;
  }

  boolean isSettled() {
    return settled.get();
  }

  /**
   * @return false when another path already settled this message
   */
  boolean ack() {
    if (!settled.compareAndSet(false, true)) {
      return false;
    }
    ackSilently();
    return true;
  }

  boolean nack() {
    if (!settled.compareAndSet(false, true)) {
      return false;
    }
    nackSilently();
    return true;
  }

  private void ackSilently() {
    try {
      delivery.ack();
    } catch (IllegalStateException ex) {
      metrics.recordSettleFailure("ack");
      logger.warn("failed to ack message messageId={}", raw.messageId(), ex);
    }
  }

  private void nackSilently() {
    try {
      delivery.nack();
    } catch (IllegalStateException ex) {
      metrics.recordSettleFailure("nack");
      logger.warn("failed to nack message messageId={}", raw.messageId(), ex);
    }
  }
}
