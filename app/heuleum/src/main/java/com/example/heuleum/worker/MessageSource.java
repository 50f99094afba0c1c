package com.example.heuleum.worker;

import com.example.heuleum.service.BrokerException;
import java.time.Duration;
import java.util.List;

/** Pull side of the broker consumed by {@link SubscriberLoop}. */
public interface MessageSource extends AutoCloseable {

  /**
   * Blocks up to {@code maxWait} and returns at most {@code maxMessages} deliveries. An empty list
   * means nothing arrived in time.
   *
   * @throws BrokerException when the broker cannot be reached
   */
  List<InboundMessage> pull(int maxMessages, Duration maxWait);

  /** Drops the current subscription so the next pull starts from a fresh one. */
  default void reset() {}

  @Override
  void close();
}
