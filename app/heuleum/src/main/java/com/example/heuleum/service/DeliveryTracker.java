/*
 * Where: heuleum service layer
 * What: Counts delivery attempts per broker message ID
 * Why: Decides when a retryable failure has used up its attempts
 */
package com.example.heuleum.service;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import java.time.Duration;

/**
 * Bounded, expiring attempt counter.
 *
 * <p>Counts are advisory. The broker's own delivery count wins when it is higher, which covers
 * restarts and evictions where the local count was lost.
 */
public class DeliveryTracker {

  private final Cache<String, Integer> attempts;

  public DeliveryTracker(long maxEntries, Duration expireAfter) {
    this(maxEntries, expireAfter, Ticker.systemTicker());
  }

  @VisibleForTesting
  DeliveryTracker(long maxEntries, Duration expireAfter, Ticker ticker) {
    this.attempts =
        CacheBuilder.newBuilder()
            .maximumSize(maxEntries)
            .expireAfterAccess(expireAfter)
            .ticker(ticker)
            .build();
  }

  public int recordAttempt(String messageId) {
    return attempts.asMap().merge(messageId, 1, Integer::sum);
  }

  /**
   * Records one attempt and reconciles it with the broker delivery count.
   *
   * @return the effective attempt count for this delivery
   */
  public int observe(String messageId, int brokerCount) {
    return attempts
        .asMap()
        .compute(messageId, (key, previous) -> Math.max(previous == null ? 1 : previous + 1, brokerCount));
  }

  public boolean exceeded(String messageId, int maxAttempts) {
    return current(messageId) >= maxAttempts;
  }

  public int current(String messageId) {
    final Integer count = attempts.getIfPresent(messageId);
    return count == null ? 0 : count;
  }

  public void forget(String messageId) {
    attempts.invalidate(messageId);
  }

  public long size() {
    attempts.cleanUp();
    return attempts.size();
  }
}
