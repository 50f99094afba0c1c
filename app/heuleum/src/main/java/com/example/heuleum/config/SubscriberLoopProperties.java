/*
 * Where: heuleum configuration binding
 * What: Pull/dispatch concurrency, shutdown grace and reconnect backoff of the subscriber loop
 */
package com.example.heuleum.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "heuleum.subscriber")
@Validated
public record SubscriberLoopProperties(
    boolean enabled,
    @NotNull @Positive Integer maxInFlight,
    @NotNull @Positive Integer workerThreads,
    @NotNull @Positive Integer fetchBatchSize,
    @NotNull Duration fetchWait,
    @NotNull Duration shutdownGrace,
    @NotNull Duration reconnectBackoffBase,
    @NotNull Duration reconnectBackoffMax) {

  @AssertTrue(message = "heuleum.subscriber.fetch-wait must be positive")
  public boolean isFetchWaitPositive() {
    return isPositive(fetchWait);
  }

  @AssertTrue(message = "heuleum.subscriber.shutdown-grace must not be negative")
  public boolean isShutdownGraceValid() {
    return shutdownGrace != null && !shutdownGrace.isNegative();
  }

  @AssertTrue(message = "heuleum.subscriber.reconnect-backoff-max must be >= reconnect-backoff-base")
  public boolean isReconnectBackoffOrdered() {
    return isPositive(reconnectBackoffBase)
        && isPositive(reconnectBackoffMax)
        && reconnectBackoffMax.compareTo(reconnectBackoffBase) >= 0;
  }

  private boolean isPositive(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
