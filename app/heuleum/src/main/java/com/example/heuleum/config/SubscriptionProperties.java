/*
 * Where: heuleum configuration binding
 * What: Source subscription (subject/stream/durable/ack-wait/max-attempts)
 * Why: Redelivery limits are validated at startup instead of failing at the first message
 */
package com.example.heuleum.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "heuleum.subscription")
@Validated
public record SubscriptionProperties(
    @NotBlank String subject,
    @NotBlank String stream,
    @NotBlank String durable,
    @NotNull Duration ackWait,
    @NotNull @Positive Integer maxAttempts) {

  @AssertTrue(message = "heuleum.subscription.ack-wait must be positive")
  public boolean isAckWaitPositive() {
    return ackWait != null && !ackWait.isZero() && !ackWait.isNegative();
  }

  /**
   * Broker side redelivery limit. One above {@link #maxAttempts()} so the broker never
   * drops a message before the service had the chance to dead-letter it.
   */
  public long brokerMaxDeliver() {
    return maxAttempts.longValue() + 1L;
  }
}
