/*
 * Where: heuleum domain model
 * What: Message as received from the broker, before decoding
 * Why: The loop, router and pipeline share one immutable view of a delivery
 */
package com.example.heuleum.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record RawMessage(
    String messageId,
    byte[] payload,
    int deliveryAttempt,
    Instant publishTime,
    String subject,
    Map<String, String> headers) {

  public RawMessage {
    Objects.requireNonNull(messageId, "messageId");
    if (deliveryAttempt < 1) {
      throw new IllegalArgumentException("deliveryAttempt must be >= 1");
    }
    payload = payload == null ? new byte[0] : payload.clone();
    headers =
        headers == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
  }

  @Override
  public byte[] payload() {
    return payload.clone();
  }

  public int payloadSize() {
    return payload.length;
  }

  public String header(String name) {
    return headers.get(name);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof RawMessage that)) {
      return false;
    }
    return deliveryAttempt == that.deliveryAttempt
        && messageId.equals(that.messageId)
        && Arrays.equals(payload, that.payload)
        && Objects.equals(publishTime, that.publishTime)
        && Objects.equals(subject, that.subject)
        && headers.equals(that.headers);
  }

  @Override
  public int hashCode() {
    return Objects.hash(messageId, Arrays.hashCode(payload), deliveryAttempt, publishTime, subject, headers);
  }

  @Override
  public String toString() {
    return "RawMessage[messageId=" + messageId
        + ", deliveryAttempt=" + deliveryAttempt
        + ", subject=" + subject
        + ", payloadSize=" + payload.length + "]";
  }
}
