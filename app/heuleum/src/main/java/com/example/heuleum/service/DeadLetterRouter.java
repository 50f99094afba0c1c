/*
 * Where: heuleum service layer
 * What: Publishes poison or exhausted messages to the dead-letter subject with failure metadata
 * Why: Failed messages stay observable instead of being dropped by the broker
 */
package com.example.heuleum.service;

import com.example.heuleum.model.DeadLetterRecord;
import com.example.heuleum.model.FailureReason;
import com.example.heuleum.model.RawMessage;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DeadLetterRouter {

  private static final Logger logger = LoggerFactory.getLogger(DeadLetterRouter.class);

  private final DeadLetterPublisher publisher;
  private final String deadLetterSubject;
  private final int errorMessageMaxLength;
  private final HeuleumMetrics metrics;
  private final Clock clock;

  public DeadLetterRouter(DeadLetterPublisher publisher,
      String deadLetterSubject,
      int errorMessageMaxLength,
      HeuleumMetrics metrics,
      Clock clock) {
    this.publisher = publisher;
    this.deadLetterSubject = deadLetterSubject;
    this.errorMessageMaxLength = errorMessageMaxLength;
    this.metrics = metrics;
    this.clock = clock;
  }

  public DeadLetterRecord route(RawMessage raw, FailureReason reason, int attempts) {
    return route(raw, reason, attempts, null);
  }

  /**
   * @throws DeadLetterPublishException when the dead-letter subject did not accept the message;
   *     the caller must not ack the original in that case
   */
  public DeadLetterRecord route(RawMessage raw, FailureReason reason, int attempts, String detail) {
    Instant failedAt = Instant.now(clock);
    String error = truncate(sanitize(detail));
    DeadLetterRecord record = new DeadLetterRecord(
        raw, reason.code(), attempts, raw.subject(), error, failedAt);
    publisher.publish(deadLetterSubject, buildHeaders(record),
        raw.payload(), DeadLetterHeaders.DEDUPE_PREFIX + raw.messageId());
    metrics.recordDeadLetter(reason.code());
    logger.warn("message dead-lettered messageId={} reason={} attempts={} originalTopic={} error={}",
        raw.messageId(), reason.code(), attempts, raw.subject(), error);
    return record;
  }

  Map<String, String> buildHeaders(DeadLetterRecord record) {
    Map<String, String> headers = new LinkedHashMap<>();
    record.original().headers().forEach((name, value) -> {
      if (!name.startsWith(DeadLetterHeaders.BROKER_HEADER_PREFIX)) {
        headers.put(name, value);
      }
    });
    headers.put(DeadLetterHeaders.REASON, record.reason());
    headers.put(DeadLetterHeaders.ATTEMPTS, Integer.toString(record.attempts()));
    if (record.originalTopic() != null) {
      headers.put(DeadLetterHeaders.ORIGINAL_TOPIC, record.originalTopic());
    }
    headers.put(DeadLetterHeaders.MESSAGE_ID, record.original().messageId());
    if (record.errorDetail() != null && !record.errorDetail().isEmpty()) {
      headers.put(DeadLetterHeaders.ERROR, record.errorDetail());
    }
    headers.put(DeadLetterHeaders.FAILED_AT, record.deadLetteredAt().toString());
    if (record.original().publishTime() != null) {
      headers.put(DeadLetterHeaders.PUBLISH_TIME, record.original().publishTime().toString());
    }
    return headers;
  }

  // header values must stay on a single line
  private static String sanitize(String detail) {
    if (detail == null) {
      return null;
    }
    return detail.replace('\r', ' ').replace('\n', ' ');
  }

  private String truncate(String detail) {
    if (detail == null || detail.length() <= errorMessageMaxLength) {
      return detail;
    }
    return detail.substring(0, errorMessageMaxLength);
  }
}
