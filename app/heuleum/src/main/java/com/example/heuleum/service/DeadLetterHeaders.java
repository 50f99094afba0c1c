package com.example.heuleum.service;

/** Header names attached to every message published on the dead-letter subject. */
public final class DeadLetterHeaders {
  private DeadLetterHeaders() {}

  public static final String REASON = "heuleum-dlq-reason";
  public static final String ATTEMPTS = "heuleum-dlq-attempts";
  public static final String ORIGINAL_TOPIC = "heuleum-dlq-original-topic";
  public static final String MESSAGE_ID = "heuleum-dlq-message-id";
  public static final String ERROR = "heuleum-dlq-error";
  public static final String FAILED_AT = "heuleum-dlq-failed-at";
  public static final String PUBLISH_TIME = "heuleum-dlq-publish-time";

  /** Broker reserved prefix, never copied from the original message. */
  static final String BROKER_HEADER_PREFIX = "Nats-";
  static final String DEDUPE_PREFIX = "dlq-";
}
