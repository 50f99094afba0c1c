package com.example.heuleum.service;

import java.util.Map;

/** Outbound side of the dead-letter router. */
public interface DeadLetterPublisher {

  /**
   * Publishes the payload with headers; {@code dedupeId} lets the broker drop repeats.
   *
   * @throws DeadLetterPublishException when the broker did not accept the message
   */
  void publish(String subject, Map<String, String> headers, byte[] payload, String dedupeId);
}
