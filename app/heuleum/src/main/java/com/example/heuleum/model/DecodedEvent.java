/*
 * Where: heuleum domain model
 * What: Top-level fields of a tracking event payload, parsed but not yet validated
 * Why: Separates "is this JSON" from "is this a valid event"
 */
package com.example.heuleum.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record DecodedEvent(String messageId, Instant publishTime, Map<String, Object> fields) {

  public DecodedEvent {
    Objects.requireNonNull(messageId, "messageId");
    // JSON null values are kept, so Map.copyOf is not an option here.
    fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  public boolean has(String name) {
    return fields.containsKey(name);
  }

  public Object field(String name) {
    return fields.get(name);
  }
}
