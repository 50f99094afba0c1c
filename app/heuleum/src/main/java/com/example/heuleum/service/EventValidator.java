/*
 * Where: heuleum service layer
 * What: Checks a decoded event against the tracking event schema and builds the sink record
 * Why: Schema violations must surface as poison before anything reaches the sink
 */
package com.example.heuleum.service;

import com.example.heuleum.config.EventSchemaProperties;
import com.example.heuleum.model.DecodedEvent;
import com.example.heuleum.model.TrackedEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

@Component
public class EventValidator {

  static final String FIELD_EVENT = "event";
  static final String FIELD_ID = "id";
  static final String FIELD_TIMESTAMP = "timestamp";
  static final String FIELD_VERSION = "version";
  static final String FIELD_PROPERTIES = "properties";

  private static final List<String> KNOWN_FIELDS =
      List.of(FIELD_EVENT, FIELD_ID, FIELD_TIMESTAMP, FIELD_VERSION, FIELD_PROPERTIES);
  private static final int MAX_TEXT_LENGTH = 255;
  private static final String EMPTY_PROPERTIES = "{}";

  private final ObjectMapper objectMapper;
  private final EventSchemaProperties properties;

  public EventValidator(ObjectMapper objectMapper, EventSchemaProperties properties) {
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  public TrackedEvent validate(DecodedEvent event, Instant receivedAt) {
    rejectUnknownFields(event);
    rejectNullFields(event);
    String eventType = requireText(event, FIELD_EVENT);
    String id = optionalText(event, FIELD_ID);
    Instant occurredAt = resolveOccurredAt(event, receivedAt);
    String version = resolveVersion(event);
    String propertiesJson = resolveProperties(event);
    String messageId = requireStorableMessageId(event);
    String idempotencyKey = id != null ? id : messageId;
    return new TrackedEvent(
        idempotencyKey,
        eventType,
        occurredAt,
        version,
        propertiesJson,
        messageId,
        receivedAt);
  }

  private void rejectUnknownFields(DecodedEvent event) {
    if (!properties.strict()) {
      return;
    }
    Set<String> unknown = new TreeSet<>(event.fields().keySet());
    KNOWN_FIELDS.forEach(unknown::remove);
    if (!unknown.isEmpty()) {
      throw new EventValidationException("unknown fields " + unknown);
    }
  }

  private void rejectNullFields(DecodedEvent event) {
    for (String name : KNOWN_FIELDS) {
      if (event.has(name) && event.field(name) == null) {
        throw new EventValidationException("field '" + name + "' must not be null");
      }
    }
  }

  private String requireText(DecodedEvent event, String name) {
    if (!event.has(name)) {
      throw new EventValidationException("field '" + name + "' is required");
    }
    return optionalText(event, name);
  }

  private String optionalText(DecodedEvent event, String name) {
    if (!event.has(name)) {
      return null;
    }
    if (!(event.field(name) instanceof String text)) {
      throw new EventValidationException("field '" + name + "' must be a string");
    }
    if (text.isBlank()) {
      throw new EventValidationException("field '" + name + "' must not be blank");
    }
    if (text.length() > MAX_TEXT_LENGTH) {
      throw new EventValidationException(
          "field '" + name + "' exceeds " + MAX_TEXT_LENGTH + " characters");
    }
    return text;
  }

  private String requireStorableMessageId(DecodedEvent event) {
    String messageId = event.messageId();
    if (messageId.length() > MAX_TEXT_LENGTH) {
      throw new EventValidationException(
          "message id exceeds " + MAX_TEXT_LENGTH + " characters");
    }
    return messageId;
  }

  private Instant resolveOccurredAt(DecodedEvent event, Instant receivedAt) {
    String timestamp = optionalText(event, FIELD_TIMESTAMP);
    if (timestamp == null) {
      return event.publishTime() != null ? event.publishTime() : receivedAt;
    }
    try {
      return Instant.parse(timestamp);
    } catch (DateTimeParseException ignored) {
      // not in Z form, try an explicit offset next
    }
    try {
      return OffsetDateTime.parse(timestamp).toInstant();
    } catch (DateTimeParseException ex) {
      throw new EventValidationException(
          "field 'timestamp' is not an ISO-8601 date-time: " + timestamp, ex);
    }
  }

  private String resolveVersion(DecodedEvent event) {
    if (!event.has(FIELD_VERSION)) {
      return properties.defaultVersion();
    }
    // integral versions are coerced to their string form
    if (event.field(FIELD_VERSION) instanceof Integer || event.field(FIELD_VERSION) instanceof Long) {
      return String.valueOf(event.field(FIELD_VERSION));
    }
    return optionalText(event, FIELD_VERSION);
  }

  private String resolveProperties(DecodedEvent event) {
    if (!event.has(FIELD_PROPERTIES)) {
      return EMPTY_PROPERTIES;
    }
    if (!(event.field(FIELD_PROPERTIES) instanceof Map<?, ?> map)) {
      throw new EventValidationException("field 'properties' must be a JSON object");
    }
    try {
      return objectMapper.writeValueAsString(map);
    } catch (JsonProcessingException ex) {
      throw new EventValidationException("field 'properties' could not be serialized", ex);
    }
  }
}
