/*
 * Where: heuleum service layer
 * What: Turns raw broker payload bytes into a DecodedEvent
 * Why: Malformed or oversized payloads are rejected before any side effect happens
 */
package com.example.heuleum.service;

import com.example.heuleum.config.EventSchemaProperties;
import com.example.heuleum.model.DecodedEvent;
import com.example.heuleum.model.RawMessage;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import java.io.IOException;
import java.util.LinkedHashMap;
import org.springframework.stereotype.Component;

@Component
public class EnvelopeDecoder {

  private static final TypeReference<LinkedHashMap<String, Object>> FIELD_MAP =
      new TypeReference<>() {};

  private final ObjectMapper objectMapper;
  private final ObjectReader reader;
  private final int maxPayloadBytes;

  public EnvelopeDecoder(ObjectMapper objectMapper, EventSchemaProperties properties) {
    this.objectMapper = objectMapper;
    this.reader = objectMapper.reader()
        .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
        .with(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
    this.maxPayloadBytes = properties.maxPayloadBytes();
  }

  public DecodedEvent decode(RawMessage raw) {
    if (raw.payloadSize() == 0) {
      throw new EventDecodeException("payload is empty");
    }
    // size is checked before parsing so an oversized payload is never buffered into a tree
    if (raw.payloadSize() > maxPayloadBytes) {
      throw new EventDecodeException(
          "payload too large size=" + raw.payloadSize() + " limit=" + maxPayloadBytes);
    }
    JsonNode root;
    try {
      root = reader.readTree(raw.payload());
    } catch (JsonProcessingException ex) {
      throw new EventDecodeException("payload is not valid JSON: " + ex.getOriginalMessage(), ex);
    } catch (IOException ex) {
      throw new EventDecodeException("payload could not be read", ex);
    }
    if (root == null || !root.isObject()) {
      throw new EventDecodeException(
          "payload must be a JSON object but was " + (root == null ? "empty" : root.getNodeType()));
    }
    LinkedHashMap<String, Object> fields = objectMapper.convertValue(root, FIELD_MAP);
    return new DecodedEvent(raw.messageId(), raw.publishTime(), fields);
  }
}
