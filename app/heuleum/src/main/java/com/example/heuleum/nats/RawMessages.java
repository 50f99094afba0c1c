/*
 * Where: heuleum NATS adapter
 * What: Converts a JetStream delivery into a RawMessage
 * Why: Keeps the broker client types out of the processing path
 */
package com.example.heuleum.nats;

import com.example.heuleum.model.RawMessage;
import io.nats.client.Message;
import io.nats.client.api.MessageInfo;
import io.nats.client.impl.Headers;
import io.nats.client.impl.NatsJetStreamMetaData;
import java.util.LinkedHashMap;
import java.util.Map;

final class RawMessages {

  static final String HEADER_MESSAGE_ID = "Nats-Msg-Id";

  private RawMessages() {}

  static RawMessage from(Message message) {
    NatsJetStreamMetaData metaData = message.metaData();
    Map<String, String> headers = firstValues(message.getHeaders());
    return new RawMessage(
        resolveMessageId(headers, metaData.getStream(), metaData.streamSequence()),
        message.getData(),
        toAttempt(metaData.deliveredCount()),
        metaData.timestamp() == null ? null : metaData.timestamp().toInstant(),
        message.getSubject(),
        headers);
  }

  /**
   * Rebuilds a delivery from a stored stream message, for messages the consumer no longer delivers.
   */
  static RawMessage from(MessageInfo info, String stream, int deliveries) {
    Map<String, String> headers = firstValues(info.getHeaders());
    return new RawMessage(
        resolveMessageId(headers, stream, info.getSeq()),
        info.getData(),
        toAttempt(deliveries),
        info.getTime() == null ? null : info.getTime().toInstant(),
        info.getSubject(),
        headers);
  }

  // both candidates stay the same across redeliveries of one stored message
  private static String resolveMessageId(Map<String, String> headers, String stream, long streamSeq) {
    String messageId = headers.get(HEADER_MESSAGE_ID);
    if (messageId != null && !messageId.isBlank()) {
      return messageId;
    }
    return stream + ":" + streamSeq;
  }

  private static int toAttempt(long deliveredCount) {
    if (deliveredCount < 1) {
      return 1;
    }
    return deliveredCount > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) deliveredCount;
  }

  private static Map<String, String> firstValues(Headers headers) {
    Map<String, String> values = new LinkedHashMap<>();
    if (headers == null) {
      return values;
    }
    for (String key : headers.keySet()) {
      String value = headers.getFirst(key);
      if (value != null) {
        values.put(key, value);
      }
    }
    return values;
  }
}
