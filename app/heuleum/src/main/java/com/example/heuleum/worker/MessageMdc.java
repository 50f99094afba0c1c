/*
 * Where: heuleum worker
 * What: Scopes per-message logging context to the dispatching thread
 * Why: Every log line of a delivery carries its message ID and trace ID
 */
package com.example.heuleum.worker;

import com.example.common.TraceIds;
import com.example.heuleum.model.RawMessage;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.MDC;

final class MessageMdc implements AutoCloseable {

  static final String MESSAGE_ID = "message_id";
  static final String DELIVERY_ATTEMPT = "delivery_attempt";
  static final String SUBJECT = "subject";
  static final String TRACE_ID_HEADER = "trace_id";
  static final String TRACE_ID_HEADER_ALT = "Trace-Id";

  private final List<String> keys = new ArrayList<>();

  private MessageMdc() {}

  static MessageMdc open(RawMessage raw) {
    final MessageMdc mdc = new MessageMdc();
    mdc.put(MESSAGE_ID, raw.messageId());
    mdc.put(DELIVERY_ATTEMPT, Integer.toString(raw.deliveryAttempt()));
    mdc.put(SUBJECT, raw.subject());
    mdc.put(TraceIds.MDC_KEY, resolveTraceId(raw));
    return mdc;
  }

  private static String resolveTraceId(RawMessage raw) {
    final String traceId = raw.header(TRACE_ID_HEADER);
    if (traceId != null && !traceId.isBlank()) {
      return traceId;
    }
    final String alternative = raw.header(TRACE_ID_HEADER_ALT);
    if (alternative != null && !alternative.isBlank()) {
      return alternative;
    }
    return TraceIds.currentOrNew();
  }

  private void put(String key, String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    MDC.put(key, value);
    keys.add(key);
  }

  @Override
  public void close() {
    keys.forEach(MDC::remove);
  }
}
