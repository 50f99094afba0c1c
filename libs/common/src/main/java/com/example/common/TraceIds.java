/*
 * Where: common utilities
 * What: Resolves the trace id carried by the current thread or mints a new one
 * Why: Log lines and dead-letter metadata share one trace id per message
 */
package com.example.common;

import java.util.UUID;
import org.slf4j.MDC;

public final class TraceIds {

  public static final String MDC_KEY = "trace_id";
  private static final String LEGACY_MDC_KEY = "traceId";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  public static String currentOrNew() {
    final String traceId = MDC.get(MDC_KEY);
    if (traceId != null && !traceId.isBlank()) {
      return traceId;
    }
    final String legacyTraceId = MDC.get(LEGACY_MDC_KEY);
    if (legacyTraceId != null && !legacyTraceId.isBlank()) {
      return legacyTraceId;
    }
    return newTraceId();
  }
}
