/*
 * Where: heuleum domain model
 * What: Stable reason codes attached to retries and dead letters
 * Why: Dead-letter consumers and dashboards match on these strings
 */
package com.example.heuleum.model;

public enum FailureReason {
  DECODE_ERROR("decode_error"),
  VALIDATION_ERROR("validation_error"),
  SINK_UNAVAILABLE("sink_unavailable"),
  PROCESSING_ERROR("processing_error"),
  DELIVERY_EXHAUSTED("delivery_exhausted");

  private final String code;

  FailureReason(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}
