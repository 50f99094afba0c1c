/*
 * Where: heuleum service layer
 * What: Payload is not a well-formed event envelope
 * Why: Redelivery cannot fix malformed bytes, so this is never retried
 */
package com.example.heuleum.service;

import com.example.heuleum.model.FailureReason;

public class EventDecodeException extends HeuleumException {

  public EventDecodeException(String message) {
    this(message, null);
  }

  public EventDecodeException(String message, Throwable cause) {
    super(FailureReason.DECODE_ERROR, message, cause);
  }

  @Override
  public boolean isRetryable() {
    return false;
  }
}
