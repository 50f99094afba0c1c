/*
 * Where: heuleum service layer
 * What: Decoded event violates the tracking event schema
 */
package com.example.heuleum.service;

import com.example.heuleum.model.FailureReason;

public class EventValidationException extends HeuleumException {

  public EventValidationException(String message) {
    this(message, null);
  }

  public EventValidationException(String message, Throwable cause) {
    super(FailureReason.VALIDATION_ERROR, message, cause);
  }

  @Override
  public boolean isRetryable() {
    return false;
  }
}
