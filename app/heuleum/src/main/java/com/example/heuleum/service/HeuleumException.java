/*
 * Where: heuleum service layer
 * What: Base of the per-message failures, carrying the reason code used for routing
 */
package com.example.heuleum.service;

import com.example.heuleum.model.FailureReason;

public abstract class HeuleumException extends RuntimeException {

  private final FailureReason reason;

  protected HeuleumException(FailureReason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public FailureReason getReason() {
    return reason;
  }

  public abstract boolean isRetryable();
}
