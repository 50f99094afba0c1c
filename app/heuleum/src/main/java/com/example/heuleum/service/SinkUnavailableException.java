/*
 * Where: heuleum service layer
 * What: The analytics sink could not accept the record right now
 */
package com.example.heuleum.service;

import com.example.heuleum.model.FailureReason;

public class SinkUnavailableException extends HeuleumException {

  public SinkUnavailableException(String message, Throwable cause) {
    super(FailureReason.SINK_UNAVAILABLE, message, cause);
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}
