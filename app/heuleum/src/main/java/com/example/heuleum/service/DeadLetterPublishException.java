/*
 * Where: heuleum service layer
 * What: The dead-letter subject rejected or never confirmed a publish
 */
package com.example.heuleum.service;

public class DeadLetterPublishException extends RuntimeException {

  public DeadLetterPublishException(String message, Throwable cause) {
    super(message, cause);
  }
}
