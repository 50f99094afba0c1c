/*
 * Where: heuleum service layer
 * What: Pulling from the broker failed (connection, API or timeout error)
 * Why: Fails one loop iteration only; the loop backs off and pulls again
 */
package com.example.heuleum.service;

public class BrokerException extends RuntimeException {

  public BrokerException(String message, Throwable cause) {
    super(message, cause);
  }
}
