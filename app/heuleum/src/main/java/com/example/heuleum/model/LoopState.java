/*
 * Where: heuleum domain model
 * What: States of the subscriber loop thread
 */
package com.example.heuleum.model;

public enum LoopState {
  IDLE,
  PULLING,
  DISPATCHING,
  DRAINING,
  STOPPED
}
