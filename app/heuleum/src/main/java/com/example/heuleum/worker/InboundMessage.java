package com.example.heuleum.worker;

import com.example.heuleum.model.RawMessage;

/** A single broker delivery that can be acknowledged or negatively acknowledged. */
public interface InboundMessage {

  RawMessage raw();

  void ack();

  void nack();
}
