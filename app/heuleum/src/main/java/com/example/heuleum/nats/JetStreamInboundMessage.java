package com.example.heuleum.nats;

import com.example.heuleum.model.RawMessage;
import com.example.heuleum.worker.InboundMessage;
import io.nats.client.Message;

final class JetStreamInboundMessage implements InboundMessage {

  private final Message message;
  private final RawMessage raw;

  JetStreamInboundMessage(Message message) {
    this.message = message;
    this.raw = RawMessages.from(message);
  }

  @Override
  public RawMessage raw() {
    return raw;
  }

  @Override
  public void ack() {
    message.ack();
  }

  @Override
  public void nack() {
    message.nak();
  }
}
