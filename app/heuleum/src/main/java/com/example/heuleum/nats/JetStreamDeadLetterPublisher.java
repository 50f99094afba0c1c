/*
 * Where: heuleum NATS adapter
 * What: Publishes dead letters to JetStream and waits for the publish ack
 * Why: The original is acked only once the dead-letter stream stored the copy
 */
package com.example.heuleum.nats;

import com.example.heuleum.service.DeadLetterPublishException;
import com.example.heuleum.service.DeadLetterPublisher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@RequiredArgsConstructor
public class JetStreamDeadLetterPublisher implements DeadLetterPublisher {

  private static final Logger logger = LoggerFactory.getLogger(JetStreamDeadLetterPublisher.class);

  private final JetStream jetStream;

  @Override
  public void publish(String subject, Map<String, String> headers, byte[] payload, String dedupeId) {
    Headers natsHeaders = new Headers();
    headers.forEach((name, value) -> natsHeaders.add(name, value));
    // the stream drops a second copy carrying the same id within its duplicate window
    natsHeaders.put(RawMessages.HEADER_MESSAGE_ID, dedupeId);
    PublishAck ack;
    try {
      ack = jetStream.publish(subject, natsHeaders, payload);
    } catch (IOException | JetStreamApiException ex) {
      throw new DeadLetterPublishException("failed to publish dead letter to " + subject, ex);
    }
    if (ack == null) {
      throw new DeadLetterPublishException("puback is missing for dead letter " + dedupeId, null);
    }
    if (ack.isDuplicate()) {
      logger.info("dead letter already stored dedupeId={} stream={} seq={}",
          dedupeId, ack.getStream(), ack.getSeqno());
    }
  }
}
