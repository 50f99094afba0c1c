/*
 * Where: heuleum NATS adapter
 * What: Fetches stranded messages by stream_seq and routes them to the dead-letter subject
 * Why: The broker no longer redelivers them, so the consumer path can not finish them
 */
package com.example.heuleum.nats;

import com.example.heuleum.config.RecoveryProperties;
import com.example.heuleum.model.FailureReason;
import com.example.heuleum.model.RawMessage;
import com.example.heuleum.model.StrandedMessage;
import com.example.heuleum.repository.StrandedMessageRepository;
import com.example.heuleum.service.DeadLetterPublishException;
import com.example.heuleum.service.DeadLetterRouter;
import com.example.heuleum.service.HeuleumMetrics;
import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.api.MessageInfo;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = {"nats.enabled", "heuleum.subscriber.enabled", "heuleum.recovery.enabled"},
    havingValue = "true",
    matchIfMissing = true)
public class StrandedMessageReplayer {

  private static final Logger logger = LoggerFactory.getLogger(StrandedMessageReplayer.class);
  private static final int MESSAGE_NOT_FOUND_ERROR = 404;
  private static final int MESSAGE_NOT_FOUND_API_ERROR = 10037;
  private static final String DETAIL = "broker redelivery limit reached before the message was settled";

  private final Connection connection;
  private final StrandedMessageRepository strandedMessageRepository;
  private final DeadLetterRouter router;
  private final HeuleumMetrics metrics;
  private final RecoveryProperties recoveryProperties;

  public StrandedMessageReplayer(Connection connection,
      StrandedMessageRepository strandedMessageRepository,
      DeadLetterRouter router,
      HeuleumMetrics metrics,
      RecoveryProperties recoveryProperties) {
    this.connection = connection;
    this.strandedMessageRepository = strandedMessageRepository;
    this.router = router;
    this.metrics = metrics;
    this.recoveryProperties = recoveryProperties;
  }

  @Scheduled(fixedDelayString = "${heuleum.recovery.replay-interval}")
  public void run() {
    replay();
  }

  /**
   * Routes the oldest stranded messages. Stops at the first failure so the batch is retried in order
   * on the next run.
   *
   * @return number of rows resolved, either routed or found missing from the stream
   */
  public int replay() {
    List<StrandedMessage> batch;
    try {
      batch = strandedMessageRepository.findOldest(recoveryProperties.replayBatchSize());
    } catch (DataAccessException ex) {
      logger.warn("failed to load stranded messages", ex);
      return 0;
    }
    int resolved = 0;
    for (StrandedMessage stranded : batch) {
      if (!replayOne(stranded)) {
        break;
      }
      resolved++;
    }
    if (resolved > 0) {
      logger.info("stranded messages resolved count={} pending={}", resolved, batch.size() - resolved);
    }
    return resolved;
  }

  private boolean replayOne(StrandedMessage stranded) {
    MessageInfo info;
    try {
      info = connection.jetStreamManagement().getMessage(stranded.stream(), stranded.streamSeq());
    } catch (JetStreamApiException ex) {
      if (!isMessageNotFound(ex)) {
        logger.warn("failed to fetch stranded message stream={} streamSeq={}",
            stranded.stream(), stranded.streamSeq(), ex);
        return false;
      }
      // removed by stream limits or an operator; nothing left to route
      logger.warn("stranded message no longer in stream stream={} streamSeq={}",
          stranded.stream(), stranded.streamSeq());
      metrics.recordStranded("missing");
      return forget(stranded);
    } catch (IOException ex) {
      logger.warn("failed to fetch stranded message stream={} streamSeq={}",
          stranded.stream(), stranded.streamSeq(), ex);
      return false;
    }
    RawMessage raw = RawMessages.from(info, stranded.stream(), stranded.deliveries());
    try {
      router.route(raw, FailureReason.DELIVERY_EXHAUSTED, stranded.deliveries(), DETAIL);
    } catch (DeadLetterPublishException ex) {
      logger.warn("stranded message still not accepted by the dead-letter subject stream={} streamSeq={}",
          stranded.stream(), stranded.streamSeq(), ex);
      return false;
    }
    metrics.recordStranded("routed");
    return forget(stranded);
  }

  private boolean forget(StrandedMessage stranded) {
    try {
      strandedMessageRepository.delete(stranded.stream(), stranded.streamSeq());
      return true;
    } catch (DataAccessException ex) {
      // the dead-letter dedupe id absorbs the repeated route on the next run
      logger.warn("failed to remove stranded message stream={} streamSeq={}",
          stranded.stream(), stranded.streamSeq(), ex);
      return false;
    }
  }

  private boolean isMessageNotFound(JetStreamApiException ex) {
    return ex.getApiErrorCode() == MESSAGE_NOT_FOUND_API_ERROR
        || ex.getErrorCode() == MESSAGE_NOT_FOUND_ERROR;
  }
}
