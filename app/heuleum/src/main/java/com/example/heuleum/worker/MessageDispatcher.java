/*
 * Where: heuleum worker
 * What: Runs one delivery through decode, processing and settlement
 * Why: Ack happens only after processing finished, dead letters only at the attempt limit
 */
package com.example.heuleum.worker;

import com.example.heuleum.model.DecodedEvent;
import com.example.heuleum.model.Disposition;
import com.example.heuleum.model.FailureReason;
import com.example.heuleum.model.ProcessingResult;
import com.example.heuleum.model.RawMessage;
import com.example.heuleum.service.DeadLetterPublishException;
import com.example.heuleum.service.EventDecodeException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class MessageDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(MessageDispatcher.class);

  private final SubscriberContext context;

  MessageDispatcher(SubscriberContext context) {
    this.context = context;
  }

  Disposition dispatch(InFlightMessage message) {
    final RawMessage raw = message.raw();
    final long startedAt = System.nanoTime();
    try (MessageMdc ignored = MessageMdc.open(raw)) {
      final int attempts = context.tracker().observe(raw.messageId(), raw.deliveryAttempt());
      final ProcessingResult result = evaluate(raw);
      final Disposition disposition = settle(message, raw, attempts, result);
      // force-nacked messages are counted by the shutdown path
      if (disposition != Disposition.FORCE_NACKED) {
        context.metrics().recordOutcome(disposition.metricValue());
      }
      logger.debug("message settled disposition={} attempts={}", disposition, attempts);
      return disposition;
    } finally {
      context.metrics().recordProcessingDuration(Duration.ofNanos(System.nanoTime() - startedAt));
    }
  }

  private ProcessingResult evaluate(RawMessage raw) {
    final DecodedEvent event;
    try {
      event = context.decoder().decode(raw);
    } catch (EventDecodeException ex) {
      logger.warn("failed to decode message payload detail={}", ex.getMessage());
      return ProcessingResult.poison(FailureReason.DECODE_ERROR, ex.getMessage());
    }
    try {
      return context.pipeline().process(event);
    } catch (RuntimeException ex) {
      logger.warn("pipeline failed unexpectedly", ex);
      return ProcessingResult.retryable(FailureReason.PROCESSING_ERROR, ex.toString());
    }
  }

  private Disposition settle(
      InFlightMessage message, RawMessage raw, int attempts, ProcessingResult result) {
    if (result instanceof ProcessingResult.Success) {
      if (!message.ack()) {
        return Disposition.FORCE_NACKED;
      }
      context.tracker().forget(raw.messageId());
      return Disposition.ACKED;
    }
    if (result instanceof ProcessingResult.Retryable retryable
        && attempts < context.maxAttempts()) {
      logger.info(
          "message will be redelivered reason={} attempts={} maxAttempts={}",
          retryable.reason().code(),
          attempts,
          context.maxAttempts());
      return message.nack() ? Disposition.NACKED : Disposition.FORCE_NACKED;
    }
    return deadLetter(message, raw, attempts, result);
  }

  private Disposition deadLetter(
      InFlightMessage message, RawMessage raw, int attempts, ProcessingResult result) {
    if (message.isSettled()) {
      return Disposition.FORCE_NACKED;
    }
    final FailureReason reason;
    final String detail;
    if (result instanceof ProcessingResult.Poison poison) {
      reason = poison.reason();
      detail = poison.detail();
    } else {
      final ProcessingResult.Retryable retryable = (ProcessingResult.Retryable) result;
      reason = retryable.reason();
      detail = retryable.detail();
    }
    try {
      context.router().route(raw, reason, attempts, detail);
    } catch (DeadLetterPublishException ex) {
      final boolean finalDelivery = raw.deliveryAttempt() > context.maxAttempts();
      context.metrics().recordDeadLetterFailure(reason.code(), finalDelivery);
      if (finalDelivery) {
        // no broker redelivery follows; the max-deliver advisory hands it to StrandedMessageReplayer
        logger.error(
            "dead-letter failed on final broker delivery, left for max-deliver recovery "
                + "reason={} attempts={}",
            reason.code(),
            attempts,
            ex);
      } else {
        logger.error(
            "failed to dead-letter message reason={} attempts={}", reason.code(), attempts, ex);
      }
      return message.nack() ? Disposition.NACKED : Disposition.FORCE_NACKED;
    }
    if (!message.ack()) {
      return Disposition.FORCE_NACKED;
    }
    context.tracker().forget(raw.messageId());
    return Disposition.DEAD_LETTERED;
  }
}
