/*
 * Where: heuleum service layer
 * What: Validates a decoded event, writes it to the sink and classifies the outcome
 * Why: The subscriber loop settles messages from a ProcessingResult, never from exceptions
 */
package com.example.heuleum.service;

import com.example.heuleum.model.DecodedEvent;
import com.example.heuleum.model.FailureReason;
import com.example.heuleum.model.ProcessingResult;
import com.example.heuleum.model.SinkWriteOutcome;
import com.example.heuleum.model.TrackedEvent;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ProcessingPipeline {

  private static final Logger logger = LoggerFactory.getLogger(ProcessingPipeline.class);

  private final EventValidator validator;
  private final EventSink sink;
  private final Clock clock;

  public ProcessingResult process(DecodedEvent event) {
    final TrackedEvent tracked;
    try {
      tracked = validator.validate(event, Instant.now(clock));
    } catch (EventValidationException ex) {
      logger.warn(
          "event rejected by validation messageId={} detail={}", event.messageId(), ex.getMessage());
      return ProcessingResult.poison(FailureReason.VALIDATION_ERROR, ex.getMessage());
    }
    try {
      final SinkWriteOutcome outcome = sink.write(tracked);
      return ProcessingResult.success(outcome);
    } catch (SinkUnavailableException ex) {
      logger.warn("event sink unavailable messageId={}", event.messageId(), ex);
      return ProcessingResult.retryable(FailureReason.SINK_UNAVAILABLE, ex.getMessage());
    } catch (HeuleumException ex) {
      logger.warn("event processing failed messageId={} reason={}",
          event.messageId(), ex.getReason().code(), ex);
      return ex.isRetryable()
          ? ProcessingResult.retryable(ex.getReason(), ex.getMessage())
          : ProcessingResult.poison(ex.getReason(), ex.getMessage());
    } catch (RuntimeException ex) {
      // unknown failures are redelivered to avoid data loss
      logger.warn("unexpected failure while processing event messageId={}", event.messageId(), ex);
      return ProcessingResult.retryable(FailureReason.PROCESSING_ERROR, describe(ex));
    }
  }

  private static String describe(RuntimeException ex) {
    return ex.getMessage() == null ? ex.getClass().getName() : ex.getClass().getName() + ": " + ex.getMessage();
  }
}
