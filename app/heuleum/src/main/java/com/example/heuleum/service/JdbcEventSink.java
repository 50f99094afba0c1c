/*
 * Where: heuleum service layer
 * What: Stores tracked events in Postgres guarded by the processed_events ledger
 * Why: A redelivered message must not produce a second row
 */
package com.example.heuleum.service;

import com.example.heuleum.model.SinkWriteOutcome;
import com.example.heuleum.model.TrackedEvent;
import com.example.heuleum.repository.ProcessedEventRepository;
import com.example.heuleum.repository.TrackedEventRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

@Component
public class JdbcEventSink implements EventSink {

  private static final Logger logger = LoggerFactory.getLogger(JdbcEventSink.class);

  private final ProcessedEventRepository processedEventRepository;
  private final TrackedEventRepository trackedEventRepository;
  private final TransactionTemplate transactionTemplate;
  private final HeuleumMetrics metrics;
  private final Clock clock;

  public JdbcEventSink(ProcessedEventRepository processedEventRepository,
      TrackedEventRepository trackedEventRepository,
      TransactionTemplate transactionTemplate,
      HeuleumMetrics metrics,
      Clock clock) {
    this.processedEventRepository = processedEventRepository;
    this.trackedEventRepository = trackedEventRepository;
    this.transactionTemplate = transactionTemplate;
    this.metrics = metrics;
    this.clock = clock;
  }

  @Override
  public SinkWriteOutcome write(TrackedEvent event) {
    SinkWriteOutcome outcome;
    try {
      outcome = transactionTemplate.execute(status -> writeInTransaction(event));
    } catch (DataIntegrityViolationException ex) {
      // the same row fails the same constraint on every redelivery
      metrics.recordSinkWrite("rejected");
      throw new EventValidationException("event rejected by the event store: " + ex.getMessage(), ex);
    } catch (DataAccessException | TransactionException ex) {
      metrics.recordSinkWrite("unavailable");
      throw new SinkUnavailableException("event store unavailable: " + ex.getMessage(), ex);
    }
    metrics.recordSinkWrite(outcome.name().toLowerCase(Locale.ROOT));
    return outcome;
  }

  private SinkWriteOutcome writeInTransaction(TrackedEvent event) {
    Instant now = Instant.now(clock);
    // ledger row and event row commit together, so a rollback leaves the key free for redelivery
    if (!processedEventRepository.insertIfAbsent(event.idempotencyKey(), now)) {
      logger.info("tracked event duplicate skipped key={} messageId={}",
          event.idempotencyKey(), event.messageId());
      return SinkWriteOutcome.DUPLICATE;
    }
    if (!trackedEventRepository.insertIfAbsent(event)) {
      // ledger row was pruned by retention while the event row stayed
      logger.info("tracked event already stored key={} messageId={}",
          event.idempotencyKey(), event.messageId());
      return SinkWriteOutcome.DUPLICATE;
    }
    logger.debug("tracked event stored key={} type={}", event.idempotencyKey(), event.eventType());
    return SinkWriteOutcome.WRITTEN;
  }
}
