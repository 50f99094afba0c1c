/*
 * Where: heuleum service layer
 * What: Deletes processed_events rows older than the retention window
 * Why: The ledger only needs to outlive broker redelivery, not the stored events
 */
package com.example.heuleum.service;

import com.example.heuleum.config.RetentionProperties;
import com.example.heuleum.repository.ProcessedEventRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RetentionService {

  private static final Logger logger = LoggerFactory.getLogger(RetentionService.class);

  private final ProcessedEventRepository processedEventRepository;
  private final RetentionProperties properties;
  private final Clock clock;

  public int cleanup() {
    final Instant threshold = Instant.now(clock).minus(Duration.ofDays(properties.retentionDays()));
    final int deleted = processedEventRepository.deleteOlderThan(threshold);
    logger.info("ledger retention cleanup deleted processedEvents={} threshold={}", deleted, threshold);
    return deleted;
  }
}
