package com.example.heuleum.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "heuleum.retention.enabled", havingValue = "true")
public class RetentionWorker {

  private final RetentionService retentionService;

  @Scheduled(fixedDelayString = "${heuleum.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
