/*
 * Where: heuleum configuration
 * What: Retention settings for the processed_events idempotency ledger
 * Why: Keeps the ledger bounded while covering the broker redelivery horizon
 */
package com.example.heuleum.config;

import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "heuleum.retention")
@Validated
public record RetentionProperties(
    boolean enabled,
    @Positive int retentionDays,
    Duration cleanupInterval) {}
