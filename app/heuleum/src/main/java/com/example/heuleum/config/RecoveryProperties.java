/*
 * Where: heuleum configuration binding
 * What: Max-deliver advisory stream/durable and the stranded message replay cadence
 * Why: Messages the broker stopped redelivering still have to reach the dead-letter subject
 */
package com.example.heuleum.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "heuleum.recovery")
@Validated
public record RecoveryProperties(
    boolean enabled,
    @NotBlank String advisoryStream,
    @NotBlank String advisoryDurable,
    @NotNull Duration replayInterval,
    @NotNull @Positive Integer replayBatchSize) {}
