/*
 * Where: heuleum configuration binding
 * What: Bounds of the in-memory delivery attempt map
 */
package com.example.heuleum.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "heuleum.tracker")
@Validated
public record DeliveryTrackerProperties(
    @NotNull @Positive Long maxEntries,
    @NotNull Duration expireAfter) {}
