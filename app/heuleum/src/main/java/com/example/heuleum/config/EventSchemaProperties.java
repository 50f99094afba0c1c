/*
 * Where: heuleum configuration binding
 * What: Payload size limit and tracking event schema switches
 */
package com.example.heuleum.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "heuleum.event")
@Validated
public record EventSchemaProperties(
    @NotNull @Positive Integer maxPayloadBytes,
    boolean strict,
    @NotBlank String defaultVersion) {}
