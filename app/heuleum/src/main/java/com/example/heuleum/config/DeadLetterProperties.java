/*
 * Where: heuleum configuration binding
 * What: Dead-letter subject/stream and diagnostic header limits
 */
package com.example.heuleum.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "heuleum.dead-letter")
@Validated
public record DeadLetterProperties(
    @NotBlank String subject,
    @NotBlank String stream,
    @NotNull @Positive Integer errorMessageMaxLength) {}
