/*
 * Where: heuleum domain model
 * What: A message handed to the dead-letter subject together with its diagnostics
 */
package com.example.heuleum.model;

import java.time.Instant;

public record DeadLetterRecord(
    RawMessage original,
    String reason,
    int attempts,
    String originalTopic,
    String errorDetail,
    Instant deadLetteredAt) {}
