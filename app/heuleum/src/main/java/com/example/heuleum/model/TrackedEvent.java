/*
 * Where: heuleum domain model
 * What: Validated tracking event ready for the analytics sink
 */
package com.example.heuleum.model;

import java.time.Instant;

public record TrackedEvent(
    String idempotencyKey,
    String eventType,
    Instant occurredAt,
    String version,
    String propertiesJson,
    String messageId,
    Instant receivedAt) {}
