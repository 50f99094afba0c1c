/*
 * Where: heuleum domain model
 * What: Stream position of a message the broker stopped redelivering
 */
package com.example.heuleum.model;

import java.time.Instant;

public record StrandedMessage(String stream, long streamSeq, int deliveries, Instant recordedAt) {}
