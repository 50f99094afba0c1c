package com.example.heuleum.service;

import com.example.heuleum.model.SinkWriteOutcome;
import com.example.heuleum.model.TrackedEvent;

/**
 * Destination for validated events.
 *
 * <p>Implementations must be idempotent on {@link TrackedEvent#idempotencyKey()} and signal
 * transient unavailability with {@link SinkUnavailableException}.
 */
public interface EventSink {

  SinkWriteOutcome write(TrackedEvent event);
}
