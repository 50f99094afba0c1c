/*
 * Where: heuleum domain model
 * What: Outcome of running one decoded event through the pipeline
 * Why: The loop picks ack, nak or dead-letter from this value alone
 */
package com.example.heuleum.model;

import java.util.Objects;

public sealed interface ProcessingResult
    permits ProcessingResult.Success, ProcessingResult.Retryable, ProcessingResult.Poison {

  static ProcessingResult success(SinkWriteOutcome output) {
    return new Success(output);
  }

  static ProcessingResult retryable(FailureReason reason, String detail) {
    return new Retryable(reason, detail);
  }

  static ProcessingResult poison(FailureReason reason, String detail) {
    return new Poison(reason, detail);
  }

  record Success(SinkWriteOutcome output) implements ProcessingResult {
    public Success {
      Objects.requireNonNull(output, "output");
    }
  }

  record Retryable(FailureReason reason, String detail) implements ProcessingResult {
    public Retryable {
      Objects.requireNonNull(reason, "reason");
    }
  }

  record Poison(FailureReason reason, String detail) implements ProcessingResult {
    public Poison {
      Objects.requireNonNull(reason, "reason");
    }
  }
}
