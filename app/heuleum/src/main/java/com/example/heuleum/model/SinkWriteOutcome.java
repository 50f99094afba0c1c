package com.example.heuleum.model;

public enum SinkWriteOutcome {
  WRITTEN,
  DUPLICATE
}
