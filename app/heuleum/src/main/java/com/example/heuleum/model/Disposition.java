/*
 * Where: heuleum domain model
 * What: How a single in-flight message was settled with the broker
 */
package com.example.heuleum.model;

public enum Disposition {
  ACKED("acked"),
  NACKED("nacked"),
  DEAD_LETTERED("dead_lettered"),
  FORCE_NACKED("force_nacked");

  private final String metricValue;

  Disposition(String metricValue) {
    this.metricValue = metricValue;
  }

  public String metricValue() {
    return metricValue;
  }
}
