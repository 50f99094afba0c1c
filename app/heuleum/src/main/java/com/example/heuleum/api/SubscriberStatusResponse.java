package com.example.heuleum.api;

public record SubscriberStatusResponse(
    boolean enabled, String state, int inFlight, long trackedMessages) {}
