/*
 * Where: heuleum configuration binding
 * What: NATS connection target
 * Why: Switch between the local server and a deployed cluster per environment
 */
package com.example.heuleum.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nats")
public record NatsProperties(boolean enabled, String url, Duration connectionTimeout) {}
