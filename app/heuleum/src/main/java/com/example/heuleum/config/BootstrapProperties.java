/*
 * Where: heuleum configuration binding
 * What: Whether startup creates missing streams or only verifies them
 * Why: Local brokers start empty, production streams are owned by infrastructure
 */
package com.example.heuleum.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "heuleum.bootstrap")
public record BootstrapProperties(boolean provisionStreams, Duration duplicateWindow) {}
