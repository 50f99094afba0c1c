/*
 * Where: heuleum infrastructure configuration
 * What: Manages the NATS Connection as a Spring bean
 * Why: The subscriber, dead-letter publisher and bootstrap share one connection
 */
package com.example.heuleum.config;

import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.Nats;
import io.nats.client.Options;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsConfig {

  private static final Logger logger = LoggerFactory.getLogger(NatsConfig.class);

  @Bean(destroyMethod = "close")
  public Connection natsConnection(NatsProperties properties) throws IOException, InterruptedException {
    Options options = new Options.Builder()
        .server(properties.url())
        .connectionTimeout(properties.connectionTimeout())
        // the subscriber loop survives broker restarts, so never give up reconnecting
        .maxReconnects(-1)
        .connectionListener((connection, event) ->
            logger.info("nats connection event={} url={}", event, connection.getConnectedUrl()))
        .build();
    return Nats.connect(options);
  }

  @Bean
  public JetStream jetStream(Connection connection) throws IOException {
    return connection.jetStream();
  }
}
