/*
 * Where: emoji-notifier infrastructure configuration
 * What: Puts the NATS Connection under Spring's lifecycle
 * Why: The guild update subscriber shares one connection that closes on shutdown
 */
package com.example.emojinotifier.config;

import io.nats.client.Connection;
import io.nats.client.ConnectionListener;
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
  private static final String CONNECTION_NAME = "emoji-notifier";

  @Bean(destroyMethod = "close")
  public Connection natsConnection(NatsProperties properties)
      throws IOException, InterruptedException {
    final Options options =
        new Options.Builder()
            .server(properties.url())
            .connectionName(CONNECTION_NAME)
            .connectionTimeout(properties.connectionTimeout())
            // keep reconnecting; the durable consumer resumes where it stopped
            .maxReconnects(-1)
            .connectionListener(connectionListener())
            .build();
    logger.info("connecting to nats url={}", properties.url());
    return Nats.connect(options);
  }

  private ConnectionListener connectionListener() {
    return (connection, event) -> logger.info("nats connection event={}", event);
  }
}
