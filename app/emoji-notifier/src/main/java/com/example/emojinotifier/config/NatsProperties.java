/*
 * Where: emoji-notifier configuration binding
 * What: NATS server URL and connect timeout
 * Why: The subscription transport endpoint is environment specific
 */
package com.example.emojinotifier.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nats")
public record NatsProperties(boolean enabled, String url, Duration connectionTimeout) {

  public NatsProperties {
    url = url == null || url.isBlank() ? "nats://localhost:4222" : url;
    connectionTimeout = connectionTimeout == null ? Duration.ofSeconds(5) : connectionTimeout;
  }
}
