/*
 * Where: emoji-notifier configuration binding
 * What: Aggregation worker switch and shutdown grace period
 * Why: Tests and tooling can boot the context without the worker thread
 */
package com.example.emojinotifier.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "emoji-notifier.worker")
public record EmojiWorkerProperties(Boolean enabled, Duration shutdownTimeout) {

  public EmojiWorkerProperties {
    enabled = enabled == null ? Boolean.TRUE : enabled;
    shutdownTimeout = shutdownTimeout == null ? Duration.ofSeconds(30) : shutdownTimeout;
  }
}
