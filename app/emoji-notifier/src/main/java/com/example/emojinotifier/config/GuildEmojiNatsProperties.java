/*
 * Where: emoji-notifier configuration binding
 * What: JetStream subscription settings for guild emoji updates
 * Why: Subject, stream and redelivery window differ per environment
 */
package com.example.emojinotifier.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "emoji-notifier.nats")
@Validated
public record GuildEmojiNatsProperties(
    @NotBlank String subject,
    @NotBlank String stream,
    @NotBlank String durable,
    @NotNull Duration duplicateWindow,
    @NotNull Duration ackWait,
    @NotNull @Positive Integer maxDeliver) {

  @AssertTrue(message = "emoji-notifier.nats.duplicate-window must be positive")
  public boolean isDuplicateWindowPositive() {
    return isPositiveDuration(duplicateWindow);
  }

  @AssertTrue(message = "emoji-notifier.nats.ack-wait must be positive")
  public boolean isAckWaitPositive() {
    return isPositiveDuration(ackWait);
  }

  private boolean isPositiveDuration(Duration duration) {
    // null is reported by @NotNull
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
