/*
 * Where: emoji-notifier configuration binding
 * What: Credential, aggregation window and channel store location
 * Why: A missing bot token must stop the process at startup
 */
package com.example.emojinotifier.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "emoji-notifier")
@Validated
public record EmojiNotifierProperties(
    @NotBlank String botToken,
    @NotNull Duration notifyWindow,
    @NotBlank String channelStorePath) {

  @AssertTrue(message = "emoji-notifier.notify-window must be positive")
  public boolean isNotifyWindowPositive() {
    return notifyWindow != null && !notifyWindow.isZero() && !notifyWindow.isNegative();
  }

  @Override
  public String toString() {
    // never print the bot token
    return "EmojiNotifierProperties[notifyWindow="
        + notifyWindow
        + ", channelStorePath="
        + channelStorePath
        + "]";
  }
}
