/*
 * Where: emoji-notifier API model
 * What: Inbound interaction issued from a guild channel
 * Why: Carries the command name together with the guild and channel it was used in
 */
package com.example.emojinotifier.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InteractionRequest(
    @NotNull Integer type, String guildId, String channelId, CommandData data) {

  public static final int TYPE_PING = 1;
  public static final int TYPE_APPLICATION_COMMAND = 2;

  public String commandName() {
    return data == null ? null : data.name();
  }

  public record CommandData(String name) {}
}
