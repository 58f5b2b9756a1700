package com.example.emojinotifier.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "platform")
public record PlatformApiProperties(
    String baseUrl,
    Duration connectTimeout,
    Duration readTimeout,
    String currentUserPath,
    String currentUserGuildsPath,
    String guildPath,
    String guildEmojisPath,
    String channelPath,
    String channelMessagesPath,
    String applicationCommandsPath,
    String applicationCommandPath,
    Integer guildPageSize) {

  public PlatformApiProperties {
    baseUrl = isBlank(baseUrl) ? "https://discord.com/api/v10" : baseUrl;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
    currentUserPath = isBlank(currentUserPath) ? "/users/@me" : currentUserPath;
    currentUserGuildsPath =
        isBlank(currentUserGuildsPath) ? "/users/@me/guilds" : currentUserGuildsPath;
    guildPath = isBlank(guildPath) ? "/guilds/{guildId}" : guildPath;
    guildEmojisPath = isBlank(guildEmojisPath) ? "/guilds/{guildId}/emojis" : guildEmojisPath;
    channelPath = isBlank(channelPath) ? "/channels/{channelId}" : channelPath;
    channelMessagesPath =
        isBlank(channelMessagesPath) ? "/channels/{channelId}/messages" : channelMessagesPath;
    applicationCommandsPath =
        isBlank(applicationCommandsPath)
            ? "/applications/{applicationId}/commands"
            : applicationCommandsPath;
    applicationCommandPath =
        isBlank(applicationCommandPath)
            ? "/applications/{applicationId}/commands/{commandId}"
            : applicationCommandPath;
    // the platform caps a guild page at 200 entries
    guildPageSize = guildPageSize == null || guildPageSize <= 0 ? 200 : guildPageSize;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
