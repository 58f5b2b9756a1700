package com.example.emojinotifier.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GuildDebugResponse(
    String guildId, int knownEmojis, int pendingRequests, String notifyChannelId) {}
