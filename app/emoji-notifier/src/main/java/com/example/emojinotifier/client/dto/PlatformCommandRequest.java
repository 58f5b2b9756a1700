package com.example.emojinotifier.client.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** Global chat-input command. A "0" permission set limits use to administrators. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PlatformCommandRequest(String name, String description, String defaultMemberPermissions) {}
