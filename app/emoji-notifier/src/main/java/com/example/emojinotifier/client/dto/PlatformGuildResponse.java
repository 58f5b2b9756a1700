package com.example.emojinotifier.client.dto;

public record PlatformGuildResponse(String id, String name) {}
