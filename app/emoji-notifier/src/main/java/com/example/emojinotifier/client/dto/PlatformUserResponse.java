package com.example.emojinotifier.client.dto;

public record PlatformUserResponse(String id, String username) {}
