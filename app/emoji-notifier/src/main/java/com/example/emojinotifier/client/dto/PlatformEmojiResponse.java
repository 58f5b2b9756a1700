package com.example.emojinotifier.client.dto;

public record PlatformEmojiResponse(String id, String name, Boolean animated) {}
