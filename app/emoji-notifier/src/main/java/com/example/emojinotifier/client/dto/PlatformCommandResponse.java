package com.example.emojinotifier.client.dto;

public record PlatformCommandResponse(String id, String name) {}
