package com.example.emojinotifier.model;

public record GuildInfo(String id, String name) {}
