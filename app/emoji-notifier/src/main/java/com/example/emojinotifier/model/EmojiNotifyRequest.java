/*
 * Where: emoji-notifier domain model
 * What: One pending "new emoji" notification for a guild
 * Why: Unit of hand-off between the ingestor and the aggregation worker
 */
package com.example.emojinotifier.model;

public record EmojiNotifyRequest(String guildId, Emoji emoji) {}
