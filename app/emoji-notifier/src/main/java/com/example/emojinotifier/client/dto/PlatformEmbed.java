/*
 * Where: platform API DTO
 * What: Rich embed body of a channel message
 * Why: The batch summary is rendered as a single embed
 */
package com.example.emojinotifier.client.dto;

public record PlatformEmbed(
    String title, String description, Integer color, Footer footer, String timestamp) {

  public record Footer(String text) {}
}
