/*
 * Where: emoji-notifier domain model
 * What: A custom emoji as observed in a guild
 * Why: Shared by ingestion, aggregation and the rendered summary
 */
package com.example.emojinotifier.model;

public record Emoji(String id, String name, boolean animated) {

  /** Inline chat markup, e.g. {@code <:party:123>} or {@code <a:party:123>} when animated. */
  public String messageFormat() {
    return (animated ? "<a:" : "<:") + name + ":" + id + ">";
  }
}
