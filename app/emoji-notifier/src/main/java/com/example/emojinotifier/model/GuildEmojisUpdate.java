/*
 * Where: emoji-notifier domain model
 * What: Full current emoji list of one guild, pushed whenever any entry changes
 * Why: Payload of the subscription transport
 */
package com.example.emojinotifier.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GuildEmojisUpdate(String guildId, List<Emoji> emojis) {

  public GuildEmojisUpdate {
    // null stays null so the ingestor can reject it; entries may be null and are validated there
    if (emojis != null) {
      emojis = Collections.unmodifiableList(new ArrayList<>(emojis));
    }
  }
}
