/*
 * Where: emoji-notifier service layer
 * What: Diffs a guild's full emoji list against the registry and forwards new ones
 * Why: The transport reports the whole catalogue, never which entry changed
 */
package com.example.emojinotifier.service;

import com.example.emojinotifier.model.Emoji;
import com.example.emojinotifier.model.EmojiNotifyRequest;
import com.example.emojinotifier.model.GuildEmojisUpdate;
import com.example.emojinotifier.repository.EmojiRegistry;
import com.example.emojinotifier.worker.EmojiAggregationWorker;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class EmojiUpdateIngestor {

  private static final Logger logger = LoggerFactory.getLogger(EmojiUpdateIngestor.class);

  private final EmojiRegistry emojiRegistry;
  private final EmojiAggregationWorker worker;
  private final GuildSession guildSession;

  /** Returns the number of emojis forwarded to the aggregation worker. */
  public int handleGuildEmojisUpdate(GuildEmojisUpdate update) {
    final String guildId = requireGuildId(update);
    final List<Emoji> emojis = requireEmojis(update);
    if (!emojiRegistry.knowsGuild(guildId) && !guildSession.listedAtStartup(guildId)) {
      // guild joined after startup: its current catalogue is the baseline, not news
      emojiRegistry.recordAll(guildId, emojis);
      logger.info("guild baseline recorded guildId={} emojis={}", guildId, emojis.size());
      return 0;
    }
    int forwarded = 0;
    for (Emoji emoji : emojis) {
      if (emojiRegistry.contains(guildId, emoji.id())) {
        continue;
      }
      logger.info("new emoji observed guildId={} emojiId={} name={}", guildId, emoji.id(), emoji.name());
      worker.submit(new EmojiNotifyRequest(guildId, emoji));
      forwarded++;
    }
    return forwarded;
  }

  private String requireGuildId(GuildEmojisUpdate update) {
    if (update == null || update.guildId() == null || update.guildId().isBlank()) {
      throw new EmojiEventPermanentException("guild emojis update without guild_id");
    }
    return update.guildId();
  }

  private List<Emoji> requireEmojis(GuildEmojisUpdate update) {
    if (update.emojis() == null) {
      throw new EmojiEventPermanentException(
          "guild emojis update without emoji list guildId=" + update.guildId());
    }
    for (Emoji emoji : update.emojis()) {
      if (emoji == null || isBlank(emoji.id()) || isBlank(emoji.name())) {
        throw new EmojiEventPermanentException(
            "guild emojis update has a malformed emoji guildId=" + update.guildId());
      }
    }
    return update.emojis();
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
