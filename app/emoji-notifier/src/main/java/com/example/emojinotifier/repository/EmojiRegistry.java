/*
 * Where: emoji-notifier in-memory state
 * What: Per-guild set of emojis that were already announced or pre-existed at sync
 * Why: Membership decides whether an emoji in a full-list update is new
 */
package com.example.emojinotifier.repository;

import com.example.emojinotifier.model.Emoji;
import com.example.emojinotifier.service.EmojiNotifierMetrics;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * Append-only within the process lifetime: entries are overwritten but never removed.
 *
 * <p>Writers are the startup sync and the aggregation worker after a successful delivery; the
 * ingestor only reads. Per-guild maps are concurrent so those reads never observe a torn map.
 */
@Repository
@RequiredArgsConstructor
public class EmojiRegistry {

  private static final Logger logger = LoggerFactory.getLogger(EmojiRegistry.class);

  private final ConcurrentHashMap<String, ConcurrentHashMap<String, Emoji>> emojisByGuild =
      new ConcurrentHashMap<>();
  private final EmojiNotifierMetrics metrics;

  public boolean contains(String guildId, String emojiId) {
    final Map<String, Emoji> emojis = emojisByGuild.get(guildId);
    return emojis != null && emojis.containsKey(emojiId);
  }

  public boolean knowsGuild(String guildId) {
    return emojisByGuild.containsKey(guildId);
  }

  public void record(String guildId, Emoji emoji) {
    final Emoji previous = guildEmojis(guildId).put(emoji.id(), emoji);
    if (previous == null) {
      logger.info(
          "emoji registered guildId={} emojiId={} name={} animated={}",
          guildId,
          emoji.id(),
          emoji.name(),
          emoji.animated());
      metrics.recordRegistryRecorded();
    }
  }

  public void recordAll(String guildId, Collection<Emoji> emojis) {
    // an empty catalogue still marks the guild as synchronized
    guildEmojis(guildId);
    for (Emoji emoji : emojis) {
      record(guildId, emoji);
    }
  }

  public int size(String guildId) {
    final Map<String, Emoji> emojis = emojisByGuild.get(guildId);
    return emojis == null ? 0 : emojis.size();
  }

  private ConcurrentHashMap<String, Emoji> guildEmojis(String guildId) {
    return emojisByGuild.computeIfAbsent(guildId, ignored -> new ConcurrentHashMap<>());
  }
}
