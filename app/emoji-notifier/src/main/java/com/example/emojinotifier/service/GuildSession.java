/*
 * Where: emoji-notifier service layer
 * What: Guilds visible to the bot and the startup emoji backfill
 * Why: Pre-existing emojis must be known before any update event is classified
 */
package com.example.emojinotifier.service;

import com.example.emojinotifier.client.PlatformApiClient;
import com.example.emojinotifier.client.PlatformIntegrationException;
import com.example.emojinotifier.model.Emoji;
import com.example.emojinotifier.model.GuildInfo;
import com.example.emojinotifier.repository.EmojiRegistry;
import jakarta.annotation.PostConstruct;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class GuildSession {

  private static final Logger logger = LoggerFactory.getLogger(GuildSession.class);

  private final PlatformApiClient platformApiClient;
  private final EmojiRegistry emojiRegistry;
  private final ConcurrentHashMap<String, GuildInfo> guilds = new ConcurrentHashMap<>();
  private final Set<String> listedAtStartup = ConcurrentHashMap.newKeySet();

  /** Completes before the update subscriber is created. */
  @PostConstruct
  public void synchronize() {
    final List<GuildInfo> visible;
    try {
      visible = platformApiClient.listGuilds();
    } catch (PlatformIntegrationException ex) {
      logger.error("guild sync failed reason={}; starting without a baseline", ex.reason(), ex);
      return;
    }
    logger.info("available guilds: {}", visible.size());
    int synced = 0;
    for (GuildInfo guild : visible) {
      guilds.put(guild.id(), guild);
      listedAtStartup.add(guild.id());
      try {
        final List<Emoji> emojis = platformApiClient.listGuildEmojis(guild.id());
        emojiRegistry.recordAll(guild.id(), emojis);
        synced++;
      } catch (PlatformIntegrationException ex) {
        // the registry stays empty for this guild, so every emoji it reports counts as new
        logger.warn(
            "guild emoji backfill failed guildId={} reason={}", guild.id(), ex.reason(), ex);
      }
    }
    logger.info("guild emoji backfill completed guilds={} synced={}", visible.size(), synced);
  }

  /**
   * True for guilds the startup sync listed, whether or not their emoji backfill succeeded. Only
   * guilds outside this set take their first update as a baseline.
   */
  public boolean listedAtStartup(String guildId) {
    return listedAtStartup.contains(guildId);
  }

  /** Cached guild metadata, fetched from the platform on first use for guilds joined later. */
  public Optional<GuildInfo> resolve(String guildId) {
    final GuildInfo cached = guilds.get(guildId);
    if (cached != null) {
      return Optional.of(cached);
    }
    try {
      final GuildInfo fetched = platformApiClient.getGuild(guildId);
      guilds.put(guildId, fetched);
      return Optional.of(fetched);
    } catch (PlatformIntegrationException ex) {
      logger.warn("guild resolve failed guildId={} reason={}", guildId, ex.reason());
      return Optional.empty();
    }
  }
}
