/*
 * Where: emoji-notifier service layer
 * What: Guild to notification channel mapping driven by register/unregister commands
 * Why: The aggregation worker looks up where each guild's summary goes at flush time
 */
package com.example.emojinotifier.service;

import com.example.emojinotifier.client.PlatformApiClient;
import com.example.emojinotifier.client.PlatformIntegrationException;
import com.example.emojinotifier.client.dto.PlatformChannelResponse;
import com.example.emojinotifier.repository.ChannelDirectoryStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class NotificationChannelDirectory {

  private static final Logger logger = LoggerFactory.getLogger(NotificationChannelDirectory.class);

  private final PlatformApiClient platformApiClient;
  private final ChannelDirectoryStore store;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<String, String> channelByGuild = new HashMap<>();

  public NotificationChannelDirectory(PlatformApiClient platformApiClient, ChannelDirectoryStore store) {
    this.platformApiClient = platformApiClient;
    this.store = store;
  }

  @PostConstruct
  public void restore() {
    restore(store.load());
  }

  @PreDestroy
  public void persist() {
    final Map<String, String> snapshot = snapshot();
    if (!store.save(snapshot)) {
      logger.warn("channel directory not persisted entries={}", snapshot.size());
    }
  }

  /**
   * Commits the mapping only after the channel resolves through the platform API. The remote
   * check runs outside the lock so a slow platform never blocks flush-time lookups.
   */
  public void register(String guildId, String channelId) {
    requireId(guildId, "guildId");
    requireId(channelId, "channelId");
    ensureResolvable(guildId, channelId);
    final String previous;
    lock.writeLock().lock();
    try {
      previous = channelByGuild.put(guildId, channelId);
    } finally {
      lock.writeLock().unlock();
    }
    logger.info("registered: guild {} -> channel {} previous={}", guildId, channelId, previous);
  }

  /** Removes the mapping only when the caller names the currently registered channel. */
  public void unregister(String guildId, String channelId) {
    requireId(guildId, "guildId");
    lock.writeLock().lock();
    try {
      final String registered = channelByGuild.get(guildId);
      if (registered == null) {
        throw new ChannelDirectoryException(
            ChannelDirectoryException.Reason.NOT_REGISTERED, "no channel registered");
      }
      if (!registered.equals(channelId)) {
        throw new ChannelDirectoryException(
            ChannelDirectoryException.Reason.DESTINATION_MISMATCH,
            "this channel is not registered as the notification channel");
      }
      channelByGuild.remove(guildId);
    } finally {
      lock.writeLock().unlock();
    }
    logger.info("unregistered: guild {}: remove channel {}", guildId, channelId);
  }

  public Optional<String> lookup(String guildId) {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(channelByGuild.get(guildId));
    } finally {
      lock.readLock().unlock();
    }
  }

  public Map<String, String> snapshot() {
    lock.readLock().lock();
    try {
      return Map.copyOf(channelByGuild);
    } finally {
      lock.readLock().unlock();
    }
  }

  void restore(Map<String, String> mapping) {
    lock.writeLock().lock();
    try {
      channelByGuild.clear();
      channelByGuild.putAll(mapping);
    } finally {
      lock.writeLock().unlock();
    }
    logger.info("channel directory restored entries={}", mapping.size());
  }

  private void ensureResolvable(String guildId, String channelId) {
    final PlatformChannelResponse channel;
    try {
      channel = platformApiClient.getChannel(channelId);
    } catch (PlatformIntegrationException ex) {
      logger.warn(
          "channel resolve failed guildId={} channelId={} reason={}",
          guildId,
          channelId,
          ex.reason(),
          ex);
      throw new ChannelDirectoryException(
          ChannelDirectoryException.Reason.DESTINATION_UNREACHABLE,
          "could not find out the channel you've requested (might be wrong permissions?)",
          ex);
    }
    if (channel.guildId() != null && !channel.guildId().equals(guildId)) {
      throw new ChannelDirectoryException(
          ChannelDirectoryException.Reason.DESTINATION_UNREACHABLE,
          "the channel you've requested belongs to another server");
    }
  }

  private void requireId(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " is required");
    }
  }
}
