/*
 * Where: emoji-notifier persistence
 * What: Reads and writes the guild to channel mapping as a flat JSON object
 * Why: Registrations survive restarts; a missing or broken file must not stop startup
 */
package com.example.emojinotifier.repository;

import com.example.emojinotifier.config.EmojiNotifierProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

@Repository
public class ChannelDirectoryStore {

  private static final Logger logger = LoggerFactory.getLogger(ChannelDirectoryStore.class);
  private static final TypeReference<Map<String, String>> MAPPING_TYPE = new TypeReference<>() {};

  private final ObjectMapper objectMapper;
  private final Path path;

  @Autowired
  public ChannelDirectoryStore(ObjectMapper objectMapper, EmojiNotifierProperties properties) {
    this(objectMapper, Path.of(properties.channelStorePath()));
  }

  ChannelDirectoryStore(ObjectMapper objectMapper, Path path) {
    this.objectMapper = objectMapper;
    this.path = path;
  }

  /** Empty map when the file is absent, unreadable or malformed. */
  public Map<String, String> load() {
    if (!Files.exists(path)) {
      logger.warn("channel store not found, starting with empty directory path={}", path);
      return Map.of();
    }
    try {
      final Map<String, String> mapping = objectMapper.readValue(path.toFile(), MAPPING_TYPE);
      if (mapping == null) {
        logger.warn("channel store is empty, starting with empty directory path={}", path);
        return Map.of();
      }
      final Map<String, String> valid = new TreeMap<>();
      mapping.forEach(
          (guildId, channelId) -> {
            if (isBlank(guildId) || isBlank(channelId)) {
              logger.warn("channel store entry skipped guildId={} channelId={}", guildId, channelId);
              return;
            }
            valid.put(guildId, channelId);
          });
      logger.info("channel store loaded entries={} path={}", valid.size(), path);
      return valid;
    } catch (IOException ex) {
      logger.warn("channel store unreadable, starting with empty directory path={}", path, ex);
      return Map.of();
    }
  }

  /** Returns false when the mapping could not be written; the failure is logged. */
  public boolean save(Map<String, String> mapping) {
    try {
      final Path absolute = path.toAbsolutePath();
      if (absolute.getParent() != null) {
        Files.createDirectories(absolute.getParent());
      }
      final Path temp = absolute.resolveSibling(absolute.getFileName() + ".tmp");
      objectMapper.writeValue(temp.toFile(), new TreeMap<>(mapping));
      moveIntoPlace(temp, absolute);
      logger.info("channel store saved entries={} path={}", mapping.size(), path);
      return true;
    } catch (IOException ex) {
      logger.warn("channel store write failed entries={} path={}", mapping.size(), path, ex);
      return false;
    }
  }

  private void moveIntoPlace(Path temp, Path target) throws IOException {
    try {
      Files.move(
          temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException ex) {
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
