/*
 * Where: emoji-notifier in-memory state
 * What: Per-guild ordered sequence of notify requests awaiting the next tick
 * Why: Batches rapid additions into one summary per guild and window
 */
package com.example.emojinotifier.repository;

import com.example.emojinotifier.model.EmojiNotifyRequest;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Every read and write takes the queue's single lock, so a drain never observes a partially
 * appended sequence and an enqueued request is either drained or still pending, never both.
 */
public class PendingEmojiQueue {

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, List<EmojiNotifyRequest>> queueByGuild = new HashMap<>();

  public void enqueue(EmojiNotifyRequest request) {
    lock.lock();
    try {
      queueByGuild.computeIfAbsent(request.guildId(), ignored -> new ArrayList<>()).add(request);
    } finally {
      lock.unlock();
    }
  }

  /** Returns the guild's pending sequence in insertion order and resets it; empty if unknown. */
  public List<EmojiNotifyRequest> drainAndClear(String guildId) {
    lock.lock();
    try {
      final List<EmojiNotifyRequest> drained = queueByGuild.remove(guildId);
      return drained == null ? List.of() : List.copyOf(drained);
    } finally {
      lock.unlock();
    }
  }

  /** Drains every non-empty guild under one lock acquisition. */
  public Map<String, List<EmojiNotifyRequest>> drainAll() {
    lock.lock();
    try {
      final Map<String, List<EmojiNotifyRequest>> drained = new LinkedHashMap<>();
      queueByGuild.forEach(
          (guildId, requests) -> {
            if (!requests.isEmpty()) {
              drained.put(guildId, List.copyOf(requests));
            }
          });
      // emptied guilds are dropped instead of kept as empty lists
      queueByGuild.clear();
      return drained;
    } finally {
      lock.unlock();
    }
  }

  public Set<String> guilds() {
    lock.lock();
    try {
      return queueByGuild.entrySet().stream()
          .filter(entry -> !entry.getValue().isEmpty())
          .map(Map.Entry::getKey)
          .collect(Collectors.toUnmodifiableSet());
    } finally {
      lock.unlock();
    }
  }

  public int pendingCount() {
    lock.lock();
    try {
      return queueByGuild.values().stream().mapToInt(List::size).sum();
    } finally {
      lock.unlock();
    }
  }

  public int pendingCount(String guildId) {
    lock.lock();
    try {
      final List<EmojiNotifyRequest> requests = queueByGuild.get(guildId);
      return requests == null ? 0 : requests.size();
    } finally {
      lock.unlock();
    }
  }
}
