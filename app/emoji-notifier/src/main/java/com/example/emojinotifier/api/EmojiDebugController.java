/*
 * Where: emoji-notifier debug API
 * What: Shows registry size, pending requests and channel for one guild
 * Why: Lets operators check why a guild did or did not get a summary
 */
package com.example.emojinotifier.api;

import com.example.emojinotifier.repository.EmojiRegistry;
import com.example.emojinotifier.service.NotificationChannelDirectory;
import com.example.emojinotifier.worker.EmojiAggregationWorker;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/debug/emoji-notifier")
@RequiredArgsConstructor
public class EmojiDebugController {

  private final EmojiRegistry emojiRegistry;
  private final EmojiAggregationWorker worker;
  private final NotificationChannelDirectory channelDirectory;

  @GetMapping("/guilds/{guildId}")
  public GuildDebugResponse guild(@PathVariable("guildId") String guildId) {
    return new GuildDebugResponse(
        guildId,
        emojiRegistry.size(guildId),
        worker.pendingCount(guildId),
        channelDirectory.lookup(guildId).orElse(null));
  }
}
