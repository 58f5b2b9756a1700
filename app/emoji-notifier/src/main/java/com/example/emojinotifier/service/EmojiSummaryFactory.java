package com.example.emojinotifier.service;

import com.example.emojinotifier.model.Emoji;
import com.example.emojinotifier.model.EmojiSummary;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EmojiSummaryFactory {

  static final String TITLE = "New Emoji";
  static final int COLOR = 0x5ae9ff;

  private final Clock clock;

  public EmojiSummary create(String guildName, List<Emoji> emojis) {
    final List<String> lines =
        emojis.stream().map(emoji -> emoji.messageFormat() + " (`:" + emoji.name() + ":`)").toList();
    return new EmojiSummary(TITLE, COLOR, lines.size(), lines, guildName, Instant.now(clock));
  }
}
