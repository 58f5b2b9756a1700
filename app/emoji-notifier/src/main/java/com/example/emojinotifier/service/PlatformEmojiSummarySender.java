package com.example.emojinotifier.service;

import com.example.emojinotifier.client.PlatformApiClient;
import com.example.emojinotifier.client.dto.PlatformEmbed;
import com.example.emojinotifier.model.EmojiSummary;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "emoji-notifier.delivery.mode",
    havingValue = "platform",
    matchIfMissing = true)
public class PlatformEmojiSummarySender implements EmojiSummarySender {

  private static final Logger logger = LoggerFactory.getLogger(PlatformEmojiSummarySender.class);

  private final PlatformApiClient platformApiClient;

  @Override
  public void send(String channelId, EmojiSummary summary) {
    final PlatformEmbed embed =
        new PlatformEmbed(
            summary.title(),
            summary.description(),
            summary.color(),
            new PlatformEmbed.Footer(summary.footer()),
            summary.timestamp().toString());
    final String messageId = platformApiClient.sendEmbed(channelId, embed);
    logger.info(
        "summary sent channelId={} messageId={} count={}",
        channelId,
        messageId,
        summary.emojiCount());
  }
}
