/*
 * Where: emoji-notifier service layer
 * What: Resolves guild and channel, builds the summary and hands it to the sender
 * Why: Gives the worker a single call whose failure reason decides logging and metrics
 */
package com.example.emojinotifier.service;

import com.example.emojinotifier.model.Emoji;
import com.example.emojinotifier.model.EmojiSummary;
import com.example.emojinotifier.model.GuildInfo;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class EmojiSummaryDeliveryService {

  private final GuildSession guildSession;
  private final NotificationChannelDirectory channelDirectory;
  private final EmojiSummaryFactory summaryFactory;
  private final EmojiSummarySender sender;

  /**
   * @throws EmojiDeliveryException when the guild is unknown, has no registered channel, or
   *     the transport call fails
   */
  public EmojiSummary deliver(String guildId, List<Emoji> emojis) {
    final GuildInfo guild =
        guildSession
            .resolve(guildId)
            .orElseThrow(
                () ->
                    new EmojiDeliveryException(
                        EmojiDeliveryException.Reason.GUILD_UNKNOWN,
                        "the guild (id:" + guildId + ") is not included in bot session"));
    final String channelId =
        channelDirectory
            .lookup(guildId)
            .orElseThrow(
                () ->
                    new EmojiDeliveryException(
                        EmojiDeliveryException.Reason.DESTINATION_NOT_REGISTERED,
                        "the guild (id:" + guildId + ") has no registered notify channel"));
    final EmojiSummary summary = summaryFactory.create(guild.name(), emojis);
    try {
      sender.send(channelId, summary);
    } catch (RuntimeException ex) {
      throw new EmojiDeliveryException(
          EmojiDeliveryException.Reason.TRANSPORT_FAILURE,
          "failed to send summary to channel " + channelId + ": " + ex.getMessage(),
          ex);
    }
    return summary;
  }
}
