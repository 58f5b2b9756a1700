/*
 * Where: emoji-notifier service layer
 * What: Delivery transport abstraction for batch summaries
 * Why: Lets the platform sender be swapped for a local one or a test double
 */
package com.example.emojinotifier.service;

import com.example.emojinotifier.model.EmojiSummary;

public interface EmojiSummarySender {
    void send(String channelId, EmojiSummary summary);
}
