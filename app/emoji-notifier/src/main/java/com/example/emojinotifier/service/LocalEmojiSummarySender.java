/*
 * Where: emoji-notifier service layer
 * What: Sender that only logs the summary
 * Why: Local runs exercise the aggregation path without a platform account
 */
package com.example.emojinotifier.service;

import com.example.emojinotifier.model.EmojiSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "emoji-notifier.delivery.mode", havingValue = "local")
public class LocalEmojiSummarySender implements EmojiSummarySender {

    private static final Logger logger = LoggerFactory.getLogger(LocalEmojiSummarySender.class);

    @Override
    public void send(String channelId, EmojiSummary summary) {
        logger.info("summary simulated send channelId={} footer={} count={}\n{}",
                channelId,
                summary.footer(),
                summary.emojiCount(),
                summary.description());
    }
}
