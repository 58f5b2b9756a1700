/*
 * Where: emoji-notifier service layer
 * What: Marks a guild update event that can never be processed
 * Why: The subscriber terminates such messages instead of asking for redelivery
 */
package com.example.emojinotifier.service;

public class EmojiEventPermanentException extends RuntimeException {

    public EmojiEventPermanentException(String message) {
        super(message);
    }

    public EmojiEventPermanentException(String message, Throwable cause) {
        super(message, cause);
    }
}
