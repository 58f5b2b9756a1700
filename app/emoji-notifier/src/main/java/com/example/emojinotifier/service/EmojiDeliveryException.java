package com.example.emojinotifier.service;

public class EmojiDeliveryException extends RuntimeException {

  public enum Reason {
    GUILD_UNKNOWN,
    DESTINATION_NOT_REGISTERED,
    TRANSPORT_FAILURE
  }

  private final Reason reason;

  public EmojiDeliveryException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public EmojiDeliveryException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
