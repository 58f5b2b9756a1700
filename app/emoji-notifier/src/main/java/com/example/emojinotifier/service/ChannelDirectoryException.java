/*
 * Where: emoji-notifier service layer
 * What: Register/unregister failure with a caller-facing reason
 * Why: The command endpoint turns these into a textual acknowledgment, never a fault
 */
package com.example.emojinotifier.service;

public class ChannelDirectoryException extends RuntimeException {

  public enum Reason {
    DESTINATION_UNREACHABLE,
    NOT_REGISTERED,
    DESTINATION_MISMATCH
  }

  private final Reason reason;

  public ChannelDirectoryException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public ChannelDirectoryException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
