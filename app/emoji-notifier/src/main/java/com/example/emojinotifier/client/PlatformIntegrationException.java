package com.example.emojinotifier.client;

public class PlatformIntegrationException extends RuntimeException {

  public enum Reason {
    UNAUTHORIZED,
    FORBIDDEN,
    NOT_FOUND,
    BAD_GATEWAY,
    TIMEOUT,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public PlatformIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public PlatformIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
