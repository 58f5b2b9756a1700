package com.example.emojinotifier.api;

public class UnsupportedInteractionException extends RuntimeException {

  public UnsupportedInteractionException(String message) {
    super(message);
  }
}
