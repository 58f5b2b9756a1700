package com.example.emojinotifier.api;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record InteractionResponse(int type, ResponseData data) {

  public static final int TYPE_PONG = 1;
  public static final int TYPE_CHANNEL_MESSAGE = 4;

  public static InteractionResponse pong() {
    return new InteractionResponse(TYPE_PONG, null);
  }

  public static InteractionResponse message(String content) {
    return new InteractionResponse(TYPE_CHANNEL_MESSAGE, new ResponseData(content));
  }

  public record ResponseData(String content) {}
}
