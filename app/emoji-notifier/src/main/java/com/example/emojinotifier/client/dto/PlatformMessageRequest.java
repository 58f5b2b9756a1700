package com.example.emojinotifier.client.dto;

import java.util.List;

public record PlatformMessageRequest(List<PlatformEmbed> embeds) {

  public PlatformMessageRequest {
    embeds = embeds == null ? List.of() : List.copyOf(embeds);
  }
}
