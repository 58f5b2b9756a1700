/*
 * Where: emoji-notifier command API
 * What: Answers pings and runs register/unregister from a guild channel
 * Why: Members configure the notification channel from inside the guild
 */
package com.example.emojinotifier.api;

import com.example.emojinotifier.service.NotificationChannelCommandService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class InteractionController {

  private final NotificationChannelCommandService commandService;

  @PostMapping("/interactions")
  public InteractionResponse interact(@Valid @RequestBody InteractionRequest request) {
    if (request.type() == InteractionRequest.TYPE_PING) {
      return InteractionResponse.pong();
    }
    if (request.type() != InteractionRequest.TYPE_APPLICATION_COMMAND) {
      throw new UnsupportedInteractionException("unsupported interaction type: " + request.type());
    }
    final String content =
        commandService.execute(request.commandName(), request.guildId(), request.channelId());
    return InteractionResponse.message(content);
  }
}
