/*
 * Where: emoji-notifier service layer
 * What: Executes the register/unregister commands and phrases the acknowledgment
 * Why: The command transport expects a short text reply, never an error status
 */
package com.example.emojinotifier.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationChannelCommandService {

  public static final String REGISTER = "register";
  public static final String UNREGISTER = "unregister";

  static final String REGISTERED_MESSAGE = "okay, I will notify here for new emojis!";
  static final String UNREGISTERED_MESSAGE = "unregistered!";
  static final String INVALID_COMMAND_MESSAGE = "invalid command :(";
  private static final String FAILURE_PREFIX = "hmm, something went wrong: ";

  private static final Logger logger =
      LoggerFactory.getLogger(NotificationChannelCommandService.class);

  private final NotificationChannelDirectory channelDirectory;

  public String execute(String commandName, String guildId, String channelId) {
    if (isBlank(guildId) || isBlank(channelId)) {
      return FAILURE_PREFIX + "this command must be used in a server channel";
    }
    if (commandName == null) {
      return INVALID_COMMAND_MESSAGE;
    }
    try {
      switch (commandName) {
        case REGISTER -> {
          channelDirectory.register(guildId, channelId);
          return REGISTERED_MESSAGE;
        }
        case UNREGISTER -> {
          channelDirectory.unregister(guildId, channelId);
          return UNREGISTERED_MESSAGE;
        }
        default -> {
          logger.info("unknown command name={} guildId={}", commandName, guildId);
          return INVALID_COMMAND_MESSAGE;
        }
      }
    } catch (ChannelDirectoryException ex) {
      logger.info(
          "command rejected name={} guildId={} channelId={} reason={}",
          commandName,
          guildId,
          channelId,
          ex.reason());
      return FAILURE_PREFIX + ex.getMessage();
    }
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
