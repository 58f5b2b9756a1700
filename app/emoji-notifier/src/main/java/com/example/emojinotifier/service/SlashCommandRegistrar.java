/*
 * Where: emoji-notifier service layer
 * What: Creates the register/unregister commands at startup and removes them at shutdown
 * Why: Commands must exist on the platform for members to configure a notification channel
 */
package com.example.emojinotifier.service;

import com.example.emojinotifier.client.PlatformApiClient;
import com.example.emojinotifier.client.PlatformIntegrationException;
import com.example.emojinotifier.client.dto.PlatformCommandRequest;
import com.example.emojinotifier.client.dto.PlatformCommandResponse;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "emoji-notifier.commands.sync-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class SlashCommandRegistrar {

  private static final Logger logger = LoggerFactory.getLogger(SlashCommandRegistrar.class);
  // "0" limits the commands to administrators until a guild overrides it
  private static final String DEFAULT_MEMBER_PERMISSIONS = "0";

  static final List<PlatformCommandRequest> COMMANDS =
      List.of(
          new PlatformCommandRequest(
              NotificationChannelCommandService.REGISTER,
              "make this channel to a notification channel",
              DEFAULT_MEMBER_PERMISSIONS),
          new PlatformCommandRequest(
              NotificationChannelCommandService.UNREGISTER,
              "stop to notify here",
              DEFAULT_MEMBER_PERMISSIONS));

  private final PlatformApiClient platformApiClient;
  private final List<PlatformCommandResponse> registered = new ArrayList<>();
  private String applicationId;

  @PostConstruct
  public synchronized void registerCommands() {
    try {
      applicationId = platformApiClient.getCurrentUserId();
    } catch (PlatformIntegrationException ex) {
      logger.error("cannot resolve application id, commands not created reason={}", ex.reason(), ex);
      return;
    }
    for (PlatformCommandRequest command : COMMANDS) {
      try {
        registered.add(platformApiClient.createGlobalCommand(applicationId, command));
        logger.info("created a command '{}'", command.name());
      } catch (PlatformIntegrationException ex) {
        logger.error("cannot create command '{}' reason={}", command.name(), ex.reason(), ex);
      }
    }
  }

  @PreDestroy
  public synchronized void unregisterCommands() {
    for (PlatformCommandResponse command : registered) {
      try {
        platformApiClient.deleteGlobalCommand(applicationId, command.id());
        logger.info("deleted a command: {}", command.name());
      } catch (PlatformIntegrationException ex) {
        logger.error("cannot delete command {} reason={}", command.name(), ex.reason(), ex);
      }
    }
    registered.clear();
  }

  synchronized List<PlatformCommandResponse> registeredCommands() {
    return List.copyOf(registered);
  }
}
