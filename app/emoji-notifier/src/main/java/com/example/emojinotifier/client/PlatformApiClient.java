/*
 * Where: emoji-notifier outbound integration
 * What: REST calls to the chat platform (guilds, emojis, channels, messages, commands)
 * Why: Sync, destination validation, delivery and command setup share one error mapping
 */
package com.example.emojinotifier.client;

import com.example.emojinotifier.client.dto.PlatformChannelResponse;
import com.example.emojinotifier.client.dto.PlatformCommandRequest;
import com.example.emojinotifier.client.dto.PlatformCommandResponse;
import com.example.emojinotifier.client.dto.PlatformEmbed;
import com.example.emojinotifier.client.dto.PlatformEmojiResponse;
import com.example.emojinotifier.client.dto.PlatformGuildResponse;
import com.example.emojinotifier.client.dto.PlatformMessageRequest;
import com.example.emojinotifier.client.dto.PlatformMessageResponse;
import com.example.emojinotifier.client.dto.PlatformUserResponse;
import com.example.emojinotifier.config.PlatformApiProperties;
import com.example.emojinotifier.model.Emoji;
import com.example.emojinotifier.model.GuildInfo;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
@RequiredArgsConstructor
public class PlatformApiClient {

  private static final ParameterizedTypeReference<List<PlatformGuildResponse>> GUILD_LIST =
      new ParameterizedTypeReference<>() {};
  private static final ParameterizedTypeReference<List<PlatformEmojiResponse>> EMOJI_LIST =
      new ParameterizedTypeReference<>() {};

  private final RestClient platformRestClient;
  private final PlatformApiProperties properties;

  /** Pages through the guild list with {@code after} until a short page comes back. */
  public List<GuildInfo> listGuilds() {
    final List<GuildInfo> guilds = new ArrayList<>();
    String after = null;
    while (true) {
      final List<PlatformGuildResponse> page = fetchGuildPage(after);
      for (PlatformGuildResponse entry : page) {
        guilds.add(toGuildInfo(entry));
      }
      if (page.size() < properties.guildPageSize()) {
        return List.copyOf(guilds);
      }
      after = guilds.get(guilds.size() - 1).id();
    }
  }

  private List<PlatformGuildResponse> fetchGuildPage(String after) {
    final Map<String, Object> variables = new HashMap<>();
    variables.put("limit", properties.guildPageSize());
    final String template;
    if (after == null) {
      template = properties.currentUserGuildsPath() + "?limit={limit}";
    } else {
      template = properties.currentUserGuildsPath() + "?limit={limit}&after={after}";
      variables.put("after", after);
    }
    final List<PlatformGuildResponse> response =
        call(
            "list guilds",
            () ->
                platformRestClient
                    .get()
                    .uri(template, variables)
                    .retrieve()
                    .body(GUILD_LIST));
    requireBody(response, "guild list response is empty");
    return response;
  }

  public GuildInfo getGuild(String guildId) {
    requireId(guildId, "guildId");
    final PlatformGuildResponse response =
        call(
            "get guild",
            () ->
                platformRestClient
                    .get()
                    .uri(properties.guildPath(), guildId)
                    .retrieve()
                    .body(PlatformGuildResponse.class));
    requireBody(response, "guild response is empty");
    return toGuildInfo(response);
  }

  public List<Emoji> listGuildEmojis(String guildId) {
    requireId(guildId, "guildId");
    final List<PlatformEmojiResponse> response =
        call(
            "list guild emojis",
            () ->
                platformRestClient
                    .get()
                    .uri(properties.guildEmojisPath(), guildId)
                    .retrieve()
                    .body(EMOJI_LIST));
    requireBody(response, "emoji list response is empty");
    return response.stream().map(this::toEmoji).toList();
  }

  public PlatformChannelResponse getChannel(String channelId) {
    requireId(channelId, "channelId");
    final PlatformChannelResponse response =
        call(
            "get channel",
            () ->
                platformRestClient
                    .get()
                    .uri(properties.channelPath(), channelId)
                    .retrieve()
                    .body(PlatformChannelResponse.class));
    if (response == null || isBlank(response.id())) {
      throw new PlatformIntegrationException(
          PlatformIntegrationException.Reason.INVALID_RESPONSE, "channel response is invalid");
    }
    return response;
  }

  public String sendEmbed(String channelId, PlatformEmbed embed) {
    requireId(channelId, "channelId");
    final PlatformMessageResponse response =
        call(
            "send message",
            () ->
                platformRestClient
                    .post()
                    .uri(properties.channelMessagesPath(), channelId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new PlatformMessageRequest(List.of(embed)))
                    .retrieve()
                    .body(PlatformMessageResponse.class));
    return response == null ? null : response.id();
  }

  public String getCurrentUserId() {
    final PlatformUserResponse response =
        call(
            "get current user",
            () ->
                platformRestClient
                    .get()
                    .uri(properties.currentUserPath())
                    .retrieve()
                    .body(PlatformUserResponse.class));
    if (response == null || isBlank(response.id())) {
      throw new PlatformIntegrationException(
          PlatformIntegrationException.Reason.INVALID_RESPONSE, "current user response is invalid");
    }
    return response.id();
  }

  public PlatformCommandResponse createGlobalCommand(
      String applicationId, PlatformCommandRequest request) {
    requireId(applicationId, "applicationId");
    final PlatformCommandResponse response =
        call(
            "create command",
            () ->
                platformRestClient
                    .post()
                    .uri(properties.applicationCommandsPath(), applicationId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(PlatformCommandResponse.class));
    if (response == null || isBlank(response.id())) {
      throw new PlatformIntegrationException(
          PlatformIntegrationException.Reason.INVALID_RESPONSE, "command response is invalid");
    }
    return response;
  }

  public void deleteGlobalCommand(String applicationId, String commandId) {
    requireId(applicationId, "applicationId");
    requireId(commandId, "commandId");
    call(
        "delete command",
        () ->
            platformRestClient
                .delete()
                .uri(properties.applicationCommandPath(), applicationId, commandId)
                .retrieve()
                .toBodilessEntity());
  }

  private <T> T call(String operation, Supplier<T> request) {
    try {
      return request.get();
    } catch (RestClientResponseException ex) {
      throw mapResponseException(operation, ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(operation, ex);
    } catch (PlatformIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      throw new PlatformIntegrationException(
          PlatformIntegrationException.Reason.INVALID_RESPONSE,
          "platform " + operation + " response parse failed",
          ex);
    }
  }

  private GuildInfo toGuildInfo(PlatformGuildResponse response) {
    if (response == null || isBlank(response.id())) {
      throw new PlatformIntegrationException(
          PlatformIntegrationException.Reason.INVALID_RESPONSE, "guild entry is invalid");
    }
    return new GuildInfo(response.id(), response.name());
  }

  private Emoji toEmoji(PlatformEmojiResponse response) {
    if (response == null || isBlank(response.id()) || isBlank(response.name())) {
      throw new PlatformIntegrationException(
          PlatformIntegrationException.Reason.INVALID_RESPONSE, "emoji entry is invalid");
    }
    return new Emoji(response.id(), response.name(), Boolean.TRUE.equals(response.animated()));
  }

  private void requireBody(Object response, String message) {
    if (response == null) {
      throw new PlatformIntegrationException(
          PlatformIntegrationException.Reason.INVALID_RESPONSE, message);
    }
  }

  private void requireId(String value, String name) {
    if (isBlank(value)) {
      throw new IllegalArgumentException(name + " is required");
    }
  }

  private PlatformIntegrationException mapResponseException(
      String operation, RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    if (status == 401) {
      return new PlatformIntegrationException(
          PlatformIntegrationException.Reason.UNAUTHORIZED,
          "platform rejected bot credential on " + operation,
          ex);
    }
    if (status == 403) {
      return new PlatformIntegrationException(
          PlatformIntegrationException.Reason.FORBIDDEN,
          "platform denied access on " + operation,
          ex);
    }
    if (status == 404) {
      return new PlatformIntegrationException(
          PlatformIntegrationException.Reason.NOT_FOUND,
          "platform resource not found on " + operation,
          ex);
    }
    if (ex.getStatusCode().is5xxServerError()) {
      return new PlatformIntegrationException(
          PlatformIntegrationException.Reason.BAD_GATEWAY,
          "platform server error on " + operation,
          ex);
    }
    return new PlatformIntegrationException(
        PlatformIntegrationException.Reason.BAD_GATEWAY,
        "platform request failed on " + operation + " status=" + status,
        ex);
  }

  private PlatformIntegrationException mapResourceException(
      String operation, ResourceAccessException ex) {
    if (isTimeout(ex)) {
      return new PlatformIntegrationException(
          PlatformIntegrationException.Reason.TIMEOUT, "platform timeout on " + operation, ex);
    }
    return new PlatformIntegrationException(
        PlatformIntegrationException.Reason.BAD_GATEWAY,
        "platform connection failed on " + operation,
        ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
