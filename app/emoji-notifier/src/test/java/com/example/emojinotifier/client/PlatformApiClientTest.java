package com.example.emojinotifier.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.DELETE;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.emojinotifier.client.dto.PlatformChannelResponse;
import com.example.emojinotifier.client.dto.PlatformCommandRequest;
import com.example.emojinotifier.client.dto.PlatformCommandResponse;
import com.example.emojinotifier.client.dto.PlatformEmbed;
import com.example.emojinotifier.config.PlatformApiProperties;
import com.example.emojinotifier.model.Emoji;
import com.example.emojinotifier.model.GuildInfo;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class PlatformApiClientTest {

  private static final String BASE_URL = "http://platform.test";

  @Test
  void listGuildsReadsVisibleGuilds() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(BASE_URL + "/users/@me/guilds?limit=200"))
        .andExpect(method(GET))
        .andRespond(
            withSuccess(
                """
                [{"id":"g1","name":"One"},{"id":"g2","name":"Two"}]
                """,
                MediaType.APPLICATION_JSON));

    final List<GuildInfo> guilds = fixture.client.listGuilds();

    assertThat(guilds).containsExactly(new GuildInfo("g1", "One"), new GuildInfo("g2", "Two"));
    fixture.server.verify();
  }

  @Test
  void listGuildsFollowsPagesUntilShortPage() {
    final ClientFixture fixture = newFixture(2);
    fixture
        .server
        .expect(requestTo(BASE_URL + "/users/@me/guilds?limit=2"))
        .andRespond(
            withSuccess(
                """
                [{"id":"g1","name":"One"},{"id":"g2","name":"Two"}]
                """,
                MediaType.APPLICATION_JSON));
    fixture
        .server
        .expect(requestTo(BASE_URL + "/users/@me/guilds?limit=2&after=g2"))
        .andRespond(
            withSuccess(
                """
                [{"id":"g3","name":"Three"}]
                """,
                MediaType.APPLICATION_JSON));

    final List<GuildInfo> guilds = fixture.client.listGuilds();

    assertThat(guilds).extracting(GuildInfo::id).containsExactly("g1", "g2", "g3");
    fixture.server.verify();
  }

  @Test
  void listGuildEmojisTreatsMissingAnimatedAsStatic() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(BASE_URL + "/guilds/g1/emojis"))
        .andExpect(method(GET))
        .andRespond(
            withSuccess(
                """
                [{"id":"1","name":"foo"},{"id":"2","name":"party","animated":true}]
                """,
                MediaType.APPLICATION_JSON));

    final List<Emoji> emojis = fixture.client.listGuildEmojis("g1");

    assertThat(emojis)
        .containsExactly(new Emoji("1", "foo", false), new Emoji("2", "party", true));
  }

  @Test
  void getChannelReadsOwningGuild() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(BASE_URL + "/channels/c1"))
        .andRespond(
            withSuccess(
                """
                {"id":"c1","guild_id":"g1","name":"general","type":0}
                """,
                MediaType.APPLICATION_JSON));

    final PlatformChannelResponse channel = fixture.client.getChannel("c1");

    assertThat(channel.guildId()).isEqualTo("g1");
  }

  @Test
  void sendEmbedPostsSingleEmbedAndReturnsMessageId() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(BASE_URL + "/channels/c1/messages"))
        .andExpect(method(POST))
        .andExpect(jsonPath("$.embeds[0].title").value("New Emoji"))
        .andExpect(jsonPath("$.embeds[0].color").value(0x5ae9ff))
        .andExpect(jsonPath("$.embeds[0].footer.text").value("My Server"))
        .andRespond(
            withSuccess(
                """
                {"id":"m1","channel_id":"c1"}
                """,
                MediaType.APPLICATION_JSON));

    final String messageId =
        fixture.client.sendEmbed(
            "c1",
            new PlatformEmbed(
                "New Emoji",
                "body",
                0x5ae9ff,
                new PlatformEmbed.Footer("My Server"),
                "2026-03-01T12:00:00Z"));

    assertThat(messageId).isEqualTo("m1");
    fixture.server.verify();
  }

  @Test
  void createAndDeleteGlobalCommand() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(BASE_URL + "/applications/app-1/commands"))
        .andExpect(method(POST))
        .andExpect(jsonPath("$.name").value("register"))
        .andExpect(jsonPath("$.default_member_permissions").value("0"))
        .andRespond(
            withSuccess(
                """
                {"id":"cmd-1","name":"register"}
                """,
                MediaType.APPLICATION_JSON));
    fixture
        .server
        .expect(requestTo(BASE_URL + "/applications/app-1/commands/cmd-1"))
        .andExpect(method(DELETE))
        .andRespond(withStatus(HttpStatus.NO_CONTENT));

    final PlatformCommandResponse created =
        fixture.client.createGlobalCommand(
            "app-1", new PlatformCommandRequest("register", "desc", "0"));
    fixture.client.deleteGlobalCommand("app-1", created.id());

    assertThat(created.id()).isEqualTo("cmd-1");
    fixture.server.verify();
  }

  @Test
  void getCurrentUserIdReadsBotId() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(BASE_URL + "/users/@me"))
        .andRespond(
            withSuccess(
                """
                {"id":"app-1","username":"emoji-notifier"}
                """,
                MediaType.APPLICATION_JSON));

    assertThat(fixture.client.getCurrentUserId()).isEqualTo("app-1");
  }

  @Test
  void getChannelRejectsBlankChannelId() {
    final ClientFixture fixture = newFixture();

    assertThatThrownBy(() -> fixture.client.getChannel(" "))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("channelId is required");
  }

  @Test
  void maps401ToUnauthorized() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(BASE_URL + "/users/@me/guilds?limit=200"))
        .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

    assertReason(fixture.client::listGuilds, PlatformIntegrationException.Reason.UNAUTHORIZED);
  }

  @Test
  void maps403ToForbidden() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(BASE_URL + "/channels/c1"))
        .andRespond(withStatus(HttpStatus.FORBIDDEN));

    assertReason(
        () -> fixture.client.getChannel("c1"), PlatformIntegrationException.Reason.FORBIDDEN);
  }

  @Test
  void maps404ToNotFound() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(BASE_URL + "/guilds/g9"))
        .andRespond(withStatus(HttpStatus.NOT_FOUND));

    assertReason(
        () -> fixture.client.getGuild("g9"), PlatformIntegrationException.Reason.NOT_FOUND);
  }

  @Test
  void maps5xxAndRateLimitToBadGateway() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(BASE_URL + "/channels/c1/messages"))
        .andRespond(withServerError());
    fixture
        .server
        .expect(requestTo(BASE_URL + "/channels/c1/messages"))
        .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));
    final PlatformEmbed embed = new PlatformEmbed("t", "d", 1, null, null);

    assertReason(
        () -> fixture.client.sendEmbed("c1", embed),
        PlatformIntegrationException.Reason.BAD_GATEWAY);
    assertReason(
        () -> fixture.client.sendEmbed("c1", embed),
        PlatformIntegrationException.Reason.BAD_GATEWAY);
  }

  @Test
  void mapsReadTimeoutToTimeout() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(BASE_URL + "/users/@me/guilds?limit=200"))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    assertReason(fixture.client::listGuilds, PlatformIntegrationException.Reason.TIMEOUT);
  }

  @Test
  void mapsConnectionFailureToBadGateway() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(BASE_URL + "/users/@me/guilds?limit=200"))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "connection refused", new ConnectException("Connection refused"));
            });

    assertReason(fixture.client::listGuilds, PlatformIntegrationException.Reason.BAD_GATEWAY);
  }

  @Test
  void mapsUnparseableBodyToInvalidResponse() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(BASE_URL + "/guilds/g1/emojis"))
        .andRespond(withSuccess("{not-json", MediaType.APPLICATION_JSON));

    assertReason(
        () -> fixture.client.listGuildEmojis("g1"),
        PlatformIntegrationException.Reason.INVALID_RESPONSE);
  }

  @Test
  void rejectsEmojiEntryWithoutName() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(BASE_URL + "/guilds/g1/emojis"))
        .andRespond(withSuccess("[{\"id\":\"1\"}]", MediaType.APPLICATION_JSON));

    assertReason(
        () -> fixture.client.listGuildEmojis("g1"),
        PlatformIntegrationException.Reason.INVALID_RESPONSE);
  }

  private void assertReason(Runnable call, PlatformIntegrationException.Reason reason) {
    assertThatThrownBy(call::run)
        .isInstanceOf(PlatformIntegrationException.class)
        .extracting(ex -> ((PlatformIntegrationException) ex).reason())
        .isEqualTo(reason);
  }

  private ClientFixture newFixture() {
    return newFixture(null);
  }

  private ClientFixture newFixture(Integer guildPageSize) {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final RestClient restClient = builder.baseUrl(BASE_URL).build();
    final PlatformApiProperties properties =
        new PlatformApiProperties(
            BASE_URL, null, null, null, null, null, null, null, null, null, null, guildPageSize);
    return new ClientFixture(new PlatformApiClient(restClient, properties), server);
  }

  private record ClientFixture(PlatformApiClient client, MockRestServiceServer server) {}
}
