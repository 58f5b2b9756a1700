/*
 * Where: emoji-notifier NATS subscription
 * What: Consumes guild emoji list updates and hands them to the ingestor
 * Why: Connects the platform's push events to the aggregation pipeline
 */
package com.example.emojinotifier.nats;

import com.example.emojinotifier.config.GuildEmojiNatsProperties;
import com.example.emojinotifier.model.GuildEmojisUpdate;
import com.example.emojinotifier.service.EmojiEventPermanentException;
import com.example.emojinotifier.service.EmojiUpdateIngestor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.StreamConfiguration;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.DependsOn;
import org.springframework.stereotype.Component;

@Component
@DependsOn("guildSession")
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class GuildEmojisUpdateSubscriber {

  private static final Logger logger = LoggerFactory.getLogger(GuildEmojisUpdateSubscriber.class);
  private static final int STREAM_NOT_FOUND_ERROR = 404;
  private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "NATS Connection is a shared resource owned by the Spring context")
  private final Connection connection;

  private final EmojiUpdateIngestor ingestor;
  private final GuildEmojiNatsProperties properties;
  private final ObjectMapper objectMapper;
  private final AtomicBoolean started;
  private Dispatcher dispatcher;
  private JetStreamSubscription subscription;

  public GuildEmojisUpdateSubscriber(
      Connection connection,
      EmojiUpdateIngestor ingestor,
      GuildEmojiNatsProperties properties,
      ObjectMapper objectMapper) {
    this.connection = connection;
    this.ingestor = ingestor;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.started = new AtomicBoolean(false);
  }

  @PostConstruct
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    try {
      ensureStream();
      final JetStream jetStream = connection.jetStream();
      dispatcher = connection.createDispatcher();
      subscription =
          jetStream.subscribe(
              properties.subject(),
              dispatcher,
              this::handleMessage,
              false,
              buildPushSubscribeOptions());
      logger.info(
          "guild emojis subscriber started subject={} stream={} durable={}",
          properties.subject(),
          properties.stream(),
          properties.durable());
    } catch (IOException | JetStreamApiException ex) {
      started.set(false);
      throw new IllegalStateException("failed to start JetStream subscription", ex);
    }
  }

  @PreDestroy
  public void stop() {
    if (subscription != null) {
      subscription.unsubscribe();
      subscription = null;
    }
    if (dispatcher != null) {
      connection.closeDispatcher(dispatcher);
      dispatcher = null;
    }
  }

  @VisibleForTesting
  void handleMessage(Message message) {
    try {
      final GuildEmojisUpdate update =
          objectMapper.readValue(message.getData(), GuildEmojisUpdate.class);
      final int forwarded = ingestor.handleGuildEmojisUpdate(update);
      logger.debug("guild emojis update handled guildId={} forwarded={}", update.guildId(), forwarded);
      message.ack();
    } catch (JsonProcessingException ex) {
      // a broken payload stays broken on redelivery
      logger.warn("failed to parse guild emojis update payload", ex);
      termSilently(message);
    } catch (EmojiEventPermanentException ex) {
      logger.warn("permanent failure while handling guild emojis update", ex);
      termSilently(message);
    } catch (IOException | RuntimeException ex) {
      logger.warn("failed to handle guild emojis update", ex);
      nakSilently(message);
    }
  }

  private void ensureStream() throws IOException, JetStreamApiException {
    final StreamConfiguration streamConfiguration =
        StreamConfiguration.builder()
            .name(properties.stream())
            .subjects(properties.subject())
            .duplicateWindow(properties.duplicateWindow())
            .build();
    final JetStreamManagement jetStreamManagement = connection.jetStreamManagement();
    try {
      jetStreamManagement.updateStream(streamConfiguration);
    } catch (JetStreamApiException ex) {
      if (!isStreamNotFound(ex)) {
        throw ex;
      }
      jetStreamManagement.addStream(streamConfiguration);
    }
    logger.info(
        "guild emojis stream ensured stream={} subject={} duplicateWindow={}",
        properties.stream(),
        properties.subject(),
        properties.duplicateWindow());
  }

  private boolean isStreamNotFound(JetStreamApiException ex) {
    return ex.getApiErrorCode() == STREAM_NOT_FOUND_API_ERROR
        || ex.getErrorCode() == STREAM_NOT_FOUND_ERROR;
  }

  private PushSubscribeOptions buildPushSubscribeOptions() {
    final ConsumerConfiguration consumerConfiguration =
        ConsumerConfiguration.builder()
            .ackPolicy(AckPolicy.Explicit)
            .ackWait(properties.ackWait())
            .maxDeliver(properties.maxDeliver())
            .build();
    return PushSubscribeOptions.builder()
        .stream(properties.stream())
        .durable(properties.durable())
        .configuration(consumerConfiguration)
        .build();
  }

  private void nakSilently(Message message) {
    try {
      message.nak();
    } catch (IllegalStateException ex) {
      logger.warn("failed to nak guild emojis update", ex);
    }
  }

  private void termSilently(Message message) {
    try {
      message.term();
    } catch (IllegalStateException ex) {
      logger.warn("failed to term guild emojis update", ex);
    }
  }
}
