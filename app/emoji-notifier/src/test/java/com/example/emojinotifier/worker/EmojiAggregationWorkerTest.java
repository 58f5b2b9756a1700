/*
 * Where: emoji-notifier aggregation worker tests
 * What: Dedup, self-notification suppression, failure discard and per-guild isolation
 * Why: One summary per guild and window, never a repeated announcement
 */
package com.example.emojinotifier.worker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.emojinotifier.config.EmojiNotifierProperties;
import com.example.emojinotifier.config.EmojiWorkerProperties;
import com.example.emojinotifier.config.WorkerExecutorConfig;
import com.example.emojinotifier.model.Emoji;
import com.example.emojinotifier.model.EmojiNotifyRequest;
import com.example.emojinotifier.repository.EmojiRegistry;
import com.example.emojinotifier.service.EmojiDeliveryException;
import com.example.emojinotifier.service.EmojiNotifierMetrics;
import com.example.emojinotifier.service.EmojiSummaryDeliveryService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@ExtendWith(MockitoExtension.class)
class EmojiAggregationWorkerTest {

  private static final String GUILD_ID = "guild-1";
  private static final String OTHER_GUILD_ID = "guild-2";
  private static final Duration WINDOW = Duration.ofMinutes(5);

  @Mock private EmojiSummaryDeliveryService deliveryService;

  @Captor private ArgumentCaptor<List<Emoji>> emojisCaptor;

  private SimpleMeterRegistry meterRegistry;
  private EmojiNotifierMetrics metrics;
  private EmojiRegistry registry;
  private EmojiAggregationWorker worker;
  private ThreadPoolTaskExecutor executor;

  @BeforeEach
  void setUp() {
    executor = WorkerExecutorConfig.aggregationExecutor(Duration.ofSeconds(5));
    executor.initialize();
    meterRegistry = new SimpleMeterRegistry();
    metrics = new EmojiNotifierMetrics(meterRegistry);
    registry = new EmojiRegistry(metrics);
    // the loop thread stays off; the tests drive accept/flush directly
    worker = newWorker(WINDOW, false);
  }

  @AfterEach
  void tearDown() {
    worker.stop();
    executor.shutdown();
  }

  @Test
  void flushDeliversOneSummaryWithLastOccurrenceOfEachEmoji() {
    final Emoji a = new Emoji("1", "foo", false);
    final Emoji b = new Emoji("2", "bar", false);
    final Emoji renamedA = new Emoji("1", "foo2", false);
    worker.accept(new EmojiNotifyRequest(GUILD_ID, a));
    worker.accept(new EmojiNotifyRequest(GUILD_ID, b));
    worker.accept(new EmojiNotifyRequest(GUILD_ID, renamedA));

    worker.flush();

    verify(deliveryService).deliver(GUILD_ID, List.of(renamedA, b));
    assertThat(registry.contains(GUILD_ID, "1")).isTrue();
    assertThat(registry.contains(GUILD_ID, "2")).isTrue();
    assertThat(worker.pendingCount(GUILD_ID)).isZero();
    assertThat(deliveryCount("sent")).isEqualTo(1.0d);
  }

  @Test
  void emojisAlreadyInRegistryAreNotAnnouncedAgain() {
    final Emoji known = new Emoji("1", "foo", false);
    registry.record(GUILD_ID, known);
    worker.accept(new EmojiNotifyRequest(GUILD_ID, known));

    worker.flush();

    verifyNoInteractions(deliveryService);
    assertThat(deliveryCount("skipped")).isEqualTo(1.0d);
  }

  @Test
  void failedDeliveryDiscardsBatchWithoutRecording() {
    final Emoji emoji = new Emoji("1", "foo", false);
    when(deliveryService.deliver(eq(GUILD_ID), anyList()))
        .thenThrow(
            new EmojiDeliveryException(
                EmojiDeliveryException.Reason.DESTINATION_NOT_REGISTERED, "no channel"));
    worker.accept(new EmojiNotifyRequest(GUILD_ID, emoji));

    worker.flush();

    assertThat(registry.contains(GUILD_ID, "1")).isFalse();
    assertThat(worker.pendingCount(GUILD_ID)).isZero();
    assertThat(deliveryCount("destination_not_registered")).isEqualTo(1.0d);

    // nothing is retried on the next tick
    worker.flush();
    verify(deliveryService).deliver(eq(GUILD_ID), anyList());
  }

  @Test
  void oneGuildFailingDoesNotAffectAnother() {
    final Emoji failing = new Emoji("1", "foo", false);
    final Emoji delivered = new Emoji("2", "bar", false);
    when(deliveryService.deliver(anyString(), anyList()))
        .thenAnswer(
            invocation -> {
              if (GUILD_ID.equals(invocation.getArgument(0))) {
                throw new IllegalStateException("boom");
              }
              return null;
            });
    worker.accept(new EmojiNotifyRequest(GUILD_ID, failing));
    worker.accept(new EmojiNotifyRequest(OTHER_GUILD_ID, delivered));

    worker.flush();

    verify(deliveryService).deliver(OTHER_GUILD_ID, List.of(delivered));
    assertThat(registry.contains(OTHER_GUILD_ID, "2")).isTrue();
    assertThat(registry.contains(GUILD_ID, "1")).isFalse();
    assertThat(deliveryCount("error")).isEqualTo(1.0d);
    assertThat(deliveryCount("sent")).isEqualTo(1.0d);
  }

  @Test
  void flushWithNothingPendingDeliversNothing() {
    worker.flush();

    verifyNoInteractions(deliveryService);
    assertThat(meterRegistry.get("emoji.notify.flush.duration").timer().count()).isEqualTo(1L);
  }

  @Test
  void acceptUpdatesBacklogGauge() {
    worker.accept(new EmojiNotifyRequest(GUILD_ID, new Emoji("1", "foo", false)));
    worker.accept(new EmojiNotifyRequest(OTHER_GUILD_ID, new Emoji("2", "bar", false)));

    assertThat(meterRegistry.get("emoji.notify.pending.current").gauge().value()).isEqualTo(2.0d);
    assertThat(meterRegistry.get("emoji.notify.enqueued.total").counter().count())
        .isEqualTo(2.0d);
  }

  @Test
  void submitIsDroppedWhenWorkerIsNotRunning() {
    worker.start();

    worker.submit(new EmojiNotifyRequest(GUILD_ID, new Emoji("1", "foo", false)));

    assertThat(worker.isRunning()).isFalse();
    assertThat(worker.pendingCount(GUILD_ID)).isZero();
  }

  @Test
  void runningWorkerDeliversSubmittedRequestsAtTheNextTick() {
    worker = newWorker(Duration.ofMillis(100), true);
    final Emoji emoji = new Emoji("1", "foo", false);
    final AtomicReference<String> deliveringThread = new AtomicReference<>();
    when(deliveryService.deliver(eq(GUILD_ID), anyList()))
        .thenAnswer(
            invocation -> {
              deliveringThread.set(Thread.currentThread().getName());
              return null;
            });
    worker.start();

    worker.submit(new EmojiNotifyRequest(GUILD_ID, emoji));

    verify(deliveryService, timeout(5_000)).deliver(eq(GUILD_ID), emojisCaptor.capture());
    assertThat(emojisCaptor.getValue()).containsExactly(emoji);
    assertThat(deliveringThread.get())
        .startsWith(WorkerExecutorConfig.AGGREGATION_THREAD_PREFIX);

    worker.stop();
    assertThat(worker.isRunning()).isFalse();
  }

  @Test
  void stopWithoutStartIsNoOp() {
    worker.stop();

    assertThat(worker.isRunning()).isFalse();
    verifyNoInteractions(deliveryService);
  }

  @Test
  void deduplicateKeepsFirstPositionAndLastValue() {
    final List<Emoji> unique =
        EmojiAggregationWorker.deduplicate(
            List.of(
                new EmojiNotifyRequest(GUILD_ID, new Emoji("1", "a", false)),
                new EmojiNotifyRequest(GUILD_ID, new Emoji("2", "b", false)),
                new EmojiNotifyRequest(GUILD_ID, new Emoji("1", "a2", true))));

    assertThat(unique)
        .containsExactly(new Emoji("1", "a2", true), new Emoji("2", "b", false));
  }

  private EmojiAggregationWorker newWorker(Duration window, boolean enabled) {
    return new EmojiAggregationWorker(
        registry,
        deliveryService,
        metrics,
        new EmojiNotifierProperties("token", window, "channels.json"),
        new EmojiWorkerProperties(enabled, Duration.ofSeconds(5)),
        executor);
  }

  private double deliveryCount(String result) {
    return meterRegistry.get("emoji.notify.delivery.total").tag("result", result).counter().count();
  }
}
