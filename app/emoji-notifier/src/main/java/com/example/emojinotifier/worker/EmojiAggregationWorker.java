/*
 * Where: emoji-notifier aggregation worker
 * What: Owns the pending queue, accepts hand-offs and flushes one summary per guild each window
 * Why: Many rapid additions collapse into a single message per guild
 */
package com.example.emojinotifier.worker;

import com.example.common.CorrelationIds;
import com.example.emojinotifier.config.EmojiNotifierProperties;
import com.example.emojinotifier.config.EmojiWorkerProperties;
import com.example.emojinotifier.config.WorkerExecutorConfig;
import com.example.emojinotifier.model.Emoji;
import com.example.emojinotifier.model.EmojiNotifyRequest;
import com.example.emojinotifier.repository.EmojiRegistry;
import com.example.emojinotifier.repository.PendingEmojiQueue;
import com.example.emojinotifier.service.EmojiDeliveryException;
import com.example.emojinotifier.service.EmojiNotifierMetrics;
import com.example.emojinotifier.service.EmojiSummaryDeliveryService;
import com.google.common.annotations.VisibleForTesting;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Single consumer loop, hosted on the {@link WorkerExecutorConfig#AGGREGATION_EXECUTOR} executor,
 * that waits on whichever comes first: the next tick deadline or a request
 * on the hand-off queue. Only this loop enqueues into or drains the {@link PendingEmojiQueue};
 * producers on other threads go through {@link #submit(EmojiNotifyRequest)}.
 *
 * <p>Delivery failures are not retried. The drained batch of a failing guild is discarded so a
 * guild without a usable channel cannot build an unbounded backlog.
 */
@Component
public class EmojiAggregationWorker {

  private static final Logger logger = LoggerFactory.getLogger(EmojiAggregationWorker.class);
  // compared by identity
  private static final EmojiNotifyRequest STOP_SIGNAL =
      new EmojiNotifyRequest("", new Emoji("", "", false));

  private final PendingEmojiQueue pendingQueue = new PendingEmojiQueue();
  private final BlockingQueue<EmojiNotifyRequest> handoff = new LinkedBlockingQueue<>();
  private final EmojiRegistry emojiRegistry;
  private final EmojiSummaryDeliveryService deliveryService;
  private final EmojiNotifierMetrics metrics;
  private final Duration notifyWindow;
  private final EmojiWorkerProperties workerProperties;
  private final ThreadPoolTaskExecutor executor;
  private final AtomicBoolean started = new AtomicBoolean(false);
  private volatile boolean running;
  private Future<?> loop;

  public EmojiAggregationWorker(
      EmojiRegistry emojiRegistry,
      EmojiSummaryDeliveryService deliveryService,
      EmojiNotifierMetrics metrics,
      EmojiNotifierProperties properties,
      EmojiWorkerProperties workerProperties,
      @Qualifier(WorkerExecutorConfig.AGGREGATION_EXECUTOR) ThreadPoolTaskExecutor executor) {
    this.emojiRegistry = emojiRegistry;
    this.deliveryService = deliveryService;
    this.metrics = metrics;
    this.notifyWindow = properties.notifyWindow();
    this.workerProperties = workerProperties;
    this.executor = executor;
  }

  @PostConstruct
  public void start() {
    if (!workerProperties.enabled()) {
      logger.info("emoji aggregation worker disabled");
      return;
    }
    if (!started.compareAndSet(false, true)) {
      return;
    }
    running = true;
    loop = executor.submit(this::runLoop);
    logger.info("emoji aggregation worker started notifyWindow={}", notifyWindow);
  }

  /** Lets the tick in progress finish; requests still pending are dropped. */
  @PreDestroy
  public void stop() {
    if (loop == null) {
      return;
    }
    running = false;
    handoff.offer(STOP_SIGNAL);
    try {
      loop.get(workerProperties.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      logger.warn(
          "emoji aggregation worker did not stop within {}", workerProperties.shutdownTimeout());
      loop.cancel(true);
    } catch (ExecutionException ex) {
      logger.error("emoji aggregation worker terminated abnormally", ex.getCause());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    loop = null;
  }

  /** Hand-off entry point, safe to call from any thread. */
  public void submit(EmojiNotifyRequest request) {
    if (!running) {
      logger.warn(
          "emoji aggregation worker not running, request dropped guildId={} emojiId={}",
          request.guildId(),
          request.emoji().id());
      return;
    }
    handoff.offer(request);
  }

  public boolean isRunning() {
    return running;
  }

  public int pendingCount(String guildId) {
    return pendingQueue.pendingCount(guildId);
  }

  private void runLoop() {
    final long windowNanos = notifyWindow.toNanos();
    long nextTickAt = System.nanoTime() + windowNanos;
    while (running) {
      final long waitNanos = nextTickAt - System.nanoTime();
      if (waitNanos <= 0) {
        flushSafely();
        nextTickAt += windowNanos;
        final long now = System.nanoTime();
        if (nextTickAt - now <= 0) {
          // a flush longer than the window skips the missed ticks
          nextTickAt = now + windowNanos;
        }
        continue;
      }
      final EmojiNotifyRequest request;
      try {
        request = handoff.poll(waitNanos, TimeUnit.NANOSECONDS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        break;
      }
      if (request == STOP_SIGNAL) {
        break;
      }
      if (request != null) {
        accept(request);
      }
    }
    running = false;
    logger.info(
        "emoji aggregation worker stopped droppedPending={} droppedHandoff={}",
        pendingQueue.pendingCount(),
        handoff.size());
  }

  private void flushSafely() {
    try {
      flush();
    } catch (RuntimeException ex) {
      logger.error("emoji aggregation tick failed", ex);
    }
  }

  @VisibleForTesting
  void accept(EmojiNotifyRequest request) {
    logger.debug(
        "append to notify queue guildId={} emojiId={}", request.guildId(), request.emoji().id());
    pendingQueue.enqueue(request);
    metrics.recordEnqueued();
    metrics.updatePendingCurrent(pendingQueue.pendingCount());
  }

  @VisibleForTesting
  void flush() {
    final long startedAt = System.nanoTime();
    MDC.put(CorrelationIds.TICK_ID_KEY, CorrelationIds.newTickId());
    try {
      final Map<String, List<EmojiNotifyRequest>> drained = pendingQueue.drainAll();
      metrics.updatePendingCurrent(pendingQueue.pendingCount());
      logger.info("ticked guilds={}", drained.size());
      drained.forEach(this::flushGuild);
    } finally {
      metrics.recordFlushDuration(Duration.ofNanos(System.nanoTime() - startedAt));
      MDC.remove(CorrelationIds.TICK_ID_KEY);
    }
  }

  private void flushGuild(String guildId, List<EmojiNotifyRequest> requests) {
    final List<Emoji> unique = deduplicate(requests);
    final List<Emoji> fresh = new ArrayList<>(unique.size());
    for (Emoji emoji : unique) {
      // an emoji recorded by an earlier tick may have been re-enqueued before the registry caught up
      if (!emojiRegistry.contains(guildId, emoji.id())) {
        fresh.add(emoji);
      }
    }
    logger.info(
        "queue drained guildId={} requests={} unique={} fresh={}",
        guildId,
        requests.size(),
        unique.size(),
        fresh.size());
    if (fresh.isEmpty()) {
      metrics.recordDeliveryResult("skipped");
      return;
    }
    try {
      deliveryService.deliver(guildId, fresh);
    } catch (EmojiDeliveryException ex) {
      if (ex.reason() == EmojiDeliveryException.Reason.TRANSPORT_FAILURE) {
        logger.warn("summary dropped guildId={} emojis={} reason={}", guildId, fresh.size(), ex.reason(), ex);
      } else {
        logger.warn(
            "summary dropped guildId={} emojis={} reason={} detail={}",
            guildId,
            fresh.size(),
            ex.reason(),
            ex.getMessage());
      }
      metrics.recordDeliveryResult(ex.reason().name().toLowerCase(Locale.ROOT));
      return;
    } catch (RuntimeException ex) {
      logger.warn("summary dropped guildId={} emojis={} unexpected failure", guildId, fresh.size(), ex);
      metrics.recordDeliveryResult("error");
      return;
    }
    // in-memory puts that cannot fail, so the guild's batch is recorded as a whole
    for (Emoji emoji : fresh) {
      emojiRegistry.record(guildId, emoji);
    }
    metrics.recordDeliveryResult("sent");
  }

  /** Keeps the last occurrence of each emoji id, in order of first appearance. */
  static List<Emoji> deduplicate(List<EmojiNotifyRequest> requests) {
    final Map<String, Emoji> latest = new LinkedHashMap<>();
    for (EmojiNotifyRequest request : requests) {
      latest.put(request.emoji().id(), request.emoji());
    }
    return List.copyOf(latest.values());
  }
}
