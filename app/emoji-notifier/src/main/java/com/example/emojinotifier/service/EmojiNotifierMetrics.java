/*
 * Where: emoji-notifier service layer
 * What: Records enqueue, delivery outcome, backlog and registry metrics
 * Why: Duplicate suppression and dropped batches must be observable without reading logs
 */
package com.example.emojinotifier.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component")
public class EmojiNotifierMetrics {

  private static final String METRIC_ENQUEUED_TOTAL = "emoji.notify.enqueued.total";
  private static final String METRIC_DELIVERY_TOTAL = "emoji.notify.delivery.total";
  private static final String METRIC_PENDING_CURRENT = "emoji.notify.pending.current";
  private static final String METRIC_FLUSH_DURATION = "emoji.notify.flush.duration";
  private static final String METRIC_REGISTRY_RECORDED_TOTAL = "emoji.registry.recorded.total";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger pendingCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();
  private final Counter enqueuedCounter;
  private final Counter registryRecordedCounter;
  private final Timer flushTimer;

  public EmojiNotifierMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_PENDING_CURRENT, pendingCurrent, AtomicInteger::get)
        .description("Notify requests waiting for the next aggregation tick")
        .register(meterRegistry);
    this.enqueuedCounter =
        Counter.builder(METRIC_ENQUEUED_TOTAL)
            .description("Notify requests accepted into the pending queue")
            .register(meterRegistry);
    this.registryRecordedCounter =
        Counter.builder(METRIC_REGISTRY_RECORDED_TOTAL)
            .description("Emojis recorded for the first time in the registry")
            .register(meterRegistry);
    this.flushTimer =
        Timer.builder(METRIC_FLUSH_DURATION)
            .description("Time spent draining and delivering one aggregation tick")
            .register(meterRegistry);
  }

  public void recordEnqueued() {
    enqueuedCounter.increment();
  }

  /** result is one of sent, skipped or a lower-cased delivery failure reason. */
  public void recordDeliveryResult(String result) {
    deliveryCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_DELIVERY_TOTAL)
                    .description("Per-guild batch delivery outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordFlushDuration(Duration duration) {
    flushTimer.record(duration);
  }

  public void recordRegistryRecorded() {
    registryRecordedCounter.increment();
  }

  public void updatePendingCurrent(int pendingCount) {
    pendingCurrent.set(Math.max(pendingCount, 0));
  }
}
