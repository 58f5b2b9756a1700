/*
 * Where: emoji-notifier infrastructure configuration
 * What: Spring-owned executor that hosts the aggregation loop
 * Why: The loop selects on a hand-off queue and a tick deadline, which a fixed-rate schedule cannot express
 */
package com.example.emojinotifier.config;

import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class WorkerExecutorConfig {

  public static final String AGGREGATION_EXECUTOR = "emojiAggregationExecutor";
  public static final String AGGREGATION_THREAD_PREFIX = "emoji-aggregation-worker-";

  @Bean(name = AGGREGATION_EXECUTOR)
  public ThreadPoolTaskExecutor emojiAggregationExecutor(EmojiWorkerProperties properties) {
    return aggregationExecutor(properties.shutdownTimeout());
  }

  /** One thread, no queue: the executor only ever runs the single consumer loop. */
  public static ThreadPoolTaskExecutor aggregationExecutor(Duration shutdownTimeout) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix(AGGREGATION_THREAD_PREFIX);
    executor.setDaemon(true);
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationMillis(shutdownTimeout.toMillis());
    return executor;
  }
}
