/*
 * Where: emoji-notifier registry tests
 * What: Membership, overwrite and first-record observability
 * Why: Registry membership alone decides whether an emoji is announced
 */
package com.example.emojinotifier.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.emojinotifier.model.Emoji;
import com.example.emojinotifier.service.EmojiNotifierMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EmojiRegistryTest {

  private static final String GUILD_ID = "guild-1";

  private SimpleMeterRegistry meterRegistry;
  private EmojiRegistry registry;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    registry = new EmojiRegistry(new EmojiNotifierMetrics(meterRegistry));
  }

  @Test
  void containsOnlyRecordedEmojisOfTheSameGuild() {
    registry.record(GUILD_ID, new Emoji("1", "foo", false));

    assertThat(registry.contains(GUILD_ID, "1")).isTrue();
    assertThat(registry.contains(GUILD_ID, "2")).isFalse();
    // ids are scoped per guild
    assertThat(registry.contains("guild-2", "1")).isFalse();
  }

  @Test
  void recordingTheSameIdTwiceOverwritesAndCountsOnce() {
    registry.record(GUILD_ID, new Emoji("1", "foo", false));
    registry.record(GUILD_ID, new Emoji("1", "foo2", false));

    assertThat(registry.size(GUILD_ID)).isEqualTo(1);
    assertThat(meterRegistry.get("emoji.registry.recorded.total").counter().count())
        .isEqualTo(1.0d);
  }

  @Test
  void recordAllMarksGuildKnownEvenWhenCatalogueIsEmpty() {
    assertThat(registry.knowsGuild(GUILD_ID)).isFalse();

    registry.recordAll(GUILD_ID, List.of());

    assertThat(registry.knowsGuild(GUILD_ID)).isTrue();
    assertThat(registry.size(GUILD_ID)).isZero();
  }

  @Test
  void sizeOfUnknownGuildIsZero() {
    assertThat(registry.size("unknown")).isZero();
  }
}
