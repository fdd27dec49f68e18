package com.scholary.mediascribe.cache;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.mediascribe.store.CaffeineKeyValueStore;
import com.scholary.mediascribe.summary.SummaryKind;
import com.scholary.mediascribe.summary.SummaryResult;
import com.scholary.mediascribe.transcript.Transcript;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests for ResultCache replacement and summary attachment rules. */
class ResultCacheTest {

  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  private ResultCache cache;

  @BeforeEach
  void setUp() {
    cache =
        new ResultCache(
            new CaffeineKeyValueStore<>("results", 100, Duration.ofHours(1)),
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void store_shouldReplacePreviousEntryAndDropSummaries() {
    RequesterResultEntry first = cache.store("alice", transcript("first"));
    cache.attachSummary("alice", first.version(), summary(SummaryKind.BRIEF, "short"));

    RequesterResultEntry second = cache.store("alice", transcript("second"));

    assertThat(second.version()).isGreaterThan(first.version());
    assertThat(cache.find("alice"))
        .hasValueSatisfying(
            entry -> {
              assertThat(entry.transcript().raw()).isEqualTo("second");
              assertThat(entry.summaries()).isEmpty();
              assertThat(entry.storedAt()).isEqualTo(NOW);
            });
  }

  @Test
  void attachSummary_shouldStoreSummaryForCurrentVersion() {
    RequesterResultEntry entry = cache.store("alice", transcript("text"));

    boolean attached =
        cache.attachSummary("alice", entry.version(), summary(SummaryKind.DETAILED, "long"));

    assertThat(attached).isTrue();
    assertThat(cache.findSummary("alice", SummaryKind.DETAILED))
        .hasValueSatisfying(s -> assertThat(s.text()).isEqualTo("long"));
    assertThat(cache.findSummary("alice", SummaryKind.BRIEF)).isEmpty();
  }

  @Test
  void attachSummary_shouldIgnoreSummaryOfReplacedTranscript() {
    RequesterResultEntry old = cache.store("alice", transcript("old"));
    cache.store("alice", transcript("new"));

    boolean attached =
        cache.attachSummary("alice", old.version(), summary(SummaryKind.BRIEF, "stale"));

    assertThat(attached).isFalse();
    assertThat(cache.findSummary("alice", SummaryKind.BRIEF)).isEmpty();
  }

  @Test
  void attachSummary_shouldNeverOverwriteExistingSummary() {
    RequesterResultEntry entry = cache.store("alice", transcript("text"));
    cache.attachSummary("alice", entry.version(), summary(SummaryKind.BRIEF, "first"));

    boolean attached =
        cache.attachSummary("alice", entry.version(), summary(SummaryKind.BRIEF, "second"));

    assertThat(attached).isFalse();
    assertThat(cache.findSummary("alice", SummaryKind.BRIEF))
        .hasValueSatisfying(s -> assertThat(s.text()).isEqualTo("first"));
  }

  @Test
  void entries_shouldBeIsolatedPerRequester() {
    cache.store("alice", transcript("a"));

    assertThat(cache.find("bob")).isEmpty();
    assertThat(cache.attachSummary("bob", 1, summary(SummaryKind.BRIEF, "x"))).isFalse();
  }

  private static Transcript transcript(String raw) {
    return new Transcript("talk.mp4", raw, raw, null, null, null);
  }

  private static SummaryResult summary(SummaryKind kind, String text) {
    return new SummaryResult(kind, text, "model");
  }
}
