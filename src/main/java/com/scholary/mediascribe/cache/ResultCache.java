package com.scholary.mediascribe.cache;

import com.scholary.mediascribe.config.PipelineProperties;
import com.scholary.mediascribe.store.CaffeineKeyValueStore;
import com.scholary.mediascribe.store.KeyValueStore;
import com.scholary.mediascribe.summary.SummaryKind;
import com.scholary.mediascribe.summary.SummaryResult;
import com.scholary.mediascribe.transcript.Transcript;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Holds the most recent transcript and summaries per requester.
 *
 * <p>Storing a new transcript replaces the entry and drops its summaries. A summary is attached
 * only to the transcript version it was computed from, and is never overwritten once present.
 */
@Component
public class ResultCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(ResultCache.class);

  private final KeyValueStore<String, RequesterResultEntry> store;
  private final AtomicLong sequence = new AtomicLong();
  private final Clock clock;

  @Autowired
  public ResultCache(PipelineProperties properties) {
    this(
        new CaffeineKeyValueStore<>(
            "results",
            properties.resultCache().maxSize(),
            Duration.ofHours(properties.resultCache().ttlHours())),
        Clock.systemUTC());
  }

  ResultCache(KeyValueStore<String, RequesterResultEntry> store, Clock clock) {
    this.store = store;
    this.clock = clock;
  }

  /**
   * Store a new transcript for a requester. Last write wins.
   *
   * @return the new entry
   */
  public RequesterResultEntry store(String requesterId, Transcript transcript) {
    RequesterResultEntry entry =
        new RequesterResultEntry(
            requesterId, sequence.incrementAndGet(), transcript, Map.of(), clock.instant());
    store.put(requesterId, entry);
    LOGGER.info("Stored transcript: requester={}, version={}", requesterId, entry.version());
    return entry;
  }

  public Optional<RequesterResultEntry> find(String requesterId) {
    return store.get(requesterId);
  }

  public Optional<SummaryResult> findSummary(String requesterId, SummaryKind kind) {
    return find(requesterId).flatMap(entry -> entry.summary(kind));
  }

  /**
   * Attach a summary computed from a given transcript version.
   *
   * @return true if the summary was stored; false if the transcript changed meanwhile or a summary
   *     of that kind already exists
   */
  public boolean attachSummary(String requesterId, long transcriptVersion, SummaryResult summary) {
    boolean[] attached = {false};
    store.compute(
        requesterId,
        (key, current) -> {
          if (current == null
              || current.version() != transcriptVersion
              || current.summaries().containsKey(summary.kind())) {
            return current;
          }
          attached[0] = true;
          return current.withSummary(summary);
        });

    if (!attached[0]) {
      LOGGER.debug(
          "Summary not attached: requester={}, version={}, kind={}",
          requesterId,
          transcriptVersion,
          summary.kind());
    }
    return attached[0];
  }
}
