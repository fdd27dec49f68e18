package com.scholary.mediascribe.cache;

import com.scholary.mediascribe.summary.SummaryKind;
import com.scholary.mediascribe.summary.SummaryResult;
import com.scholary.mediascribe.transcript.Transcript;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Latest results for one requester.
 *
 * <p>{@code version} is a process-wide monotonic sequence number; it identifies the transcript the
 * summaries belong to. Instances are immutable; adding a summary creates a new entry.
 */
public record RequesterResultEntry(
    String requesterId,
    long version,
    Transcript transcript,
    Map<SummaryKind, SummaryResult> summaries,
    Instant storedAt) {

  public RequesterResultEntry {
    summaries =
        summaries == null || summaries.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(summaries));
  }

  public Optional<SummaryResult> summary(SummaryKind kind) {
    return Optional.ofNullable(summaries.get(kind));
  }

  RequesterResultEntry withSummary(SummaryResult summary) {
    Map<SummaryKind, SummaryResult> updated = new EnumMap<>(SummaryKind.class);
    updated.putAll(summaries);
    updated.put(summary.kind(), summary);
    return new RequesterResultEntry(requesterId, version, transcript, updated, storedAt);
  }
}
