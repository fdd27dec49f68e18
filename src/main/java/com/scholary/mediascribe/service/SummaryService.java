package com.scholary.mediascribe.service;

import com.scholary.mediascribe.cache.RequesterResultEntry;
import com.scholary.mediascribe.cache.ResultCache;
import com.scholary.mediascribe.llm.CascadeResult;
import com.scholary.mediascribe.summary.Summarizer;
import com.scholary.mediascribe.summary.SummaryKind;
import com.scholary.mediascribe.summary.SummaryResult;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Summaries of a requester's latest transcript, computed once per kind and transcript version.
 */
@Service
public class SummaryService {

  private static final Logger LOGGER = LoggerFactory.getLogger(SummaryService.class);

  private final ResultCache resultCache;
  private final Summarizer summarizer;

  public SummaryService(ResultCache resultCache, Summarizer summarizer) {
    this.resultCache = resultCache;
    this.summarizer = summarizer;
  }

  /**
   * Summarize the latest transcript of a requester.
   *
   * @return empty if the requester has no transcript
   */
  public Optional<SummaryOutcome> summarize(String requesterId, SummaryKind kind) {
    Optional<RequesterResultEntry> found = resultCache.find(requesterId);
    if (found.isEmpty()) {
      return Optional.empty();
    }
    RequesterResultEntry entry = found.get();

    Optional<SummaryResult> cached = entry.summary(kind);
    if (cached.isPresent()) {
      LOGGER.info("Summary cache hit: requester={}, kind={}", requesterId, kind);
      return Optional.of(SummaryOutcome.fromCache(cached.get()));
    }

    CascadeResult result = summarizer.summarize(entry.transcript().formatted(), kind);
    if (!result.isSuccess()) {
      LOGGER.warn(
          "Summary failed: requester={}, kind={}, attempts={}",
          requesterId,
          kind,
          result.attempts().size());
      return Optional.of(SummaryOutcome.failed(kind, result.errorMessage()));
    }

    SummaryResult summary = new SummaryResult(kind, result.text(), result.model());
    if (!resultCache.attachSummary(requesterId, entry.version(), summary)) {
      LOGGER.info(
          "Summary not cached, transcript changed or summary already present: requester={}",
          requesterId);
    }
    return Optional.of(SummaryOutcome.computed(summary));
  }
}
