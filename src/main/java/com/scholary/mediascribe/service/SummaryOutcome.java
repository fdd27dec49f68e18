package com.scholary.mediascribe.service;

import com.scholary.mediascribe.summary.SummaryKind;
import com.scholary.mediascribe.summary.SummaryResult;

/**
 * Answer to a summary request: the summary, or the error text when every model failed.
 *
 * @param cached whether the summary came from the result cache
 */
public record SummaryOutcome(
    SummaryKind kind, SummaryResult summary, boolean cached, String error) {

  public static SummaryOutcome computed(SummaryResult summary) {
    return new SummaryOutcome(summary.kind(), summary, false, null);
  }

  public static SummaryOutcome fromCache(SummaryResult summary) {
    return new SummaryOutcome(summary.kind(), summary, true, null);
  }

  public static SummaryOutcome failed(SummaryKind kind, String error) {
    return new SummaryOutcome(kind, null, false, error);
  }

  public boolean isSuccess() {
    return summary != null;
  }
}
