package com.scholary.mediascribe.api;

import com.scholary.mediascribe.service.SummaryOutcome;
import com.scholary.mediascribe.summary.SummaryKind;

/**
 * Response for a summary request.
 *
 * <p>When every model failed, {@code success} is false and {@code error} says why.
 */
public record SummaryResponse(
    String requesterId,
    SummaryKind kind,
    boolean success,
    boolean cached,
    String text,
    String model,
    String error) {

  public static SummaryResponse from(String requesterId, SummaryOutcome outcome) {
    if (!outcome.isSuccess()) {
      return new SummaryResponse(
          requesterId, outcome.kind(), false, false, null, null, outcome.error());
    }
    return new SummaryResponse(
        requesterId,
        outcome.kind(),
        true,
        outcome.cached(),
        outcome.summary().text(),
        outcome.summary().model(),
        null);
  }
}
