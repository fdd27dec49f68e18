package com.scholary.mediascribe.llm;

import java.util.List;

/**
 * Tagged outcome of a cascade run: either the text of the first model that answered, or the log of
 * every failed attempt.
 */
public record CascadeResult(
    Outcome outcome, String text, String model, List<CascadeAttempt> attempts) {

  public enum Outcome {
    SUCCESS,
    EXHAUSTED
  }

  public CascadeResult {
    attempts = attempts == null ? List.of() : List.copyOf(attempts);
  }

  public static CascadeResult success(String text, String model, List<CascadeAttempt> failed) {
    return new CascadeResult(Outcome.SUCCESS, text, model, failed);
  }

  public static CascadeResult exhausted(List<CascadeAttempt> attempts) {
    return new CascadeResult(Outcome.EXHAUSTED, null, null, attempts);
  }

  public boolean isSuccess() {
    return outcome == Outcome.SUCCESS;
  }

  /** Error text suitable for showing to the requester. Null on success. */
  public String errorMessage() {
    if (isSuccess()) {
      return null;
    }
    if (attempts.isEmpty()) {
      return "All language models failed.";
    }
    CascadeAttempt last = attempts.get(attempts.size() - 1);
    return String.format(
        "All %d language model attempts failed; last error from %s: %s",
        attempts.size(), last.model(), last.error());
  }
}
