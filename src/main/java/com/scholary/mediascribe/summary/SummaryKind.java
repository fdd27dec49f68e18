package com.scholary.mediascribe.summary;

import java.util.Locale;

/** Verbosity of a summary. */
public enum SummaryKind {
  BRIEF,
  DETAILED;

  /**
   * Parse a kind from a path segment or command argument, case-insensitively.
   *
   * @throws IllegalArgumentException for unknown values
   */
  public static SummaryKind fromString(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Summary kind is required");
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
