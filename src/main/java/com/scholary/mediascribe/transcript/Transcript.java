package com.scholary.mediascribe.transcript;

import java.nio.file.Path;

/**
 * A finished transcript in both representations.
 *
 * <p>{@code raw} is the reconstructed service output and never changes; {@code formatted} is the
 * LLM-refined version of it. Paths are null when the text was not written to disk.
 */
public record Transcript(
    String sourceName,
    String raw,
    String formatted,
    Path rawPath,
    Path formattedPath,
    Path subtitlesPath) {

  public Transcript {
    if (raw == null) {
      throw new IllegalArgumentException("Raw transcript is required");
    }
    formatted = formatted == null ? raw : formatted;
  }
}
