package com.scholary.mediascribe.audio;

import java.nio.file.Path;

/**
 * A fixed-duration window of the normalized audio, exported as its own WAV file.
 *
 * <p>The sequence index is the only sort key; the offset is always {@code index * windowSeconds}.
 */
public record AudioSegment(int index, double offsetSeconds, double durationSeconds, Path file) {

  public AudioSegment {
    if (index < 0) {
      throw new IllegalArgumentException("Index cannot be negative");
    }
    if (offsetSeconds < 0) {
      throw new IllegalArgumentException("Offset cannot be negative");
    }
    if (durationSeconds <= 0) {
      throw new IllegalArgumentException("Duration must be positive");
    }
  }

  public double endSeconds() {
    return offsetSeconds + durationSeconds;
  }
}
