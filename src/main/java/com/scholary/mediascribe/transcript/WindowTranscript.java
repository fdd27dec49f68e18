package com.scholary.mediascribe.transcript;

import com.scholary.mediascribe.whisper.TranscriptSegment;
import java.util.List;

/**
 * Transcription output for one audio window.
 *
 * <p>Segments keep window-local times; {@link #absoluteSegments()} moves them onto the global
 * axis using this window's offset.
 */
public record WindowTranscript(
    int windowIndex, double offsetSeconds, String text, List<TranscriptSegment> segments) {

  public WindowTranscript {
    if (windowIndex < 0) {
      throw new IllegalArgumentException("Window index cannot be negative");
    }
    if (offsetSeconds < 0) {
      throw new IllegalArgumentException("Offset cannot be negative");
    }
    text = text == null ? "" : text;
    segments = segments == null ? List.of() : List.copyOf(segments);
  }

  public boolean hasTiming() {
    return !segments.isEmpty();
  }

  public List<TranscriptSegment> absoluteSegments() {
    return segments.stream().map(s -> s.shift(offsetSeconds)).toList();
  }
}
