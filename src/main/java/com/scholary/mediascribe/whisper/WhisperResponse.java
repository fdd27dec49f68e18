package com.scholary.mediascribe.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Parsed {@code verbose_json} transcription response.
 *
 * <p>A failed window is represented by {@link #empty()} rather than an exception.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WhisperResponse(String text, List<TranscriptSegment> segments) {

  public WhisperResponse {
    text = text == null ? "" : text;
    segments = segments == null ? List.of() : List.copyOf(segments);
  }

  public static WhisperResponse empty() {
    return new WhisperResponse("", List.of());
  }

  public boolean isEmpty() {
    return text.isBlank() && segments.isEmpty();
  }
}
