package com.scholary.mediascribe.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A single timed phrase returned by the speech-to-text service.
 *
 * <p>Times are in seconds relative to the start of the window that produced it, until shifted.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TranscriptSegment(double start, double end, String text) {

  /**
   * Move this segment along the time axis.
   *
   * @param offsetSeconds the offset to add
   * @return a shifted copy
   */
  public TranscriptSegment shift(double offsetSeconds) {
    return new TranscriptSegment(start + offsetSeconds, end + offsetSeconds, text);
  }
}
