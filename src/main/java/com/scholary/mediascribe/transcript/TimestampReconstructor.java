package com.scholary.mediascribe.transcript;

import com.scholary.mediascribe.config.PipelineProperties;
import com.scholary.mediascribe.whisper.TranscriptSegment;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Merges per-window transcription output into one transcript on a single time axis.
 *
 * <p>Paragraph markers are synthetic: words are regrouped into fixed-size paragraphs and each
 * paragraph gets a marker that advances by a fixed step. A window's clock starts at its own offset
 * or where the previous window left off, whichever is later, so markers never decrease.
 */
@Component
public class TimestampReconstructor {

  private static final Logger LOGGER = LoggerFactory.getLogger(TimestampReconstructor.class);

  private final int windowSeconds;
  private final int stepSeconds;
  private final int wordsPerParagraph;

  @Autowired
  public TimestampReconstructor(PipelineProperties properties) {
    this(properties.windowSeconds(), properties.stepSeconds(), properties.wordsPerParagraph());
  }

  TimestampReconstructor(int windowSeconds, int stepSeconds, int wordsPerParagraph) {
    if (windowSeconds <= 0 || stepSeconds <= 0 || wordsPerParagraph <= 0) {
      throw new IllegalArgumentException("Window, step and paragraph size must be positive");
    }
    this.windowSeconds = windowSeconds;
    this.stepSeconds = stepSeconds;
    this.wordsPerParagraph = wordsPerParagraph;
  }

  /**
   * Shift every window's segments onto the global axis and order them.
   *
   * @param windows windows in any order
   * @return absolute segments sorted by start time
   */
  public List<TranscriptSegment> shift(List<WindowTranscript> windows) {
    return windows.stream()
        .sorted(Comparator.comparingInt(WindowTranscript::windowIndex))
        .flatMap(w -> w.absoluteSegments().stream())
        .sorted(Comparator.comparingDouble(TranscriptSegment::start))
        .toList();
  }

  /**
   * Build the raw transcript text.
   *
   * @param windows windows in any order
   * @return paragraphs of the form {@code [HH:MM:SS] text} separated by blank lines
   */
  public String reconstruct(List<WindowTranscript> windows) {
    List<WindowTranscript> ordered =
        windows.stream().sorted(Comparator.comparingInt(WindowTranscript::windowIndex)).toList();

    StringBuilder out = new StringBuilder();
    long clock = 0;
    int paragraphs = 0;

    for (WindowTranscript window : ordered) {
      clock = Math.max(clock, (long) window.windowIndex() * windowSeconds);

      if (window.hasTiming()) {
        List<String> words = words(window.segments());
        for (int i = 0; i < words.size(); i += wordsPerParagraph) {
          int end = Math.min(i + wordsPerParagraph, words.size());
          String group = String.join(" ", words.subList(i, end));
          appendParagraph(out, clock, group);
          clock += stepSeconds;
          paragraphs++;
        }
      } else if (!window.text().isBlank()) {
        // Blank lines in the text would start paragraphs without a marker.
        appendParagraph(out, clock, window.text().trim().replaceAll("\\s+", " "));
        clock += stepSeconds;
        paragraphs++;
      } else {
        LOGGER.debug("Window {} produced no text", window.windowIndex());
      }
    }

    LOGGER.info("Reconstructed transcript: windows={}, paragraphs={}", ordered.size(), paragraphs);
    return out.toString().trim();
  }

  private static List<String> words(List<TranscriptSegment> segments) {
    List<String> words = new ArrayList<>();
    for (TranscriptSegment segment : segments) {
      if (segment.text() == null) {
        continue;
      }
      for (String word : segment.text().trim().split("\\s+")) {
        if (!word.isEmpty()) {
          words.add(word);
        }
      }
    }
    return words;
  }

  private static void appendParagraph(StringBuilder out, long seconds, String text) {
    out.append(TimestampFormat.format(seconds)).append(' ').append(text).append("\n\n");
  }
}
