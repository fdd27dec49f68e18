package com.scholary.mediascribe.refine;

import com.scholary.mediascribe.transcript.TimestampFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Splits long text into chunks of bounded size for LLM calls.
 *
 * <p>In hard mode every chunk except the last is exactly {@code maxChars} long. In boundary-aware
 * mode a chunk ends at the last paragraph break (or failing that, whitespace) in the second half
 * of its window, and never inside a {@code [HH:MM:SS]} marker.
 */
public final class TextChunker {

  private static final String PARAGRAPH_BREAK = "\n\n";

  private final int maxChars;
  private final boolean boundaryAware;

  public TextChunker(int maxChars, boolean boundaryAware) {
    if (maxChars <= 0) {
      throw new IllegalArgumentException("Chunk size must be positive");
    }
    this.maxChars = maxChars;
    this.boundaryAware = boundaryAware;
  }

  public int maxChars() {
    return maxChars;
  }

  /**
   * Split a text. Concatenating the result reproduces the input exactly.
   *
   * @param text the text
   * @return chunks in order; empty for empty input
   */
  public List<String> split(String text) {
    List<String> chunks = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return chunks;
    }

    int start = 0;
    while (start < text.length()) {
      int end = Math.min(start + maxChars, text.length());
      if (boundaryAware && end < text.length()) {
        end = boundaryBefore(text, start, end);
      }
      chunks.add(text.substring(start, end));
      start = end;
    }
    return chunks;
  }

  private int boundaryBefore(String text, int start, int end) {
    int floor = start + maxChars / 2;

    int cut = text.lastIndexOf(PARAGRAPH_BREAK, end - PARAGRAPH_BREAK.length());
    if (cut >= floor) {
      return cut + PARAGRAPH_BREAK.length();
    }

    int candidate = end;
    for (int i = end - 1; i >= floor; i--) {
      if (Character.isWhitespace(text.charAt(i))) {
        candidate = i + 1;
        break;
      }
    }
    return avoidMarker(text, start, candidate);
  }

  private static int avoidMarker(String text, int start, int cut) {
    int from = Math.max(start, cut - 16);
    Matcher matcher = TimestampFormat.MARKER.matcher(text);
    matcher.region(from, Math.min(text.length(), cut + 16));
    while (matcher.find()) {
      if (matcher.start() < cut && matcher.end() > cut && matcher.start() > start) {
        return matcher.start();
      }
    }
    return cut;
  }
}
