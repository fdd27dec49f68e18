package com.scholary.mediascribe.transcript;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Formatting and parsing of {@code [HH:MM:SS]} paragraph markers. */
public final class TimestampFormat {

  public static final Pattern MARKER = Pattern.compile("\\[(\\d{2,}):([0-5]\\d):([0-5]\\d)]");

  private TimestampFormat() {}

  /**
   * Format whole seconds as a zero-padded marker.
   *
   * @param totalSeconds seconds from the start of the recording, not negative
   * @return the marker, for example {@code [01:02:03]}
   */
  public static String format(long totalSeconds) {
    if (totalSeconds < 0) {
      throw new IllegalArgumentException("Timestamp cannot be negative");
    }
    long hours = totalSeconds / 3600;
    long minutes = (totalSeconds % 3600) / 60;
    long seconds = totalSeconds % 60;
    return String.format("[%02d:%02d:%02d]", hours, minutes, seconds);
  }

  /**
   * All markers in a text, in order of appearance, as seconds.
   *
   * @param text any text
   * @return marker values in seconds
   */
  public static List<Long> markers(String text) {
    List<Long> values = new ArrayList<>();
    Matcher matcher = MARKER.matcher(text);
    while (matcher.find()) {
      long hours = Long.parseLong(matcher.group(1));
      long minutes = Long.parseLong(matcher.group(2));
      long seconds = Long.parseLong(matcher.group(3));
      values.add(hours * 3600 + minutes * 60 + seconds);
    }
    return values;
  }

  /** Number of markers in a text. */
  public static int count(String text) {
    int count = 0;
    Matcher matcher = MARKER.matcher(text);
    while (matcher.find()) {
      count++;
    }
    return count;
  }
}
