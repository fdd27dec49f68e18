package com.scholary.mediascribe.relay;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identifies the requester's original message inside a relayed copy.
 *
 * <p>Carried as the copy's caption, {@code #user_<chatId>_<messageId>}. Group and channel chat ids
 * are negative.
 */
public record RelayTag(long chatId, long messageId) {

  private static final Pattern TAG = Pattern.compile("^\\s*#user_(-?\\d+)_(\\d+)\\b");

  public String format() {
    return "#user_" + chatId + "_" + messageId;
  }

  /**
   * Read the tag from a caption.
   *
   * @return empty if the caption does not start with a well-formed tag
   */
  public static Optional<RelayTag> parse(String caption) {
    if (caption == null) {
      return Optional.empty();
    }
    Matcher matcher = TAG.matcher(caption);
    if (!matcher.find()) {
      return Optional.empty();
    }
    try {
      return Optional.of(
          new RelayTag(Long.parseLong(matcher.group(1)), Long.parseLong(matcher.group(2))));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }
}
