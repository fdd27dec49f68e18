package com.scholary.mediascribe.summary;

import com.scholary.mediascribe.llm.ChatMessage;
import java.util.List;

/**
 * Prompts for the three summarization stages.
 *
 * <p>The kind only changes the verbosity instruction; the structure is the same for both.
 */
final class SummaryPrompts {

  private static final String SYSTEM =
      "You analyze transcripts of meetings, lectures and conversations. "
          + "Answer in the language of the transcript. Use plain text with short headings.";

  private static final String STRUCTURE =
      "Organize the answer into four sections: 1) main topics discussed, "
          + "2) key points and viewpoints or conclusions, 3) decisions made, "
          + "4) next steps and action items. Omit a section only if nothing applies.";

  private SummaryPrompts() {}

  static List<ChatMessage> intermediate(String chunk, int index, int total, SummaryKind kind) {
    String user =
        String.format(
            "This is part %d of %d of a long transcript. Summarize only this part. %s "
                + "Do not draw final conclusions; they will be made after all parts are read."
                + "%n%n%s",
            index + 1, total, verbosity(kind, true), chunk);
    return List.of(ChatMessage.system(SYSTEM), ChatMessage.user(user));
  }

  static List<ChatMessage> finalSummary(String intermediateSummaries, SummaryKind kind) {
    String user =
        String.format(
            "Below are summaries of consecutive parts of one transcript. Merge them into a single "
                + "summary of the whole transcript, removing repetition. %s %s%n%n%s",
            STRUCTURE, verbosity(kind, false), intermediateSummaries);
    return List.of(ChatMessage.system(SYSTEM), ChatMessage.user(user));
  }

  static List<ChatMessage> direct(String transcript, SummaryKind kind) {
    String user =
        String.format(
            "Summarize the following transcript. %s %s%n%n%s",
            STRUCTURE, verbosity(kind, false), transcript);
    return List.of(ChatMessage.system(SYSTEM), ChatMessage.user(user));
  }

  private static String verbosity(SummaryKind kind, boolean partial) {
    if (kind == SummaryKind.DETAILED) {
      return "Be thorough: keep names, figures, arguments and examples.";
    }
    return partial
        ? "Keep it short: only the essentials."
        : "Keep it short: at most 300 words, only the essentials.";
  }
}
