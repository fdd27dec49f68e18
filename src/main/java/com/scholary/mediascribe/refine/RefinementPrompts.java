package com.scholary.mediascribe.refine;

import com.scholary.mediascribe.llm.ChatMessage;
import java.util.List;

/** Prompts for the transcript formatting pass. */
final class RefinementPrompts {

  private static final String SYSTEM =
      "You are an editor who turns raw speech-to-text output into readable text. "
          + "Add punctuation, capitalization and paragraph breaks, and fix obvious recognition "
          + "errors. Do not summarize, shorten, translate or add commentary. Keep the original "
          + "language. Every timestamp marker of the form [HH:MM:SS] must be kept exactly as "
          + "written, in the same order, at the start of the paragraph it belongs to.";

  private RefinementPrompts() {}

  static List<ChatMessage> formatChunk(String chunk, int index, int total) {
    String user =
        String.format(
            "Format part %d of %d of a transcript. Return only the formatted text.%n%n%s",
            index + 1, total, chunk);
    return List.of(ChatMessage.system(SYSTEM), ChatMessage.user(user));
  }
}
