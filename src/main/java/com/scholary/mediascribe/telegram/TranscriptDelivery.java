package com.scholary.mediascribe.telegram;

import com.scholary.mediascribe.transcript.Transcript;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Sends finished transcripts back to the requester's chat.
 *
 * <p>Short transcripts go out as a message; longer ones as the formatted {@code .txt} file, since
 * Telegram caps message length.
 */
@Component
public class TranscriptDelivery {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptDelivery.class);

  static final String NO_SPEECH = "No speech was recognized in this file.";

  private final TelegramBotClient bot;
  private final TelegramProperties properties;

  public TranscriptDelivery(TelegramBotClient bot, TelegramProperties properties) {
    this.bot = bot;
    this.properties = properties;
  }

  /** Deliver a transcript. Failures are logged; the transcript stays in the result cache. */
  public void deliver(long chatId, Transcript transcript) {
    String text = transcript.formatted().trim();
    try {
      if (text.isEmpty()) {
        bot.sendMessage(chatId, NO_SPEECH);
        return;
      }
      Path file = transcript.formattedPath();
      if (text.length() > properties.longMessageThreshold() && file != null) {
        bot.sendDocument(chatId, file, "Transcript: " + transcript.sourceName());
        LOGGER.info("Delivered transcript as document: chat={}, chars={}", chatId, text.length());
      } else {
        bot.sendMessage(chatId, truncate(text));
        LOGGER.info("Delivered transcript as message: chat={}, chars={}", chatId, text.length());
      }
    } catch (TelegramApiException e) {
      LOGGER.error("Failed to deliver transcript: chat={}, error={}", chatId, e.getMessage());
    }
  }

  /** Tell the requester their request failed. */
  public void deliverFailure(long chatId, String reason) {
    try {
      bot.sendMessage(chatId, "Transcription failed: " + reason);
    } catch (TelegramApiException e) {
      LOGGER.error("Failed to report failure: chat={}, error={}", chatId, e.getMessage());
    }
  }

  private String truncate(String text) {
    int max = properties.longMessageThreshold();
    return text.length() <= max ? text : text.substring(0, max);
  }
}
