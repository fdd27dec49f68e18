package com.scholary.mediascribe.telegram;

import com.scholary.mediascribe.progress.ProgressReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reports progress by editing a status message in the requester's chat. */
public class ChannelProgressReporter implements ProgressReporter {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChannelProgressReporter.class);

  private final TelegramBotClient bot;
  private final long chatId;
  private final long messageId;
  private String lastStatus;

  public ChannelProgressReporter(TelegramBotClient bot, long chatId, long messageId) {
    this.bot = bot;
    this.chatId = chatId;
    this.messageId = messageId;
  }

  @Override
  public Long statusMessageId() {
    return messageId;
  }

  @Override
  public synchronized void update(String status) {
    // Telegram rejects edits that do not change the text.
    if (status == null || status.equals(lastStatus)) {
      return;
    }
    try {
      bot.editMessageText(chatId, messageId, status);
      lastStatus = status;
    } catch (TelegramApiException e) {
      LOGGER.warn(
          "Failed to update status message: chat={}, message={}, error={}",
          chatId,
          messageId,
          e.getMessage());
    }
  }
}
