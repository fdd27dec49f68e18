package com.scholary.mediascribe.telegram;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ChannelProgressReporterTest {

  @Mock private TelegramBotClient bot;

  @Test
  void update_shouldEditStatusMessageOncePerDistinctStatus() {
    ChannelProgressReporter reporter = new ChannelProgressReporter(bot, 42, 7);

    reporter.update("Extracting audio...");
    reporter.update("Extracting audio...");
    reporter.update("Transcribing part 1 of 2...");

    verify(bot, times(1)).editMessageText(42, 7, "Extracting audio...");
    verify(bot, times(1)).editMessageText(42, 7, "Transcribing part 1 of 2...");
    assertThat(reporter.statusMessageId()).isEqualTo(7L);
  }

  @Test
  void update_shouldSwallowTelegramErrorsAndRetryNextTime() {
    ChannelProgressReporter reporter = new ChannelProgressReporter(bot, 42, 7);
    doThrow(new TelegramApiException(429, "Too Many Requests"))
        .doNothing()
        .when(bot)
        .editMessageText(anyLong(), anyLong(), anyString());

    reporter.update("Downloading file...");
    reporter.update("Downloading file...");

    verify(bot, times(2)).editMessageText(42, 7, "Downloading file...");
  }
}
