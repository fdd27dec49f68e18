package com.scholary.mediascribe.relay;

import static com.scholary.mediascribe.relay.RelayFixtures.RELAY_CHAT;
import static com.scholary.mediascribe.relay.RelayFixtures.media;
import static com.scholary.mediascribe.relay.RelayFixtures.properties;
import static com.scholary.mediascribe.relay.RelayFixtures.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.mediascribe.store.CaffeineKeyValueStore;
import com.scholary.mediascribe.telegram.TelegramBotClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/** Tests for RelayMonitor polling and orphan handling. */
@ExtendWith(MockitoExtension.class)
class RelayMonitorTest {

  @Mock private TelegramBotClient bot;
  @Mock private SecondaryAccountClient secondary;
  @Mock private RelayedMediaHandler orphanHandler;

  @TempDir Path workDir;

  private RelayMonitor monitor;

  @BeforeEach
  void setUp() {
    RelayCorrelator correlator =
        new RelayCorrelator(
            bot,
            secondary,
            properties(true),
            workDir,
            new CaffeineKeyValueStore<>("tokens", 100, Duration.ofMinutes(5)),
            new CaffeineKeyValueStore<>("delivered", 100, Duration.ofMinutes(5)));
    monitor = new RelayMonitor(secondary, correlator, orphanHandler, properties(true));
  }

  @Test
  void pollOnce_shouldDeliverTaggedCopyToPathOfOriginalMessage() throws Exception {
    stubDownload();
    when(secondary.getRecentMessages(RELAY_CHAT, 10))
        .thenReturn(List.of(media(900, "#user_111_222")));

    int delivered = monitor.pollOnce();

    assertThat(delivered).isEqualTo(1);
    Path expected = workDir.resolve("telegram_video_222.mp4");
    assertThat(Files.size(expected)).isPositive();
    verify(orphanHandler).handleRelayed(new RelayTag(111, 222), expected);
  }

  @Test
  void pollOnce_shouldAdvanceMarkPastUntaggedAndTextMessages() {
    when(secondary.getRecentMessages(RELAY_CHAT, 10))
        .thenReturn(List.of(text(905, "#user_1_2"), media(903, "no tag here"), text(901, null)));

    assertThat(monitor.pollOnce()).isZero();
    assertThat(monitor.highWaterMark()).isEqualTo(905);
    verify(secondary, never()).downloadMedia(anyLong(), any(), any());
  }

  @Test
  void pollOnce_shouldAskOnlyForMessagesAfterMark() {
    when(secondary.getRecentMessages(RELAY_CHAT, 10)).thenReturn(List.of(text(50, null)));
    when(secondary.getMessagesAfter(RELAY_CHAT, 50, 10))
        .thenReturn(List.of(text(49, null), text(52, null), text(51, null)));

    monitor.pollOnce();
    monitor.pollOnce();

    assertThat(monitor.highWaterMark()).isEqualTo(52);
  }

  @Test
  void pollOnce_shouldNotDeliverSameCopyTwice() throws Exception {
    stubDownload();
    when(secondary.getRecentMessages(RELAY_CHAT, 10))
        .thenReturn(List.of(media(900, "#user_111_222")));
    when(secondary.getMessagesAfter(RELAY_CHAT, 900, 10))
        .thenReturn(List.of(media(900, "#user_111_222")));

    assertThat(monitor.pollOnce()).isEqualTo(1);
    assertThat(monitor.pollOnce()).isZero();
  }

  @Test
  void pollOnce_shouldSurfaceReadFailureAsMonitorFault() {
    when(secondary.getRecentMessages(RELAY_CHAT, 10))
        .thenThrow(new SecondaryAccountException("session revoked"));

    assertThatThrownBy(() -> monitor.pollOnce())
        .isInstanceOf(RelayMonitorException.class)
        .hasMessageContaining("session revoked");
  }

  private void stubDownload() {
    doAnswer(
            invocation -> {
              Path target = invocation.getArgument(2);
              Files.write(target, new byte[] {9, 9});
              return null;
            })
        .when(secondary)
        .downloadMedia(anyLong(), any(RelayMessage.class), any(Path.class));
  }
}
