package com.scholary.mediascribe.relay;

import static com.scholary.mediascribe.relay.RelayFixtures.RELAY_CHAT;
import static com.scholary.mediascribe.relay.RelayFixtures.media;
import static com.scholary.mediascribe.relay.RelayFixtures.properties;
import static com.scholary.mediascribe.relay.RelayFixtures.relayRequest;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.mediascribe.acquisition.AcquisitionException;
import com.scholary.mediascribe.store.CaffeineKeyValueStore;
import com.scholary.mediascribe.telegram.TelegramApiException;
import com.scholary.mediascribe.telegram.TelegramBotClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

/** Tests for RelayCorrelator copy, direct fetch, delivery and timeout handling. */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RelayCorrelatorTest {

  @Mock private TelegramBotClient bot;
  @Mock private SecondaryAccountClient secondary;

  @TempDir Path workDir;

  private RelayCorrelator correlator;

  @BeforeEach
  void setUp() {
    correlator = newCorrelator(true);
    when(secondary.isAuthorized()).thenReturn(true);
    doAnswer(
            invocation -> {
              Path target = invocation.getArgument(2);
              Files.write(target, new byte[] {1, 2, 3});
              return null;
            })
        .when(secondary)
        .downloadMedia(anyLong(), any(RelayMessage.class), any(Path.class));
  }

  @Test
  void acquire_shouldReturnFileFoundByDirectFetch() {
    when(bot.copyMessage(RELAY_CHAT, 111, 222, "#user_111_222")).thenReturn(900L);
    when(secondary.getMessage(RELAY_CHAT, 900))
        .thenReturn(Optional.of(media(900, "#user_111_222")));

    Path file = correlator.acquire(relayRequest(111, 222), 5L);

    assertThat(file).isEqualTo(workDir.resolve("telegram_video_222.mp4"));
    assertThat(file).exists();
    verify(bot).sendMessage(eq(111L), anyString());
  }

  @Test
  void acquire_shouldFailFastWhenRelayIsDisabled() {
    correlator = newCorrelator(false);

    assertThatThrownBy(() -> correlator.acquire(relayRequest(111, 222), null))
        .isInstanceOf(AcquisitionException.class)
        .hasMessageContaining("unavailable");
    verify(bot, never()).copyMessage(anyLong(), anyLong(), anyLong(), anyString());
  }

  @Test
  void acquire_shouldFailFastWhenMonitorCircuitIsOpen() {
    correlator.setMonitorAvailable(false);

    assertThat(correlator.isAvailable()).isFalse();
    assertThatThrownBy(() -> correlator.acquire(relayRequest(111, 222), null))
        .isInstanceOf(AcquisitionException.class);
  }

  @Test
  void relay_shouldFailWhenCopyIsRejected() {
    when(bot.copyMessage(anyLong(), anyLong(), anyLong(), anyString()))
        .thenThrow(new TelegramApiException(400, "message to copy not found"));

    assertThatThrownBy(() -> correlator.relay(relayRequest(111, 222), null))
        .isInstanceOf(AcquisitionException.class)
        .hasMessageContaining("message to copy not found");
  }

  @Test
  void relay_shouldLeaveFutureOpenForMonitorWhenDirectFetchFindsNothing() throws Exception {
    when(bot.copyMessage(anyLong(), anyLong(), anyLong(), anyString())).thenReturn(900L);
    when(secondary.getMessage(RELAY_CHAT, 900)).thenReturn(Optional.empty());
    when(secondary.getRecentMessages(eq(RELAY_CHAT), anyInt())).thenReturn(List.of());

    CompletableFuture<Path> future = correlator.relay(relayRequest(111, 222), null);

    assertThat(future).isNotDone();
    verify(secondary, times(2)).getMessage(RELAY_CHAT, 900);

    Optional<RelayDelivery> delivery =
        correlator.deliver(media(900, "#user_111_222"), new RelayTag(111, 222));

    assertThat(delivery).hasValueSatisfying(d -> assertThat(d.awaited()).isTrue());
    assertThat(future.get()).isEqualTo(workDir.resolve("telegram_video_222.mp4"));
  }

  @Test
  void deliver_shouldHandEachCopyOutOnlyOnce() {
    RelayTag origin = new RelayTag(111, 222);

    Optional<RelayDelivery> first = correlator.deliver(media(900, "#user_111_222"), origin);
    Optional<RelayDelivery> second = correlator.deliver(media(900, "#user_111_222"), origin);

    assertThat(first).hasValueSatisfying(d -> assertThat(d.awaited()).isFalse());
    assertThat(second).isEmpty();
    verify(secondary, times(1)).downloadMedia(anyLong(), any(RelayMessage.class), any(Path.class));
  }

  @Test
  void deliver_shouldFailWaitingRequestWhenDownloadFails() {
    when(bot.copyMessage(anyLong(), anyLong(), anyLong(), anyString())).thenReturn(900L);
    when(secondary.getMessage(RELAY_CHAT, 900)).thenReturn(Optional.empty());
    when(secondary.getRecentMessages(eq(RELAY_CHAT), anyInt())).thenReturn(List.of());
    doThrow(new SecondaryAccountException("flood wait"))
        .when(secondary)
        .downloadMedia(anyLong(), any(RelayMessage.class), any(Path.class));
    RelayTag origin = new RelayTag(111, 222);
    CompletableFuture<Path> future = correlator.relay(relayRequest(111, 222), null);

    correlator.deliver(media(900, "#user_111_222"), origin);

    assertThatThrownBy(() -> correlator.awaitRelayed(origin, future, Duration.ofSeconds(1)))
        .isInstanceOf(AcquisitionException.class)
        .hasMessageContaining("flood wait");
  }

  @Test
  void awaitRelayed_shouldTimeOutAndDropCorrelation() {
    when(bot.copyMessage(anyLong(), anyLong(), anyLong(), anyString())).thenReturn(900L);
    when(secondary.getMessage(RELAY_CHAT, 900)).thenReturn(Optional.empty());
    when(secondary.getRecentMessages(eq(RELAY_CHAT), anyInt())).thenReturn(List.of());
    RelayTag origin = new RelayTag(111, 222);
    CompletableFuture<Path> future = correlator.relay(relayRequest(111, 222), null);

    assertThatThrownBy(() -> correlator.awaitRelayed(origin, future, Duration.ofMillis(50)))
        .isInstanceOf(AcquisitionException.class)
        .hasMessageContaining("timed out");

    // A late copy is now an orphan.
    Optional<RelayDelivery> late = correlator.deliver(media(900, "#user_111_222"), origin);
    assertThat(late).hasValueSatisfying(d -> assertThat(d.awaited()).isFalse());
    assertThat(future).isNotDone();
  }

  @Test
  void acquireAsync_shouldReturnBeforeFileArrives() throws Exception {
    when(bot.copyMessage(anyLong(), anyLong(), anyLong(), anyString())).thenReturn(900L);
    when(secondary.getMessage(RELAY_CHAT, 900)).thenReturn(Optional.empty());
    when(secondary.getRecentMessages(eq(RELAY_CHAT), anyInt())).thenReturn(List.of());

    CompletableFuture<Path> file = correlator.acquireAsync(relayRequest(111, 222), 5L);

    assertThat(file).isNotDone();
    correlator.deliver(media(900, "#user_111_222"), new RelayTag(111, 222));
    assertThat(file.get(5, TimeUnit.SECONDS))
        .isEqualTo(workDir.resolve("telegram_video_222.mp4"));
  }

  @Test
  void acquireAsync_shouldTimeOutAndDropCorrelation() {
    when(bot.copyMessage(anyLong(), anyLong(), anyLong(), anyString())).thenReturn(900L);
    when(secondary.getMessage(RELAY_CHAT, 900)).thenReturn(Optional.empty());
    when(secondary.getRecentMessages(eq(RELAY_CHAT), anyInt())).thenReturn(List.of());
    RelayTag origin = new RelayTag(111, 222);

    CompletableFuture<Path> file =
        correlator.acquireAsync(relayRequest(111, 222), null, Duration.ofMillis(50));

    assertThatThrownBy(() -> file.get(5, TimeUnit.SECONDS))
        .isInstanceOf(ExecutionException.class)
        .hasCauseInstanceOf(AcquisitionException.class)
        .hasMessageContaining("timed out");
    Optional<RelayDelivery> late = correlator.deliver(media(900, "#user_111_222"), origin);
    assertThat(late).hasValueSatisfying(d -> assertThat(d.awaited()).isFalse());
  }

  @Test
  void acquireAsync_shouldFailFastWhenRelayIsDisabled() {
    correlator = newCorrelator(false);

    assertThatThrownBy(() -> correlator.acquireAsync(relayRequest(111, 222), null))
        .isInstanceOf(AcquisitionException.class)
        .hasMessageContaining("unavailable");
    verify(bot, never()).copyMessage(anyLong(), anyLong(), anyLong(), anyString());
  }

  private RelayCorrelator newCorrelator(boolean enabled) {
    return new RelayCorrelator(
        bot,
        secondary,
        properties(enabled),
        workDir,
        new CaffeineKeyValueStore<>("tokens", 100, Duration.ofMinutes(5)),
        new CaffeineKeyValueStore<>("delivered", 100, Duration.ofMinutes(5)));
  }
}
