package com.scholary.mediascribe.relay;

import com.scholary.mediascribe.acquisition.AcquisitionException;
import com.scholary.mediascribe.acquisition.MediaRequest;
import com.scholary.mediascribe.config.PipelineProperties;
import com.scholary.mediascribe.logging.StructuredLogger;
import com.scholary.mediascribe.store.CaffeineKeyValueStore;
import com.scholary.mediascribe.store.KeyValueStore;
import com.scholary.mediascribe.telegram.TelegramApiException;
import com.scholary.mediascribe.telegram.TelegramBotClient;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Gets files above the Bot API download limit to disk through the secondary account.
 *
 * <p>The bot copies the requester's message into the relay chat with a {@link RelayTag} caption.
 * The secondary account, which can download files of any size, then picks the copy up: first
 * through a short direct fetch by the copy's id, otherwise through the {@link RelayMonitor}. Each
 * copy is delivered at most once; the file always lands at the path keyed by the original message
 * id.
 */
@Component
public class RelayCorrelator {

  private static final Logger LOGGER = LoggerFactory.getLogger(RelayCorrelator.class);

  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);
  private final TelegramBotClient bot;
  private final SecondaryAccountClient secondary;
  private final RelayProperties properties;
  private final Path workDir;
  private final KeyValueStore<RelayTag, RelayCorrelationToken> tokens;
  private final KeyValueStore<Long, Instant> deliveredCopies;
  private final Map<RelayTag, CompletableFuture<Path>> pending = new ConcurrentHashMap<>();
  private volatile boolean monitorAvailable = true;

  @Autowired
  public RelayCorrelator(
      TelegramBotClient bot,
      SecondaryAccountClient secondary,
      RelayProperties properties,
      PipelineProperties pipelineProperties) {
    this(
        bot,
        secondary,
        properties,
        Path.of(pipelineProperties.workDir()),
        new CaffeineKeyValueStore<>(
            "relay-tokens",
            10_000,
            Duration.ofMinutes(properties.correlationTimeoutMinutes())),
        new CaffeineKeyValueStore<>("relay-delivered", 10_000, Duration.ofHours(24)));
  }

  RelayCorrelator(
      TelegramBotClient bot,
      SecondaryAccountClient secondary,
      RelayProperties properties,
      Path workDir,
      KeyValueStore<RelayTag, RelayCorrelationToken> tokens,
      KeyValueStore<Long, Instant> deliveredCopies) {
    this.bot = bot;
    this.secondary = secondary;
    this.properties = properties;
    this.workDir = workDir;
    this.tokens = tokens;
    this.deliveredCopies = deliveredCopies;
  }

  /** Whether relayed requests can currently be served. */
  public boolean isAvailable() {
    return properties.enabled() && monitorAvailable && secondary.isAuthorized();
  }

  /** Called by the monitor supervisor when its circuit breaker opens or closes. */
  public void setMonitorAvailable(boolean available) {
    this.monitorAvailable = available;
  }

  /**
   * Relay a request and wait for the file.
   *
   * @param progressMessageId status message in the requester's chat, or null
   * @return the downloaded file
   * @throws AcquisitionException if the relay is unavailable, the copy fails, or the file does not
   *     arrive within the correlation timeout
   */
  public Path acquire(MediaRequest request, Long progressMessageId) {
    requireAvailable();
    RelayTag origin = new RelayTag(request.chatId(), request.messageId());
    CompletableFuture<Path> future = relay(request, progressMessageId);
    return awaitRelayed(origin, future, correlationTimeout());
  }

  /**
   * Relay a request without waiting for the file. Only the copy and the short direct fetch run on
   * the calling thread.
   *
   * @return completes with the downloaded file, or exceptionally with {@link AcquisitionException}
   *     once the correlation timeout passes
   * @throws AcquisitionException if the relay is unavailable or the copy fails
   */
  public CompletableFuture<Path> acquireAsync(MediaRequest request, Long progressMessageId) {
    return acquireAsync(request, progressMessageId, correlationTimeout());
  }

  CompletableFuture<Path> acquireAsync(
      MediaRequest request, Long progressMessageId, Duration timeout) {
    requireAvailable();
    RelayTag origin = new RelayTag(request.chatId(), request.messageId());
    CompletableFuture<Path> future = relay(request, progressMessageId);
    return future
        .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
        .handle(
            (file, error) -> {
              if (error == null) {
                return file;
              }
              Throwable cause =
                  error instanceof CompletionException && error.getCause() != null
                      ? error.getCause()
                      : error;
              if (cause instanceof TimeoutException) {
                throw timedOut(origin, future, timeout);
              }
              if (cause instanceof AcquisitionException) {
                throw (AcquisitionException) cause;
              }
              throw new AcquisitionException("Relay failed: " + cause.getMessage(), cause);
            });
  }

  /**
   * Copy the requester's message into the relay chat and start looking for the copy.
   *
   * @return completes with the downloaded file, or exceptionally with {@link AcquisitionException}
   */
  public CompletableFuture<Path> relay(MediaRequest request, Long progressMessageId) {
    if (!request.hasChat()) {
      throw new AcquisitionException("Only chat messages can be relayed");
    }
    RelayTag origin = new RelayTag(request.chatId(), request.messageId());

    // Registered before the copy exists so the monitor can never see an unclaimed copy.
    CompletableFuture<Path> future = new CompletableFuture<>();
    pending.put(origin, future);

    long copyId;
    try {
      copyId =
          bot.copyMessage(
              properties.chatId(), request.chatId(), request.messageId(), origin.format());
    } catch (TelegramApiException e) {
      pending.remove(origin, future);
      throw new AcquisitionException("Failed to copy message to relay chat: " + e.getMessage(), e);
    }

    tokens.put(
        origin,
        new RelayCorrelationToken(
            origin, copyId, progressMessageId, request.requesterId(), Instant.now()));
    LOGGER.info("Relayed message: origin={}, copy={}", origin.format(), copyId);

    directFetch(origin, copyId, future);
    return future;
  }

  /**
   * Wait for a relayed file.
   *
   * @throws AcquisitionException on timeout, with the correlation dropped
   */
  public Path awaitRelayed(RelayTag origin, CompletableFuture<Path> future, Duration timeout) {
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      throw timedOut(origin, future, timeout);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      pending.remove(origin, future);
      throw new AcquisitionException("Interrupted while waiting for relay", e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof AcquisitionException) {
        throw (AcquisitionException) e.getCause();
      }
      throw new AcquisitionException("Relay failed: " + e.getCause().getMessage(), e.getCause());
    }
  }

  /**
   * Download a tagged relay message and hand it to whoever waits for it.
   *
   * @return empty if this copy was already delivered
   * @throws AcquisitionException if nobody waits and the download fails
   */
  public Optional<RelayDelivery> deliver(RelayMessage message, RelayTag origin) {
    if (!claim(message.id())) {
      LOGGER.debug("Relay copy already delivered: copy={}", message.id());
      return Optional.empty();
    }
    structuredLogger.logRelayObserved(message.id(), origin.chatId(), origin.messageId());

    Optional<RelayCorrelationToken> token = tokens.remove(origin);
    CompletableFuture<Path> future = pending.remove(origin);
    Path target = relayedPath(origin);

    try {
      secondary.downloadMedia(properties.chatId(), message, target);
      requireNonEmpty(target);
    } catch (SecondaryAccountException | AcquisitionException e) {
      AcquisitionException failure =
          new AcquisitionException("Failed to download relayed file: " + e.getMessage(), e);
      if (future == null) {
        throw failure;
      }
      future.completeExceptionally(failure);
      return Optional.empty();
    }

    notifyReceived(origin, token.isPresent());
    if (future != null && future.complete(target)) {
      return Optional.of(new RelayDelivery(origin, target, true));
    }
    LOGGER.info("Relayed file has no waiting request: origin={}", origin.format());
    return Optional.of(new RelayDelivery(origin, target, false));
  }

  /** Where the relayed file for an original message is written. */
  public Path relayedPath(RelayTag origin) {
    return workDir.resolve("telegram_video_" + origin.messageId() + ".mp4");
  }

  private void directFetch(RelayTag origin, long copyId, CompletableFuture<Path> future) {
    try {
      for (int attempt = 1; attempt <= properties.directFetchAttempts(); attempt++) {
        if (future.isDone()) {
          return;
        }
        Thread.sleep(properties.directFetchDelayMillis());
        Optional<RelayMessage> copy = secondary.getMessage(properties.chatId(), copyId);
        if (copy.isPresent() && copy.get().hasMedia()) {
          deliver(copy.get(), origin);
          return;
        }
        LOGGER.debug("Relay copy not visible yet: copy={}, attempt={}", copyId, attempt);
      }

      if (future.isDone()) {
        return;
      }
      Optional<RelayMessage> scanned =
          secondary.getRecentMessages(properties.chatId(), properties.scanDepth()).stream()
              .filter(m -> m.id() == copyId && m.hasMedia())
              .max(Comparator.comparingLong(RelayMessage::id));
      if (scanned.isPresent()) {
        deliver(scanned.get(), origin);
      } else {
        LOGGER.info("Relay copy not found directly, waiting for monitor: copy={}", copyId);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Direct relay fetch interrupted: copy={}", copyId);
    } catch (SecondaryAccountException e) {
      LOGGER.warn(
          "Direct relay fetch failed, waiting for monitor: copy={}, error={}",
          copyId,
          e.getMessage());
    }
  }

  private void requireAvailable() {
    if (!isAvailable()) {
      throw new AcquisitionException(
          "Relay for large files is unavailable. Send a file under the direct download limit.");
    }
  }

  private Duration correlationTimeout() {
    return Duration.ofMinutes(properties.correlationTimeoutMinutes());
  }

  private AcquisitionException timedOut(
      RelayTag origin, CompletableFuture<Path> future, Duration timeout) {
    // A copy arriving after this is delivered as an orphan.
    pending.remove(origin, future);
    tokens.remove(origin);
    return new AcquisitionException(
        "Relay timed out after " + timeout.toMinutes() + " minutes for " + origin.format());
  }

  private boolean claim(long copyId) {
    boolean[] claimed = {false};
    deliveredCopies.compute(
        copyId,
        (key, existing) -> {
          if (existing == null) {
            claimed[0] = true;
            return Instant.now();
          }
          return existing;
        });
    return claimed[0];
  }

  private void notifyReceived(RelayTag origin, boolean awaited) {
    try {
      bot.sendMessage(
          origin.chatId(),
          awaited ? "File received, starting processing..." : "File received, processing...");
    } catch (TelegramApiException e) {
      LOGGER.warn(
          "Failed to notify requester: chat={}, error={}", origin.chatId(), e.getMessage());
    }
  }

  private static void requireNonEmpty(Path file) {
    try {
      if (!Files.isRegularFile(file) || Files.size(file) == 0) {
        throw new AcquisitionException("Relayed file is missing or empty: " + file);
      }
    } catch (IOException e) {
      throw new AcquisitionException("Cannot read relayed file " + file, e);
    }
  }
}
