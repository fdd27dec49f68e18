package com.scholary.mediascribe.acquisition;

import com.scholary.mediascribe.config.PipelineProperties;
import com.scholary.mediascribe.progress.ProgressReporter;
import com.scholary.mediascribe.relay.RelayCorrelator;
import com.scholary.mediascribe.relay.RelayMessage;
import com.scholary.mediascribe.relay.RelayProperties;
import com.scholary.mediascribe.relay.SecondaryAccountClient;
import com.scholary.mediascribe.relay.SecondaryAccountException;
import com.scholary.mediascribe.telegram.TelegramApiException;
import com.scholary.mediascribe.telegram.TelegramBotClient;
import com.scholary.mediascribe.telegram.TelegramProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Brings the media of a request to local disk, whatever route it arrived on.
 *
 * <p>Bot API files at or above the direct download limit, or that the Bot API refuses as too big,
 * are rerouted to the relay. Forwarded messages fall back to the bot's own copy of the file when
 * the secondary account cannot read the origin.
 */
@Component
public class MediaSourceResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(MediaSourceResolver.class);

  private final TelegramBotClient bot;
  private final TelegramProperties telegramProperties;
  private final UrlRouter urlRouter;
  private final UrlDownloader urlDownloader;
  private final RelayCorrelator relayCorrelator;
  private final SecondaryAccountClient secondary;
  private final RelayProperties relayProperties;
  private final Path workDir;

  @Autowired
  public MediaSourceResolver(
      TelegramBotClient bot,
      TelegramProperties telegramProperties,
      UrlRouter urlRouter,
      UrlDownloader urlDownloader,
      RelayCorrelator relayCorrelator,
      SecondaryAccountClient secondary,
      RelayProperties relayProperties,
      PipelineProperties pipelineProperties) {
    this(
        bot,
        telegramProperties,
        urlRouter,
        urlDownloader,
        relayCorrelator,
        secondary,
        relayProperties,
        Path.of(pipelineProperties.workDir()));
  }

  MediaSourceResolver(
      TelegramBotClient bot,
      TelegramProperties telegramProperties,
      UrlRouter urlRouter,
      UrlDownloader urlDownloader,
      RelayCorrelator relayCorrelator,
      SecondaryAccountClient secondary,
      RelayProperties relayProperties,
      Path workDir) {
    this.bot = bot;
    this.telegramProperties = telegramProperties;
    this.urlRouter = urlRouter;
    this.urlDownloader = urlDownloader;
    this.relayCorrelator = relayCorrelator;
    this.secondary = secondary;
    this.relayProperties = relayProperties;
    this.workDir = workDir;
  }

  /**
   * Resolve a request to a local, non-empty media file.
   *
   * @throws AcquisitionException if the media cannot be obtained
   */
  public Path resolve(MediaRequest request, ProgressReporter progress) {
    LOGGER.info(
        "Resolving media: requester={}, route={}, source={}",
        request.requesterId(),
        request.route(),
        request.sourceName());

    Path file;
    switch (request.route()) {
      case DIRECT:
        file = resolveDirect(request, progress);
        break;
      case FORWARDED:
        file = resolveForwarded(request, progress);
        break;
      case URL:
        progress.update("Downloading media from link...");
        file = urlDownloader.download(urlRouter.route(request.url()));
        break;
      case RELAY:
        progress.update("Large file, fetching it through the relay...");
        file = relayCorrelator.acquire(request, progress.statusMessageId());
        break;
      default:
        throw new AcquisitionException("Unknown route " + request.route());
    }

    requireNonEmpty(file);
    return file;
  }

  /**
   * Whether the request can only be served through the relay, judging by its declared size.
   * Callers can then wait for the relay without holding a pipeline thread.
   */
  public boolean needsRelay(MediaRequest request) {
    switch (request.route()) {
      case RELAY:
        return true;
      case DIRECT:
        return request.localFile() == null
            && request.fileId() != null
            && isAboveDirectLimit(request);
      default:
        return false;
    }
  }

  private boolean isAboveDirectLimit(MediaRequest request) {
    return request.sizeBytes() >= telegramProperties.directDownloadLimitBytes();
  }

  private Path resolveDirect(MediaRequest request, ProgressReporter progress) {
    if (request.localFile() != null) {
      return request.localFile();
    }
    if (request.fileId() == null) {
      throw new AcquisitionException("Request carries no media");
    }
    if (isAboveDirectLimit(request)) {
      LOGGER.info(
          "File above direct download limit, relaying: bytes={}, limit={}",
          request.sizeBytes(),
          telegramProperties.directDownloadLimitBytes());
      return resolve(request.withRoute(AcquisitionRoute.RELAY), progress);
    }

    progress.update("Downloading file...");
    try {
      String filePath = bot.getFilePath(request.fileId());
      String suffix = filePath.substring(filePath.lastIndexOf('/') + 1);
      Path target = workDir.resolve("telegram_" + request.messageId() + "_" + suffix);
      Files.createDirectories(workDir);
      bot.downloadFile(filePath, target);
      return target;
    } catch (TelegramApiException e) {
      if (isFileTooBig(e) && request.hasChat()) {
        LOGGER.info("Bot API refused file as too big, relaying: {}", e.getMessage());
        return resolve(request.withRoute(AcquisitionRoute.RELAY), progress);
      }
      throw new AcquisitionException("Failed to download file: " + e.getMessage(), e);
    } catch (IOException e) {
      throw new AcquisitionException("Cannot create work directory " + workDir, e);
    }
  }

  private Path resolveForwarded(MediaRequest request, ProgressReporter progress) {
    if (request.originChatId() != null
        && request.originMessageId() != null
        && secondary.isAuthorized()) {
      progress.update("Fetching the original of the forwarded message...");
      try {
        Optional<Path> fetched = fetchOrigin(request.originChatId(), request.originMessageId());
        if (fetched.isPresent()) {
          return fetched.get();
        }
        LOGGER.info(
            "Forward origin not readable: chat={}, message={}",
            request.originChatId(),
            request.originMessageId());
      } catch (SecondaryAccountException e) {
        LOGGER.warn("Forward origin fetch failed: {}", e.getMessage());
      }
    }

    if (request.fileId() != null) {
      return resolve(request.withRoute(AcquisitionRoute.DIRECT), progress);
    }
    throw new AcquisitionException("Cannot fetch the media of the forwarded message");
  }

  private Optional<Path> fetchOrigin(long chatId, long messageId) {
    Optional<RelayMessage> origin =
        secondary.getMessage(chatId, messageId).filter(RelayMessage::hasMedia);
    if (origin.isEmpty()) {
      origin =
          secondary.getRecentMessages(chatId, relayProperties.scanDepth()).stream()
              .filter(m -> m.id() == messageId && m.hasMedia())
              .findFirst();
    }
    if (origin.isEmpty()) {
      return Optional.empty();
    }

    String name = "forwarded_" + Math.abs(chatId) + "_" + messageId + extension(origin.get());
    Path target = workDir.resolve(name);
    secondary.downloadMedia(chatId, origin.get(), target);
    return Optional.of(target);
  }

  private static String extension(RelayMessage message) {
    String name = message.fileName();
    if (name == null) {
      return ".mp4";
    }
    int dot = name.lastIndexOf('.');
    return dot >= 0 ? name.substring(dot).toLowerCase(Locale.ROOT) : ".mp4";
  }

  private static boolean isFileTooBig(TelegramApiException e) {
    String message = e.getMessage();
    return message != null && message.toLowerCase(Locale.ROOT).contains("file is too big");
  }

  private static void requireNonEmpty(Path file) {
    try {
      if (file == null || !Files.isRegularFile(file)) {
        throw new AcquisitionException("Media file does not exist: " + file);
      }
      if (Files.size(file) == 0) {
        throw new AcquisitionException("Media file is empty: " + file);
      }
    } catch (IOException e) {
      throw new AcquisitionException("Cannot read media file " + file, e);
    }
  }
}
