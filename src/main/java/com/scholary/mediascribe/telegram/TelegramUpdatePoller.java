package com.scholary.mediascribe.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.scholary.mediascribe.acquisition.AcquisitionRoute;
import com.scholary.mediascribe.acquisition.MediaRequest;
import com.scholary.mediascribe.acquisition.UrlRouter;
import com.scholary.mediascribe.service.TranscriptionJobService;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Long-polls the Bot API and turns incoming media and links into transcription jobs.
 *
 * <p>Enabled only when {@code telegram.polling.enabled=true}.
 */
@Component
@ConditionalOnProperty(name = "telegram.polling.enabled", havingValue = "true")
public class TelegramUpdatePoller {

  private static final Logger LOGGER = LoggerFactory.getLogger(TelegramUpdatePoller.class);
  private static final List<String> MEDIA_FIELDS =
      List.of("video", "audio", "voice", "video_note", "document");

  static final String HINT = "Send a video, an audio file, a voice message or a link to one.";

  private final TelegramBotClient bot;
  private final TelegramProperties properties;
  private final UrlRouter urlRouter;
  private final TranscriptionJobService jobService;
  private final AtomicLong offset = new AtomicLong(0);

  public TelegramUpdatePoller(
      TelegramBotClient bot,
      TelegramProperties properties,
      UrlRouter urlRouter,
      TranscriptionJobService jobService) {
    this.bot = bot;
    this.properties = properties;
    this.urlRouter = urlRouter;
    this.jobService = jobService;
  }

  @Scheduled(fixedDelayString = "${telegram.polling.fixedDelayMillis:1000}")
  public void poll() {
    if (!bot.isConfigured()) {
      LOGGER.warn("telegram.polling.enabled=true but the bot token is empty; polling is skipped");
      return;
    }

    JsonNode updates;
    try {
      updates = bot.getUpdates(offset.get(), properties.polling().timeoutSeconds());
    } catch (TelegramApiException e) {
      LOGGER.warn("Telegram polling failed: {}", e.getMessage());
      return;
    }
    if (!updates.isArray() || updates.isEmpty()) {
      return;
    }

    long maxUpdateId = offset.get() - 1;
    for (JsonNode update : updates) {
      maxUpdateId = Math.max(maxUpdateId, update.path("update_id").asLong(-1));

      JsonNode message = update.path("message");
      if (message.isMissingNode() || message.isNull()) {
        continue;
      }
      try {
        handleMessage(message);
      } catch (RuntimeException e) {
        LOGGER.error(
            "Failed to handle update {}: {}", update.path("update_id").asLong(), e.getMessage(), e);
      }
    }

    // Telegram expects next offset = last_update_id + 1
    offset.set(maxUpdateId + 1);
  }

  private void handleMessage(JsonNode message) {
    Optional<MediaRequest> request = toRequest(message);
    if (request.isPresent()) {
      jobService.submitFromChat(request.get());
      return;
    }
    long chatId = message.path("chat").path("id").asLong();
    bot.sendMessage(chatId, HINT);
  }

  /** Map a message to a request, or empty if it carries neither media nor a link. */
  Optional<MediaRequest> toRequest(JsonNode message) {
    long chatId = message.path("chat").path("id").asLong();
    long messageId = message.path("message_id").asLong();
    String requesterId = message.path("from").path("id").asText(String.valueOf(chatId));

    Optional<JsonNode> media = findMedia(message);
    if (media.isPresent()) {
      JsonNode file = media.get();
      long size = file.path("file_size").asLong(0);
      Long originChatId = null;
      Long originMessageId = null;

      JsonNode origin = message.path("forward_origin");
      if (origin.has("chat") && origin.has("message_id")) {
        originChatId = origin.path("chat").path("id").asLong();
        originMessageId = origin.path("message_id").asLong();
      } else if (message.has("forward_from_chat") && message.has("forward_from_message_id")) {
        originChatId = message.path("forward_from_chat").path("id").asLong();
        originMessageId = message.path("forward_from_message_id").asLong();
      }

      AcquisitionRoute route;
      if (originChatId != null) {
        route = AcquisitionRoute.FORWARDED;
      } else if (size >= properties.directDownloadLimitBytes()) {
        route = AcquisitionRoute.RELAY;
      } else {
        route = AcquisitionRoute.DIRECT;
      }

      return Optional.of(
          new MediaRequest(
              requesterId,
              chatId,
              messageId,
              size,
              file.path("duration").asDouble(0),
              route,
              file.path("file_id").asText(null),
              file.path("file_name").asText(null),
              null,
              null,
              originChatId,
              originMessageId));
    }

    String text = message.path("text").asText(message.path("caption").asText(""));
    return urlRouter
        .findUrl(text)
        .map(url -> MediaRequest.link(requesterId, chatId, messageId, url));
  }

  private static Optional<JsonNode> findMedia(JsonNode message) {
    for (String field : MEDIA_FIELDS) {
      JsonNode node = message.path(field);
      if (node.isMissingNode() || node.isNull()) {
        continue;
      }
      if ("document".equals(field) && !isAudioOrVideo(node.path("mime_type").asText(""))) {
        continue;
      }
      return Optional.of(node);
    }
    return Optional.empty();
  }

  private static boolean isAudioOrVideo(String mimeType) {
    return mimeType.startsWith("audio/") || mimeType.startsWith("video/");
  }
}
