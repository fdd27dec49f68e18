package com.scholary.mediascribe.api;

import com.scholary.mediascribe.acquisition.AcquisitionRoute;
import com.scholary.mediascribe.acquisition.MediaRequest;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Request for transcribing media that is not uploaded with the request.
 *
 * <p>Defaults to the URL route. Telegram routes need the chat and message ids of the requester's
 * message so progress and results can be sent back there.
 */
public record TranscriptionRequest(
    @NotBlank String requesterId,
    AcquisitionRoute route,
    String url,
    String fileId,
    String fileName,
    @PositiveOrZero Long sizeBytes,
    Long chatId,
    Long messageId,
    Long originChatId,
    Long originMessageId) {

  public TranscriptionRequest {
    if (route == null) {
      route = AcquisitionRoute.URL;
    }
    if (sizeBytes == null) {
      sizeBytes = 0L;
    }
  }

  /**
   * Convert to a pipeline request.
   *
   * @throws IllegalArgumentException if the fields the route needs are missing
   */
  public MediaRequest toMediaRequest() {
    if (route == AcquisitionRoute.URL && (url == null || url.isBlank())) {
      throw new IllegalArgumentException("url is required for the URL route");
    }
    if (route != AcquisitionRoute.URL && (chatId == null || messageId == null)) {
      throw new IllegalArgumentException("chatId and messageId are required for route " + route);
    }
    return new MediaRequest(
        requesterId,
        chatId,
        messageId,
        sizeBytes,
        0,
        route,
        fileId,
        fileName,
        url,
        null,
        originChatId,
        originMessageId);
  }
}
