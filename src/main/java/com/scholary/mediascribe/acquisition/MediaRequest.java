package com.scholary.mediascribe.acquisition;

import java.nio.file.Path;

/**
 * One request to transcribe a piece of media.
 *
 * <p>Which source fields are set depends on the route: {@code fileId} for Bot API files, {@code
 * url} for links, {@code localFile} for uploads, and the origin ids for forwarded messages. {@code
 * chatId} and {@code messageId} identify the requester's message and are null for REST requests.
 */
public record MediaRequest(
    String requesterId,
    Long chatId,
    Long messageId,
    long sizeBytes,
    double durationSeconds,
    AcquisitionRoute route,
    String fileId,
    String fileName,
    String url,
    Path localFile,
    Long originChatId,
    Long originMessageId) {

  public MediaRequest {
    if (requesterId == null || requesterId.isBlank()) {
      throw new IllegalArgumentException("Requester id is required");
    }
    if (route == null) {
      throw new IllegalArgumentException("Acquisition route is required");
    }
  }

  /** A file uploaded through the REST API and stored at {@code file}. */
  public static MediaRequest upload(String requesterId, Path file, String originalName) {
    return new MediaRequest(
        requesterId,
        null,
        null,
        0,
        0,
        AcquisitionRoute.DIRECT,
        null,
        originalName,
        null,
        file,
        null,
        null);
  }

  /** A link sent as text. */
  public static MediaRequest link(String requesterId, Long chatId, Long messageId, String url) {
    return new MediaRequest(
        requesterId,
        chatId,
        messageId,
        0,
        0,
        AcquisitionRoute.URL,
        null,
        null,
        url,
        null,
        null,
        null);
  }

  public MediaRequest withRoute(AcquisitionRoute newRoute) {
    return new MediaRequest(
        requesterId,
        chatId,
        messageId,
        sizeBytes,
        durationSeconds,
        newRoute,
        fileId,
        fileName,
        url,
        localFile,
        originChatId,
        originMessageId);
  }

  /** The same request, already fetched to {@code file}. */
  public MediaRequest withLocalFile(Path file) {
    return new MediaRequest(
        requesterId,
        chatId,
        messageId,
        sizeBytes,
        durationSeconds,
        AcquisitionRoute.DIRECT,
        fileId,
        fileName,
        url,
        file,
        originChatId,
        originMessageId);
  }

  public boolean hasChat() {
    return chatId != null && messageId != null;
  }

  /** Name used for transcript files. */
  public String sourceName() {
    if (fileName != null && !fileName.isBlank()) {
      return fileName;
    }
    if (localFile != null) {
      return localFile.getFileName().toString();
    }
    if (messageId != null) {
      return "telegram_" + messageId;
    }
    return "request_" + requesterId;
  }
}
