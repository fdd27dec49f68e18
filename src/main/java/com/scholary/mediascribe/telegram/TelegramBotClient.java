package com.scholary.mediascribe.telegram;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Telegram Bot API client for the primary identity.
 *
 * <p>Covers what the pipeline needs: long polling, status messages, copying a message into the
 * relay channel, downloading files below the Bot API limit, and sending transcripts as documents.
 */
@Service
public class TelegramBotClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(TelegramBotClient.class);
  private static final Duration CALL_TIMEOUT = Duration.ofSeconds(60);
  private static final Duration DOWNLOAD_TIMEOUT = Duration.ofMinutes(10);

  private final HttpClient httpClient;
  private final TelegramProperties properties;
  private final ObjectMapper objectMapper;

  @Autowired
  public TelegramBotClient(TelegramProperties properties, ObjectMapper objectMapper) {
    this(
        properties,
        objectMapper,
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(30))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build());
  }

  TelegramBotClient(TelegramProperties properties, ObjectMapper objectMapper, HttpClient client) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient = client;
  }

  public boolean isConfigured() {
    return properties.botToken() != null && !properties.botToken().isBlank();
  }

  /**
   * Long-poll for updates.
   *
   * @return the {@code result} array
   */
  public JsonNode getUpdates(long offset, int timeoutSeconds) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("offset", offset);
    body.put("timeout", timeoutSeconds);
    body.put("allowed_updates", new String[] {"message"});
    return call("getUpdates", body, Duration.ofSeconds(timeoutSeconds + 30L));
  }

  /**
   * Send a text message.
   *
   * @return the new message id
   */
  public long sendMessage(long chatId, String text) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("chat_id", chatId);
    body.put("text", text);
    return call("sendMessage", body, CALL_TIMEOUT).path("message_id").asLong();
  }

  public void editMessageText(long chatId, long messageId, String text) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("chat_id", chatId);
    body.put("message_id", messageId);
    body.put("text", text);
    call("editMessageText", body, CALL_TIMEOUT);
  }

  /**
   * Copy a message into another chat with a new caption.
   *
   * @return the id of the copy in the target chat
   */
  public long copyMessage(long toChatId, long fromChatId, long messageId, String caption) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("chat_id", toChatId);
    body.put("from_chat_id", fromChatId);
    body.put("message_id", messageId);
    body.put("caption", caption);
    return call("copyMessage", body, CALL_TIMEOUT).path("message_id").asLong();
  }

  /**
   * Resolve a file id to its download path.
   *
   * @throws TelegramApiException if the file is too big for the Bot API or unknown
   */
  public String getFilePath(String fileId) {
    JsonNode result = call("getFile", Map.of("file_id", fileId), CALL_TIMEOUT);
    String path = result.path("file_path").asText("");
    if (path.isBlank()) {
      throw new TelegramApiException(-1, "getFile returned no file_path for " + fileId);
    }
    return path;
  }

  /** Download a file returned by {@link #getFilePath(String)}. */
  public void downloadFile(String filePath, Path target) {
    URI uri =
        URI.create(
            trimSlash(properties.apiBaseUrl())
                + "/file/bot"
                + properties.botToken()
                + "/"
                + filePath);
    HttpRequest request = HttpRequest.newBuilder().uri(uri).timeout(DOWNLOAD_TIMEOUT).GET().build();

    Path tmp = target.resolveSibling(target.getFileName() + ".part");
    try {
      Files.createDirectories(target.toAbsolutePath().getParent());
      HttpResponse<InputStream> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
      try (InputStream in = response.body()) {
        if (response.statusCode() / 100 != 2) {
          throw new TelegramApiException(
              response.statusCode(), "File download failed with status " + response.statusCode());
        }
        Files.copy(in, tmp, StandardCopyOption.REPLACE_EXISTING);
      }
      Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
      LOGGER.info("Downloaded bot file: target={}, bytes={}", target, Files.size(target));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TelegramApiException(-1, "File download interrupted", e);
    } catch (IOException e) {
      throw new TelegramApiException(-1, "File download failed: " + e.getMessage(), e);
    } finally {
      deleteQuietly(tmp);
    }
  }

  /** Send a local file as a document. */
  public void sendDocument(long chatId, Path file, String caption) {
    String boundary = UUID.randomUUID().toString();
    try {
      ByteArrayOutputStream body = new ByteArrayOutputStream();
      writeField(body, boundary, "chat_id", String.valueOf(chatId));
      if (caption != null && !caption.isBlank()) {
        writeField(body, boundary, "caption", caption);
      }
      String header =
          "--"
              + boundary
              + "\r\nContent-Disposition: form-data; name=\"document\"; filename=\""
              + file.getFileName()
              + "\"\r\nContent-Type: application/octet-stream\r\n\r\n";
      body.write(header.getBytes(StandardCharsets.UTF_8));
      body.write(Files.readAllBytes(file));
      body.write(("\r\n--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8));

      HttpRequest request =
          HttpRequest.newBuilder()
              .uri(methodUri("sendDocument"))
              .timeout(DOWNLOAD_TIMEOUT)
              .header("Content-Type", "multipart/form-data; boundary=" + boundary)
              .POST(BodyPublishers.ofByteArray(body.toByteArray()))
              .build();
      unwrap("sendDocument", httpClient.send(request, HttpResponse.BodyHandlers.ofString()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TelegramApiException(-1, "sendDocument interrupted", e);
    } catch (IOException e) {
      throw new TelegramApiException(-1, "sendDocument failed: " + e.getMessage(), e);
    }
  }

  private JsonNode call(String method, Map<String, Object> body, Duration timeout) {
    if (!isConfigured()) {
      throw new TelegramApiException(-1, "Telegram bot token is not configured");
    }
    try {
      HttpRequest request =
          HttpRequest.newBuilder()
              .uri(methodUri(method))
              .timeout(timeout)
              .header("Content-Type", "application/json")
              .POST(BodyPublishers.ofByteArray(objectMapper.writeValueAsBytes(body)))
              .build();
      return unwrap(method, httpClient.send(request, HttpResponse.BodyHandlers.ofString()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TelegramApiException(-1, method + " interrupted", e);
    } catch (IOException e) {
      throw new TelegramApiException(-1, method + " failed: " + e.getMessage(), e);
    }
  }

  private JsonNode unwrap(String method, HttpResponse<String> response) {
    JsonNode root;
    try {
      root = objectMapper.readTree(response.body());
    } catch (JsonProcessingException e) {
      throw new TelegramApiException(
          response.statusCode(), method + " returned unparseable body", e);
    }
    if (!root.path("ok").asBoolean(false)) {
      int code = root.path("error_code").asInt(response.statusCode());
      throw new TelegramApiException(
          code, method + " failed: " + root.path("description").asText("unknown error"));
    }
    return root.path("result");
  }

  private URI methodUri(String method) {
    return URI.create(
        trimSlash(properties.apiBaseUrl()) + "/bot" + properties.botToken() + "/" + method);
  }

  private static void writeField(
      ByteArrayOutputStream body, String boundary, String name, String value) throws IOException {
    String part =
        "--"
            + boundary
            + "\r\nContent-Disposition: form-data; name=\""
            + name
            + "\"\r\n\r\n"
            + value
            + "\r\n";
    body.write(part.getBytes(StandardCharsets.UTF_8));
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete partial download {}: {}", file, e.getMessage());
    }
  }

  private static String trimSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
