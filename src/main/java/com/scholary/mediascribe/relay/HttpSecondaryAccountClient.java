package com.scholary.mediascribe.relay;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Secondary account reached through a session gateway over HTTP.
 *
 * <p>The gateway holds the persisted user session and exposes the few reads the relay needs:
 *
 * <ul>
 *   <li>{@code GET /session}
 *   <li>{@code GET /chats/{chat}/messages/{id}}
 *   <li>{@code GET /chats/{chat}/messages?limit=} and {@code ?minId=&limit=}
 *   <li>{@code GET /chats/{chat}/messages/{id}/media}
 * </ul>
 */
@Component
public class HttpSecondaryAccountClient implements SecondaryAccountClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpSecondaryAccountClient.class);
  private static final Duration READ_TIMEOUT = Duration.ofSeconds(30);
  private static final Duration MEDIA_TIMEOUT = Duration.ofMinutes(30);
  private static final TypeReference<List<RelayMessage>> MESSAGE_LIST = new TypeReference<>() {};

  private final RelayProperties properties;
  private final ObjectMapper objectMapper;
  private final HttpClient httpClient;

  @Autowired
  public HttpSecondaryAccountClient(RelayProperties properties, ObjectMapper objectMapper) {
    this(
        properties,
        objectMapper,
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build());
  }

  HttpSecondaryAccountClient(
      RelayProperties properties, ObjectMapper objectMapper, HttpClient httpClient) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient = httpClient;
  }

  @Override
  public boolean isAuthorized() {
    if (!properties.enabled()) {
      return false;
    }
    try {
      HttpResponse<String> response = get("/session", READ_TIMEOUT);
      if (response.statusCode() != 200) {
        return false;
      }
      JsonNode session = objectMapper.readTree(response.body());
      return session.path("authorized").asBoolean(false);
    } catch (IOException | SecondaryAccountException e) {
      LOGGER.warn("Secondary session check failed: {}", e.getMessage());
      return false;
    }
  }

  @Override
  public Optional<RelayMessage> getMessage(long chatId, long messageId) {
    HttpResponse<String> response =
        get("/chats/" + chatId + "/messages/" + messageId, READ_TIMEOUT);
    if (response.statusCode() == 404) {
      return Optional.empty();
    }
    requireSuccess(response, "getMessage");
    try {
      return Optional.of(objectMapper.readValue(response.body(), RelayMessage.class));
    } catch (IOException e) {
      throw new SecondaryAccountException("Unparseable message from gateway", e);
    }
  }

  @Override
  public List<RelayMessage> getRecentMessages(long chatId, int limit) {
    return list("/chats/" + chatId + "/messages?limit=" + limit);
  }

  @Override
  public List<RelayMessage> getMessagesAfter(long chatId, long minId, int limit) {
    return list("/chats/" + chatId + "/messages?minId=" + minId + "&limit=" + limit);
  }

  @Override
  public void downloadMedia(long chatId, RelayMessage message, Path target) {
    HttpRequest request =
        authorized(uri("/chats/" + chatId + "/messages/" + message.id() + "/media"))
            .timeout(MEDIA_TIMEOUT)
            .GET()
            .build();
    Path tmp = target.resolveSibling(target.getFileName() + ".part");
    try {
      Files.createDirectories(target.toAbsolutePath().getParent());
      HttpResponse<InputStream> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
      try (InputStream in = response.body()) {
        if (response.statusCode() / 100 != 2) {
          throw new SecondaryAccountException(
              "Media download failed with status " + response.statusCode());
        }
        Files.copy(in, tmp, StandardCopyOption.REPLACE_EXISTING);
      }
      Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SecondaryAccountException("Media download interrupted", e);
    } catch (IOException e) {
      throw new SecondaryAccountException("Media download failed: " + e.getMessage(), e);
    } finally {
      try {
        Files.deleteIfExists(tmp);
      } catch (IOException e) {
        LOGGER.warn("Failed to delete partial media {}: {}", tmp, e.getMessage());
      }
    }
  }

  @Override
  public void reconnect() {
    LOGGER.info("Re-checking secondary session");
    if (!isAuthorized()) {
      throw new SecondaryAccountException("Secondary session is not authorized");
    }
  }

  private List<RelayMessage> list(String path) {
    HttpResponse<String> response = get(path, READ_TIMEOUT);
    requireSuccess(response, "listMessages");
    try {
      return objectMapper.readValue(response.body(), MESSAGE_LIST);
    } catch (IOException e) {
      throw new SecondaryAccountException("Unparseable message list from gateway", e);
    }
  }

  private HttpResponse<String> get(String path, Duration timeout) {
    HttpRequest request = authorized(uri(path)).timeout(timeout).GET().build();
    try {
      return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SecondaryAccountException("Gateway call interrupted: " + path, e);
    } catch (IOException e) {
      throw new SecondaryAccountException("Gateway unreachable: " + e.getMessage(), e);
    }
  }

  private HttpRequest.Builder authorized(URI uri) {
    HttpRequest.Builder builder = HttpRequest.newBuilder().uri(uri);
    if (properties.gatewayToken() != null && !properties.gatewayToken().isBlank()) {
      builder.header("Authorization", "Bearer " + properties.gatewayToken());
    }
    return builder;
  }

  private URI uri(String path) {
    String base = properties.gatewayBaseUrl();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return URI.create(base + path);
  }

  private static void requireSuccess(HttpResponse<String> response, String operation) {
    if (response.statusCode() / 100 != 2) {
      throw new SecondaryAccountException(
          operation + " failed with status " + response.statusCode() + ": " + response.body());
    }
  }
}
