package com.scholary.mediascribe.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Chat-completion client for OpenAI-compatible gateways (OpenRouter by default).
 *
 * <p>Sends {@code {model, messages, temperature, max_tokens}} with bearer auth plus the
 * {@code HTTP-Referer} and {@code X-Title} headers OpenRouter uses for attribution.
 */
@Component
public class HttpChatCompletionClient implements ChatCompletionClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpChatCompletionClient.class);
  private static final int ERROR_BODY_MAX = 500;

  private final HttpClient httpClient;
  private final LlmProperties properties;
  private final ObjectMapper objectMapper;
  private final ObjectWriter asciiWriter;

  @Autowired
  public HttpChatCompletionClient(LlmProperties properties, ObjectMapper objectMapper) {
    this(
        properties,
        objectMapper,
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build());
  }

  HttpChatCompletionClient(
      LlmProperties properties, ObjectMapper objectMapper, HttpClient httpClient) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.asciiWriter = objectMapper.writer().with(JsonWriteFeature.ESCAPE_NON_ASCII);
    this.httpClient = httpClient;

    LOGGER.info("Initialized chat-completion client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public String complete(String model, List<ChatMessage> messages, RequestEncoding encoding) {
    ObjectNode body = buildBody(model, messages);

    HttpRequest.Builder builder =
        HttpRequest.newBuilder()
            .uri(URI.create(trimSlash(properties.baseUrl()) + "/chat/completions"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .POST(encode(body, encoding));
    if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
      builder.header("Authorization", "Bearer " + properties.apiKey());
    }
    if (properties.referer() != null && !properties.referer().isBlank()) {
      builder.header("HTTP-Referer", properties.referer());
    }
    if (properties.title() != null && !properties.title().isBlank()) {
      builder.header("X-Title", properties.title());
    }
    builder.header(
        "Content-Type",
        encoding == RequestEncoding.PRESERIALIZED_STRING
            ? "application/json; charset=utf-8"
            : "application/json");

    HttpResponse<String> response;
    try {
      response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ModelCallException(
          ModelCallException.TRANSPORT_FAILURE, "Chat completion interrupted", e);
    } catch (IOException e) {
      throw new ModelCallException(
          ModelCallException.TRANSPORT_FAILURE,
          "Chat completion transport failure: " + e.getMessage(),
          e);
    }

    if (response.statusCode() / 100 != 2) {
      throw new ModelCallException(
          response.statusCode(),
          String.format(
              "Chat completion returned status %d for model %s: %s",
              response.statusCode(), model, truncate(response.body())));
    }

    return extractContent(model, response);
  }

  private ObjectNode buildBody(String model, List<ChatMessage> messages) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("model", model);
    ArrayNode array = body.putArray("messages");
    for (ChatMessage message : messages) {
      array.addObject().put("role", message.role()).put("content", message.content());
    }
    body.put("temperature", properties.temperature());
    body.put("max_tokens", properties.maxTokens());
    return body;
  }

  private BodyPublisher encode(ObjectNode body, RequestEncoding encoding) {
    try {
      if (encoding == RequestEncoding.PRESERIALIZED_STRING) {
        String json = asciiWriter.writeValueAsString(body);
        return BodyPublishers.ofString(json, StandardCharsets.UTF_8);
      }
      return BodyPublishers.ofByteArray(objectMapper.writeValueAsBytes(body));
    } catch (JsonProcessingException e) {
      throw new ModelCallException(
          ModelCallException.TRANSPORT_FAILURE, "Failed to encode request body", e);
    }
  }

  private String extractContent(String model, HttpResponse<String> response) {
    JsonNode root;
    try {
      root = objectMapper.readTree(response.body());
    } catch (JsonProcessingException e) {
      throw new ModelCallException(
          response.statusCode(), "Unparseable chat completion response for model " + model, e);
    }

    // Gateways sometimes report upstream failures inside a 200 body.
    JsonNode error = root.path("error");
    if (!error.isMissingNode() && !error.isNull()) {
      int code = error.path("code").asInt(response.statusCode());
      throw new ModelCallException(
          code, "Chat completion error for model " + model + ": " + error.path("message").asText());
    }

    String content = root.path("choices").path(0).path("message").path("content").asText("");
    if (content.isBlank()) {
      throw new ModelCallException(
          response.statusCode(), "Chat completion returned no content for model " + model);
    }

    LOGGER.debug("Chat completion succeeded: model={}, chars={}", model, content.length());
    return content.trim();
  }

  private static String truncate(String body) {
    if (body == null) {
      return "<no body>";
    }
    return body.length() <= ERROR_BODY_MAX ? body : body.substring(0, ERROR_BODY_MAX) + "...";
  }

  private static String trimSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
