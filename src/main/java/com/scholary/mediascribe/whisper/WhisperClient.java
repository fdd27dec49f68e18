package com.scholary.mediascribe.whisper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.mediascribe.audio.AudioSegment;
import com.scholary.mediascribe.logging.StructuredLogger;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Duration;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * HTTP client for an OpenAI-compatible speech-to-text API.
 *
 * <p>Requests {@code verbose_json} with segment-level timestamps. One call per window, no retry: a
 * window that fails is logged and returned empty, and the transcript continues without it.
 */
@Component
public class WhisperClient implements WhisperService {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperClient.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final HttpClient httpClient;
  private final WhisperProperties properties;
  private final ObjectMapper objectMapper;

  @Autowired
  public WhisperClient(WhisperProperties properties, ObjectMapper objectMapper) {
    this(
        properties,
        objectMapper,
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build());
  }

  WhisperClient(WhisperProperties properties, ObjectMapper objectMapper, HttpClient httpClient) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient = httpClient;

    LOGGER.info(
        "Initialized Whisper client: baseUrl={}, model={}",
        properties.baseUrl(),
        properties.model());
  }

  @Override
  public WhisperResponse transcribe(AudioSegment segment) {
    LOGGER.info(
        "Transcribing window: file={}, offset={}s, duration={}s, index={}",
        segment.file().getFileName(),
        segment.offsetSeconds(),
        segment.durationSeconds(),
        segment.index());

    try {
      return attemptTranscribe(segment);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      structuredLogger.logTranscribeFailed(segment.index(), "Interrupted", e.getMessage());
      return WhisperResponse.empty();
    } catch (WhisperException e) {
      structuredLogger.logTranscribeFailed(
          segment.index(), "HTTP " + e.getStatusCode(), e.getMessage());
      return WhisperResponse.empty();
    } catch (IOException e) {
      structuredLogger.logTranscribeFailed(
          segment.index(), e.getClass().getSimpleName(), e.getMessage());
      return WhisperResponse.empty();
    }
  }

  private WhisperResponse attemptTranscribe(AudioSegment segment)
      throws IOException, InterruptedException {

    String boundary = UUID.randomUUID().toString();
    BodyPublisher bodyPublisher = buildMultipartBody(segment, boundary);

    HttpRequest.Builder builder =
        HttpRequest.newBuilder()
            .uri(URI.create(trimSlash(properties.baseUrl()) + "/audio/transcriptions"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "multipart/form-data; boundary=" + boundary)
            .POST(bodyPublisher);
    if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
      builder.header("Authorization", "Bearer " + properties.apiKey());
    }
    HttpRequest request = builder.build();

    LOGGER.debug("Sending transcription request to {}", request.uri());

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    if (response.statusCode() / 100 != 2) {
      throw new WhisperException(
          response.statusCode(),
          String.format(
              "Transcription API returned status %d: %s",
              response.statusCode(), response.body()));
    }

    WhisperResponse whisperResponse =
        objectMapper.readValue(response.body(), WhisperResponse.class);

    LOGGER.info(
        "Transcription successful: window={}, segments={}, chars={}",
        segment.index(),
        whisperResponse.segments().size(),
        whisperResponse.text().length());

    return whisperResponse;
  }

  /**
   * Build a multipart/form-data body.
   *
   * <p>Java's HttpClient has no multipart support, so the parts are written by hand:
   *
   * <pre>
   * --boundary
   * Content-Disposition: form-data; name="file"; filename="x_chunk_0.wav"
   * Content-Type: audio/wav
   *
   * [binary data]
   * --boundary
   * Content-Disposition: form-data; name="model"
   *
   * openai/whisper-large-v3-turbo
   * ...
   * --boundary--
   * </pre>
   */
  private BodyPublisher buildMultipartBody(AudioSegment segment, String boundary)
      throws IOException {

    String filename = segment.file().getFileName().toString();
    ByteArrayOutputStream body = new ByteArrayOutputStream();

    StringBuilder sb = new StringBuilder();
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"file\"; filename=\"")
        .append(filename)
        .append("\"\r\n");
    sb.append("Content-Type: audio/wav\r\n\r\n");
    body.write(sb.toString().getBytes(StandardCharsets.UTF_8));

    body.write(Files.readAllBytes(segment.file()));
    body.write("\r\n".getBytes(StandardCharsets.UTF_8));

    appendField(body, boundary, "model", properties.model());
    appendField(body, boundary, "response_format", "verbose_json");
    appendField(body, boundary, "timestamp_granularities[]", "segment");

    body.write(("--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8));

    return BodyPublishers.ofByteArray(body.toByteArray());
  }

  private static void appendField(
      ByteArrayOutputStream body, String boundary, String name, String value) throws IOException {
    String part =
        "--"
            + boundary
            + "\r\n"
            + "Content-Disposition: form-data; name=\""
            + name
            + "\"\r\n\r\n"
            + value
            + "\r\n";
    body.write(part.getBytes(StandardCharsets.UTF_8));
  }

  private static String trimSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
