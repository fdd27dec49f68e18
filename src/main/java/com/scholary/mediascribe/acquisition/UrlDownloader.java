package com.scholary.mediascribe.acquisition;

import com.scholary.mediascribe.config.PipelineProperties;
import com.scholary.mediascribe.process.ProcessResult;
import com.scholary.mediascribe.process.ProcessRunner;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Downloads classified links into the work directory.
 *
 * <p>YouTube-family links go through yt-dlp with a process timeout; Google Drive links are fetched
 * over HTTP, following redirects by hand so that every hop is bounded and logged.
 */
@Component
public class UrlDownloader {

  private static final Logger LOGGER = LoggerFactory.getLogger(UrlDownloader.class);

  private final ProcessRunner processRunner;
  private final DownloaderProperties properties;
  private final Path workDir;
  private final HttpClient httpClient;

  @Autowired
  public UrlDownloader(
      ProcessRunner processRunner,
      DownloaderProperties properties,
      PipelineProperties pipelineProperties) {
    this(
        processRunner,
        properties,
        Path.of(pipelineProperties.workDir()),
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.httpTimeoutSeconds()))
            .followRedirects(HttpClient.Redirect.NEVER)
            .build());
  }

  UrlDownloader(
      ProcessRunner processRunner,
      DownloaderProperties properties,
      Path workDir,
      HttpClient httpClient) {
    this.processRunner = processRunner;
    this.properties = properties;
    this.workDir = workDir;
    this.httpClient = httpClient;
  }

  /**
   * Download a classified link.
   *
   * @return the downloaded, non-empty file
   * @throws AcquisitionException on any download failure
   */
  public Path download(UrlSource source) {
    try {
      Files.createDirectories(workDir);
    } catch (IOException e) {
      throw new AcquisitionException("Cannot create work directory " + workDir, e);
    }

    Path target;
    if (source.kind() == UrlSource.Kind.YOUTUBE) {
      target = workDir.resolve("youtube_" + source.id() + ".mp4");
      downloadWithYtdlp(source.downloadUrl(), target);
    } else {
      target = workDir.resolve("gdrive_" + source.id());
      downloadWithHttp(source.downloadUrl(), target);
    }

    requireNonEmpty(target, source.downloadUrl());
    return target;
  }

  private void downloadWithYtdlp(String url, Path target) {
    List<String> command =
        List.of(
            properties.ytdlpBinary(),
            "--no-progress",
            "--newline",
            "--no-playlist",
            "-f",
            "best",
            "-o",
            target.toString(),
            url);

    ProcessResult result;
    try {
      result =
          processRunner.run(command, Duration.ofMinutes(properties.ytdlpTimeoutMinutes()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AcquisitionException("yt-dlp interrupted for " + url, e);
    } catch (IOException e) {
      throw new AcquisitionException("Failed to start yt-dlp: " + e.getMessage(), e);
    }

    if (result.timedOut()) {
      String partialNote = cleanupPartial(target);
      throw new AcquisitionException(
          "yt-dlp timed out after "
              + properties.ytdlpTimeoutMinutes()
              + "m for "
              + url
              + partialNote);
    }

    if (result.code() != 0 || !Files.exists(target)) {
      String partialNote = cleanupPartial(target);
      String output = ProcessRunner.snippet(result.output());
      if (isAuthWall(result.output())) {
        throw new AcquisitionException(
            "Video requires sign-in and cannot be downloaded: " + url + partialNote);
      }
      throw new AcquisitionException(
          "yt-dlp exit=" + result.code() + " for " + url + partialNote + " log=" + output);
    }

    LOGGER.info("yt-dlp download OK: target={}, url={}", target.getFileName(), url);
  }

  private void downloadWithHttp(String url, Path target) {
    Duration timeout = Duration.ofSeconds(properties.httpTimeoutSeconds());
    String current = url;
    int redirects = 0;

    try {
      while (redirects <= properties.maxRedirects()) {
        HttpRequest request =
            HttpRequest.newBuilder()
                .uri(URI.create(current))
                .timeout(timeout)
                .header("User-Agent", properties.userAgent())
                .header("Accept", "*/*")
                .GET()
                .build();
        HttpResponse<InputStream> response =
            httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        int status = response.statusCode();

        if (isRedirect(status)) {
          String location = response.headers().firstValue("Location").orElse("");
          response.body().close();
          if (location.isBlank()) {
            throw new AcquisitionException("Redirect without Location header from " + current);
          }
          current = URI.create(current).resolve(location).toString();
          redirects++;
          continue;
        }

        if (status >= 200 && status < 300) {
          Path tmp = target.resolveSibling(target.getFileName() + ".part");
          try (InputStream in = response.body()) {
            Files.copy(in, tmp, StandardCopyOption.REPLACE_EXISTING);
          }
          Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
          LOGGER.info(
              "HTTP download OK: target={}, redirects={}", target.getFileName(), redirects);
          return;
        }

        String body;
        try (InputStream in = response.body()) {
          body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        throw new AcquisitionException(
            "HTTP download failed " + status + " for " + current + " body=" + snippet(body));
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AcquisitionException("HTTP download interrupted for " + url, e);
    } catch (IOException e) {
      cleanupPartial(target);
      throw new AcquisitionException("HTTP download failed for " + url + ": " + e.getMessage(), e);
    }

    throw new AcquisitionException(
        "Too many redirects (" + properties.maxRedirects() + ") for " + url);
  }

  static boolean isAuthWall(String output) {
    if (output == null) {
      return false;
    }
    String normalized = output.toLowerCase(Locale.ROOT).replace('\u2019', '\'');
    return normalized.contains("sign in to confirm you're not a bot")
        || normalized.contains("--cookies-from-browser")
        || normalized.contains("use --cookies");
  }

  private static boolean isRedirect(int status) {
    return status == 301 || status == 302 || status == 303 || status == 307 || status == 308;
  }

  private static String cleanupPartial(Path target) {
    Path partial = target.resolveSibling(target.getFileName() + ".part");
    if (!Files.exists(partial)) {
      return "";
    }
    try {
      Files.deleteIfExists(partial);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete partial download {}: {}", partial, e.getMessage());
    }
    return " partial=" + partial;
  }

  private static void requireNonEmpty(Path file, String url) {
    try {
      if (!Files.isRegularFile(file) || Files.size(file) == 0) {
        throw new AcquisitionException("Download produced no data for " + url);
      }
    } catch (IOException e) {
      throw new AcquisitionException("Cannot read downloaded file " + file, e);
    }
  }

  private static String snippet(String body) {
    return body.length() <= 500 ? body : body.substring(0, 500) + "...";
  }
}
