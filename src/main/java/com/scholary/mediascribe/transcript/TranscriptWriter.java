package com.scholary.mediascribe.transcript;

import com.scholary.mediascribe.config.PipelineProperties;
import com.scholary.mediascribe.whisper.TranscriptSegment;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Writes transcripts to the output directory.
 *
 * <p>For a source named {@code lecture.mp4} it produces {@code lecture_raw.txt} (reconstructed
 * service output), {@code lecture.txt} (refined text) and {@code lecture.srt} (subtitles built from
 * the service's real segment timings).
 *
 * <p>Each pipeline run writes into its own directory, {@code <outputDir>/<runId>/}, so requests
 * with the same source name never share files.
 */
@Component
public class TranscriptWriter {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptWriter.class);

  private final Path outputDir;

  @Autowired
  public TranscriptWriter(PipelineProperties properties) {
    this(Paths.get(properties.outputDir()));
  }

  TranscriptWriter(Path outputDir) {
    this.outputDir = outputDir;
    try {
      Files.createDirectories(outputDir);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create output directory: " + outputDir, e);
    }
  }

  /** Write the raw transcript as {@code <runId>/<stem>_raw.txt}. */
  public Path writeRaw(String runId, String sourceName, String raw) throws IOException {
    return write(runId, stem(sourceName) + "_raw.txt", raw);
  }

  /** Write the refined transcript as {@code <runId>/<stem>.txt}. */
  public Path writeFormatted(String runId, String sourceName, String formatted)
      throws IOException {
    return write(runId, stem(sourceName) + ".txt", formatted);
  }

  /**
   * Write absolute segments as SRT (SubRip subtitle format).
   *
   * <pre>
   * 1
   * 00:00:00,000 --> 00:00:05,200
   * Hello world
   * </pre>
   */
  public Path writeSrt(String runId, String sourceName, List<TranscriptSegment> segments)
      throws IOException {
    StringBuilder srt = new StringBuilder();

    for (int i = 0; i < segments.size(); i++) {
      TranscriptSegment segment = segments.get(i);
      srt.append(i + 1).append("\n");
      srt.append(formatSrtTime(segment.start()))
          .append(" --> ")
          .append(formatSrtTime(segment.end()))
          .append("\n");
      srt.append(segment.text() == null ? "" : segment.text().trim()).append("\n\n");
    }

    return write(runId, stem(sourceName) + ".srt", srt.toString());
  }

  private Path write(String runId, String fileName, String content) throws IOException {
    Path runDir = outputDir.resolve(safeName(runId));
    Files.createDirectories(runDir);
    Path target = runDir.resolve(fileName);
    Files.writeString(target, content, StandardCharsets.UTF_8);
    LOGGER.info("Wrote transcript file: {} ({} chars)", target, content.length());
    return target;
  }

  /**
   * Format a time in seconds as SRT timecode.
   *
   * <p>Format: HH:MM:SS,mmm (hours:minutes:seconds,milliseconds)
   */
  static String formatSrtTime(double seconds) {
    long totalMillis = Math.round(seconds * 1000);
    long hours = totalMillis / 3_600_000;
    long minutes = (totalMillis % 3_600_000) / 60_000;
    long secs = (totalMillis % 60_000) / 1000;
    long millis = totalMillis % 1000;

    return String.format("%02d:%02d:%02d,%03d", hours, minutes, secs, millis);
  }

  static String stem(String sourceName) {
    String name = Paths.get(sourceName).getFileName().toString();
    int dot = name.lastIndexOf('.');
    return safeName(dot > 0 ? name.substring(0, dot) : name);
  }

  private static String safeName(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Output name is required");
    }
    String safe = name.replaceAll("[^A-Za-z0-9._-]", "_");
    // "." and ".." would escape the run directory.
    return safe.matches("\\.+") ? safe.replace('.', '_') : safe;
  }
}
