package com.scholary.mediascribe.audio;

import com.scholary.mediascribe.process.ProcessResult;
import com.scholary.mediascribe.process.ProcessRunner;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decodes any media container ffmpeg understands into a normalized PCM WAV file.
 *
 * <p>A zero exit code alone is not trusted: ffmpeg happily exits 0 for inputs without an audio
 * stream and leaves an empty file behind. Success requires exit code 0 and a non-empty output.
 */
@Component
public class AudioExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioExtractor.class);

  private final ProcessRunner processRunner;
  private final FfmpegProperties properties;

  public AudioExtractor(ProcessRunner processRunner, FfmpegProperties properties) {
    this.processRunner = processRunner;
    this.properties = properties;
  }

  /**
   * Extract the audio track of a media file.
   *
   * @param input a local media file
   * @return the WAV file next to the input, named {@code <stem>.wav}
   * @throws DecodeException if the input is missing or empty, or ffmpeg fails
   */
  public Path extract(Path input) {
    requireNonEmpty(input, "Input media");

    Path output = input.resolveSibling(stem(input) + ".wav");
    if (output.equals(input)) {
      output = input.resolveSibling(stem(input) + "_pcm.wav");
    }

    List<String> command =
        List.of(
            properties.binary(),
            "-i",
            input.toString(),
            "-vn",
            "-acodec",
            "pcm_s16le",
            "-ar",
            String.valueOf(properties.sampleRate()),
            "-ac",
            String.valueOf(properties.channels()),
            "-y",
            output.toString());

    LOGGER.info(
        "Extracting audio: input={}, rate={}, channels={}",
        input.getFileName(),
        properties.sampleRate(),
        properties.channels());

    ProcessResult result;
    try {
      result = processRunner.run(command, Duration.ofSeconds(properties.timeoutSeconds()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DecodeException("Audio extraction interrupted", e);
    } catch (IOException e) {
      throw new DecodeException("Failed to start ffmpeg: " + e.getMessage(), e);
    }

    if (result.timedOut()) {
      throw new DecodeException(
          "ffmpeg timed out after " + properties.timeoutSeconds() + "s for " + input.getFileName());
    }
    if (result.code() != 0) {
      throw new DecodeException(
          "ffmpeg exited with code "
              + result.code()
              + ": "
              + ProcessRunner.snippet(result.output()));
    }
    requireNonEmpty(output, "Decoded audio");

    LOGGER.info("Audio extracted: output={}, bytes={}", output.getFileName(), sizeOf(output));
    return output;
  }

  private static void requireNonEmpty(Path file, String what) {
    if (file == null || !Files.isRegularFile(file)) {
      throw new DecodeException(what + " does not exist: " + file);
    }
    if (sizeOf(file) == 0) {
      throw new DecodeException(what + " is empty: " + file);
    }
  }

  private static long sizeOf(Path file) {
    try {
      return Files.size(file);
    } catch (IOException e) {
      throw new DecodeException("Cannot read size of " + file, e);
    }
  }

  static String stem(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }
}
