package com.scholary.mediascribe.audio;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Splits a PCM WAV file into fixed-length windows by sample position.
 *
 * <p>No silence detection: every window except the last holds exactly {@code window * sampleRate}
 * frames, which bounds the payload of each transcription call regardless of content.
 */
@Component
public class Segmenter {

  private static final Logger LOGGER = LoggerFactory.getLogger(Segmenter.class);

  /**
   * Split a WAV file into windows written next to it as {@code <stem>_chunk_<i>.wav}.
   *
   * @param wav the normalized audio
   * @param window the window length
   * @return the windows in sequence order, never empty for non-empty audio
   * @throws DecodeException if the file is not readable PCM audio
   */
  public List<AudioSegment> segment(Path wav, Duration window) {
    if (window.isZero() || window.isNegative()) {
      throw new IllegalArgumentException("Window must be positive");
    }

    String stem = AudioExtractor.stem(wav);
    List<AudioSegment> segments = new ArrayList<>();

    try (AudioInputStream source =
        AudioSystem.getAudioInputStream(new BufferedInputStream(Files.newInputStream(wav)))) {

      AudioFormat format = source.getFormat();
      float frameRate = format.getFrameRate();
      long totalFrames = source.getFrameLength();
      long framesPerWindow = (long) Math.floor(window.toMillis() / 1000.0 * frameRate);
      if (framesPerWindow <= 0) {
        throw new DecodeException("Window shorter than one frame: " + window);
      }

      LOGGER.info(
          "Segmenting audio: file={}, frames={}, frameRate={}, framesPerWindow={}",
          wav.getFileName(),
          totalFrames,
          frameRate,
          framesPerWindow);

      long framesRead = 0;
      int index = 0;
      while (totalFrames == AudioSystem.NOT_SPECIFIED || framesRead < totalFrames) {
        long remaining =
            totalFrames == AudioSystem.NOT_SPECIFIED ? framesPerWindow : totalFrames - framesRead;
        long frames = Math.min(framesPerWindow, remaining);

        Path target = wav.resolveSibling(String.format("%s_chunk_%d.wav", stem, index));
        long written = writeWindow(source, format, frames, target);
        if (written <= 0) {
          Files.deleteIfExists(target);
          break;
        }

        double offset = framesRead / frameRate;
        segments.add(new AudioSegment(index, offset, written / frameRate, target));
        framesRead += written;
        index++;

        if (written < frames) {
          break;
        }
      }
    } catch (UnsupportedAudioFileException e) {
      throw new DecodeException("Not a PCM WAV file: " + wav, e);
    } catch (IOException e) {
      throw new DecodeException("Failed to segment " + wav + ": " + e.getMessage(), e);
    }

    LOGGER.info("Segmented {} into {} windows", wav.getFileName(), segments.size());
    return segments;
  }

  private long writeWindow(AudioInputStream source, AudioFormat format, long frames, Path target)
      throws IOException {
    int frameSize = format.getFrameSize();
    byte[] buffer = new byte[(int) Math.min(frames * frameSize, 1 << 20)];
    Path tmp = target.resolveSibling(target.getFileName() + ".pcm");
    long bytesWanted = frames * frameSize;
    long bytesCopied = 0;

    try (var out = Files.newOutputStream(tmp)) {
      while (bytesCopied < bytesWanted) {
        int toRead = (int) Math.min(buffer.length, bytesWanted - bytesCopied);
        toRead -= toRead % frameSize;
        int read = source.read(buffer, 0, toRead);
        if (read <= 0) {
          break;
        }
        out.write(buffer, 0, read);
        bytesCopied += read;
      }
    }

    long framesCopied = bytesCopied / frameSize;
    try {
      if (framesCopied > 0) {
        try (InputStream raw = new BufferedInputStream(Files.newInputStream(tmp));
            AudioInputStream window = new AudioInputStream(raw, format, framesCopied)) {
          AudioSystem.write(window, AudioFileFormat.Type.WAVE, target.toFile());
        }
      }
    } finally {
      Files.deleteIfExists(tmp);
    }
    return framesCopied;
  }
}
