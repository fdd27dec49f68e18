package com.scholary.mediascribe.audio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.io.ByteArrayInputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for Segmenter window boundaries. */
class SegmenterTest {

  // Low rate keeps the fixture small; boundaries depend only on frame counts.
  private static final float SAMPLE_RATE = 100f;

  @TempDir Path tempDir;

  private final Segmenter segmenter = new Segmenter();

  @Test
  void segment_shouldSplitTwentyFiveMinutesIntoThreeWindows() throws Exception {
    Path wav = writeWav("talk.wav", 25 * 60);

    List<AudioSegment> segments = segmenter.segment(wav, Duration.ofMinutes(10));

    assertThat(segments).hasSize(3);
    assertThat(segments).extracting(AudioSegment::index).containsExactly(0, 1, 2);
    assertThat(segments.get(0).offsetSeconds()).isCloseTo(0.0, within(0.01));
    assertThat(segments.get(1).offsetSeconds()).isCloseTo(600.0, within(0.01));
    assertThat(segments.get(2).offsetSeconds()).isCloseTo(1200.0, within(0.01));
    assertThat(segments.get(0).durationSeconds()).isCloseTo(600.0, within(0.01));
    assertThat(segments.get(1).durationSeconds()).isCloseTo(600.0, within(0.01));
    assertThat(segments.get(2).durationSeconds()).isCloseTo(300.0, within(0.01));
  }

  @Test
  void segment_shouldWriteReadableWindowFiles() throws Exception {
    Path wav = writeWav("talk.wav", 25 * 60);

    List<AudioSegment> segments = segmenter.segment(wav, Duration.ofMinutes(10));

    AudioSegment last = segments.get(2);
    assertThat(last.file().getFileName().toString()).isEqualTo("talk_chunk_2.wav");
    try (AudioInputStream in = AudioSystem.getAudioInputStream(last.file().toFile())) {
      assertThat(in.getFrameLength()).isEqualTo((long) (300 * SAMPLE_RATE));
    }
    assertThat(tempDir.resolve("talk_chunk_2.wav.pcm")).doesNotExist();
  }

  @Test
  void segment_shouldReturnSingleWindowForShortAudio() throws Exception {
    Path wav = writeWav("short.wav", 42);

    List<AudioSegment> segments = segmenter.segment(wav, Duration.ofMinutes(10));

    assertThat(segments).hasSize(1);
    assertThat(segments.get(0).durationSeconds()).isCloseTo(42.0, within(0.01));
  }

  @Test
  void segment_shouldRejectNonAudioFile() throws Exception {
    Path bogus = tempDir.resolve("bogus.wav");
    Files.writeString(bogus, "not audio at all");

    assertThatThrownBy(() -> segmenter.segment(bogus, Duration.ofMinutes(10)))
        .isInstanceOf(DecodeException.class);
  }

  private Path writeWav(String name, int seconds) throws Exception {
    AudioFormat format = new AudioFormat(SAMPLE_RATE, 16, 1, true, false);
    long frames = (long) (seconds * SAMPLE_RATE);
    byte[] pcm = new byte[(int) (frames * format.getFrameSize())];
    for (int i = 0; i < pcm.length; i += 2) {
      pcm[i] = (byte) (i % 64);
    }
    Path target = tempDir.resolve(name);
    try (AudioInputStream in =
        new AudioInputStream(new ByteArrayInputStream(pcm), format, frames)) {
      AudioSystem.write(in, AudioFileFormat.Type.WAVE, target.toFile());
    }
    return target;
  }
}
