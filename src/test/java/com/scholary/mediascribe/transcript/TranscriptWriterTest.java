package com.scholary.mediascribe.transcript;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.mediascribe.whisper.TranscriptSegment;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TranscriptWriterTest {

  @TempDir Path tempDir;

  private TranscriptWriter writer;

  @BeforeEach
  void setUp() {
    writer = new TranscriptWriter(tempDir.resolve("out"));
  }

  @Test
  void writeRawAndFormatted_shouldUseSourceStem() throws IOException {
    Path raw = writer.writeRaw("run-1", "lecture.mp4", "[00:00:00] raw");
    Path formatted = writer.writeFormatted("run-1", "lecture.mp4", "[00:00:00] Raw.");

    assertThat(raw).isEqualTo(tempDir.resolve("out/run-1/lecture_raw.txt"));
    assertThat(formatted).isEqualTo(tempDir.resolve("out/run-1/lecture.txt"));
    assertThat(Files.readString(raw)).isEqualTo("[00:00:00] raw");
    assertThat(Files.readString(formatted)).isEqualTo("[00:00:00] Raw.");
  }

  @Test
  void writeSrt_shouldProduceValidSrtFormat() throws IOException {
    List<TranscriptSegment> segments =
        List.of(
            new TranscriptSegment(0.0, 5.2, "Hello world"),
            new TranscriptSegment(5.2, 10.5, " This is a test "));

    String srt = Files.readString(writer.writeSrt("run-1", "talk.wav", segments));

    // Check for sequence numbers
    assertThat(srt).startsWith("1\n");
    assertThat(srt).contains("\n\n2\n");

    // Check for timecodes
    assertThat(srt).contains("00:00:00,000 --> 00:00:05,200");
    assertThat(srt).contains("00:00:05,200 --> 00:00:10,500");

    assertThat(srt).contains("This is a test\n");
  }

  @Test
  void writeSrt_shouldHandleEmptySegments() throws IOException {
    Path srt = writer.writeSrt("run-1", "talk.wav", List.of());

    assertThat(srt.getFileName().toString()).isEqualTo("talk.srt");
    assertThat(Files.readString(srt)).isEmpty();
  }

  @Test
  void writeFormatted_shouldKeepRunsWithSameSourceNameApart() throws IOException {
    Path alice = writer.writeFormatted("alice_run", "telegram_5", "ALICE TRANSCRIPT");
    Path bob = writer.writeFormatted("bob_run", "telegram_5", "BOB TRANSCRIPT");

    assertThat(alice).isNotEqualTo(bob);
    assertThat(alice.getFileName()).isEqualTo(bob.getFileName());
    assertThat(Files.readString(alice)).isEqualTo("ALICE TRANSCRIPT");
    assertThat(Files.readString(bob)).isEqualTo("BOB TRANSCRIPT");
  }

  @Test
  void writeRaw_shouldKeepRunDirectoryInsideOutputDirectory() throws IOException {
    Path raw = writer.writeRaw("../..", "talk.wav", "text");

    assertThat(raw.normalize()).startsWith(tempDir.resolve("out"));
  }

  @Test
  void formatSrtTime_shouldFormatTimesCorrectly() {
    // 3661.5 seconds = 1 hour, 1 minute, 1.5 seconds
    assertThat(TranscriptWriter.formatSrtTime(3661.5)).isEqualTo("01:01:01,500");
    assertThat(TranscriptWriter.formatSrtTime(3665.75)).isEqualTo("01:01:05,750");
  }

  @Test
  void stem_shouldStripDirectoriesAndUnsafeCharacters() {
    assertThat(TranscriptWriter.stem("/tmp/work/my talk (final).mp4")).isEqualTo("my_talk__final_");
  }
}
