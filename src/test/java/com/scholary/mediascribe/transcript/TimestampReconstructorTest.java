package com.scholary.mediascribe.transcript;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.mediascribe.whisper.TranscriptSegment;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.RepetitionInfo;
import org.junit.jupiter.api.Test;

/** Tests for TimestampReconstructor paragraph grouping and marker monotonicity. */
class TimestampReconstructorTest {

  private static final Pattern PARAGRAPH = Pattern.compile("^\\[\\d{2,}:[0-5]\\d:[0-5]\\d] \\S");

  private final TimestampReconstructor reconstructor = new TimestampReconstructor(600, 30, 35);

  @Test
  void reconstruct_shouldGroupWordsIntoParagraphsWithStepMarkers() {
    WindowTranscript window =
        new WindowTranscript(0, 0.0, "", List.of(segment(0, 20, words("w", 80))));

    String raw = reconstructor.reconstruct(List.of(window));

    String[] paragraphs = raw.split("\n\n");
    assertThat(paragraphs).hasSize(3);
    assertThat(paragraphs[0]).startsWith("[00:00:00] w0 ");
    assertThat(paragraphs[1]).startsWith("[00:00:30] w35 ");
    assertThat(paragraphs[2]).startsWith("[00:01:00] w70 ");
    assertThat(paragraphs[2].split(" ")).hasSize(11);
  }

  @Test
  void reconstruct_shouldStartSecondWindowAtItsOffset() {
    WindowTranscript first =
        new WindowTranscript(0, 0.0, "", List.of(segment(0, 5, words("a", 40))));
    WindowTranscript second =
        new WindowTranscript(1, 600.0, "", List.of(segment(0, 5, words("b", 10))));

    String raw = reconstructor.reconstruct(List.of(second, first));

    assertThat(raw).contains("[00:10:00] b0");
    assertThat(raw.indexOf("a0")).isLessThan(raw.indexOf("b0"));
  }

  @Test
  void reconstruct_shouldKeepMarkersNonDecreasingWhenWindowOverflowsItsSlot() {
    // 30 paragraphs at a 30 s step run past the 600 s boundary of the first window.
    WindowTranscript verbose =
        new WindowTranscript(0, 0.0, "", List.of(segment(0, 600, words("x", 35 * 30))));
    WindowTranscript next =
        new WindowTranscript(1, 600.0, "", List.of(segment(0, 5, words("y", 5))));

    String raw = reconstructor.reconstruct(List.of(verbose, next));

    List<Long> markers = TimestampFormat.markers(raw);
    assertThat(markers).isSorted();
    assertThat(markers.get(markers.size() - 1)).isEqualTo(900L);
  }

  @Test
  void reconstruct_shouldUsePlainTextWhenWindowHasNoSegments() {
    WindowTranscript plain = new WindowTranscript(0, 0.0, "  just text  ", List.of());

    assertThat(reconstructor.reconstruct(List.of(plain))).isEqualTo("[00:00:00] just text");
  }

  @Test
  void reconstruct_shouldKeepUntimedTextWithBlankLinesInOneParagraph() {
    WindowTranscript plain =
        new WindowTranscript(0, 0.0, "first line\n\nsecond line\n third", List.of());

    assertThat(reconstructor.reconstruct(List.of(plain)))
        .isEqualTo("[00:00:00] first line second line third");
  }

  @RepeatedTest(50)
  void reconstruct_shouldPrefixEveryParagraphWithNonDecreasingMarker(RepetitionInfo repetition) {
    List<WindowTranscript> windows = randomWindows(new Random(repetition.getCurrentRepetition()));

    String raw = reconstructor.reconstruct(windows);

    if (!raw.isEmpty()) {
      for (String paragraph : raw.split("\n\n")) {
        assertThat(paragraph).containsPattern(PARAGRAPH);
      }
    }
    assertThat(TimestampFormat.markers(raw)).isSorted();
  }

  @RepeatedTest(50)
  void shift_shouldReturnNonDecreasingStartTimes(RepetitionInfo repetition) {
    List<WindowTranscript> windows = randomWindows(new Random(repetition.getCurrentRepetition()));

    List<TranscriptSegment> shifted = reconstructor.shift(windows);

    assertThat(shifted).extracting(TranscriptSegment::start).isSorted();
    assertThat(shifted).hasSize(windows.stream().mapToInt(w -> w.segments().size()).sum());
  }

  @Test
  void reconstruct_shouldSkipEmptyWindowsWithoutShiftingLaterOnes() {
    WindowTranscript empty = new WindowTranscript(0, 0.0, "", List.of());
    WindowTranscript second =
        new WindowTranscript(1, 600.0, "", List.of(segment(0, 3, "hello world")));

    assertThat(reconstructor.reconstruct(List.of(empty, second)))
        .isEqualTo("[00:10:00] hello world");
  }

  @Test
  void reconstruct_shouldReturnEmptyStringForNoSpeech() {
    assertThat(reconstructor.reconstruct(List.of(new WindowTranscript(0, 0.0, "", null))))
        .isEmpty();
  }

  @Test
  void shift_shouldMoveSegmentsOntoGlobalAxisInOrder() {
    WindowTranscript first =
        new WindowTranscript(0, 0.0, "", List.of(segment(1, 2, "one"), segment(550, 560, "two")));
    WindowTranscript second = new WindowTranscript(1, 600.0, "", List.of(segment(4, 8, "three")));

    List<TranscriptSegment> shifted = reconstructor.shift(List.of(second, first));

    assertThat(shifted).extracting(TranscriptSegment::text).containsExactly("one", "two", "three");
    assertThat(shifted.get(2).start()).isEqualTo(604.0);
    assertThat(shifted.get(2).end()).isEqualTo(608.0);
  }

  /** Windows in shuffled order: timed with unsorted segments, untimed text, or silent. */
  private static List<WindowTranscript> randomWindows(Random random) {
    int count = 1 + random.nextInt(6);
    List<WindowTranscript> windows = new ArrayList<>();
    for (int index = 0; index < count; index++) {
      double offset = index * 600.0;
      switch (random.nextInt(3)) {
        case 0:
          List<TranscriptSegment> segments = new ArrayList<>();
          int segmentCount = 1 + random.nextInt(8);
          for (int i = 0; i < segmentCount; i++) {
            double start = random.nextDouble() * 600;
            segments.add(
                segment(start, start + random.nextDouble() * 20, words("w", random.nextInt(60))));
          }
          windows.add(new WindowTranscript(index, offset, "", segments));
          break;
        case 1:
          String text = words("t", 1 + random.nextInt(20)) + "\n\n" + words("u", random.nextInt(5));
          windows.add(new WindowTranscript(index, offset, text, List.of()));
          break;
        default:
          windows.add(new WindowTranscript(index, offset, "", List.of()));
      }
    }
    Collections.shuffle(windows, random);
    return windows;
  }

  private static TranscriptSegment segment(double start, double end, String text) {
    return new TranscriptSegment(start, end, text);
  }

  private static String words(String prefix, int count) {
    List<String> words = new ArrayList<>();
    IntStream.range(0, count).forEach(i -> words.add(prefix + i));
    return words.stream().collect(Collectors.joining(" "));
  }
}
