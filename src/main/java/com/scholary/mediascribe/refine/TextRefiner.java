package com.scholary.mediascribe.refine;

import com.scholary.mediascribe.config.PipelineProperties;
import com.scholary.mediascribe.llm.CascadeResult;
import com.scholary.mediascribe.llm.ModelCascadeExecutor;
import com.scholary.mediascribe.logging.StructuredLogger;
import com.scholary.mediascribe.transcript.TimestampFormat;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Formats a raw transcript chunk by chunk through the model cascade.
 *
 * <p>A chunk whose formatting fails keeps its original text, so the result always covers the whole
 * transcript. A model answer is rejected when it changes the number of timestamp markers or is
 * much shorter than its input.
 */
@Component
public class TextRefiner {

  private static final Logger LOGGER = LoggerFactory.getLogger(TextRefiner.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final double MIN_LENGTH_RATIO = 0.7;

  private final ModelCascadeExecutor cascade;
  private final TextChunker chunker;
  private final int minTranscriptChars;

  @Autowired
  public TextRefiner(ModelCascadeExecutor cascade, PipelineProperties properties) {
    this(
        cascade,
        new TextChunker(properties.refineChunkChars(), properties.boundaryAwareChunking()),
        properties.minTranscriptChars());
  }

  TextRefiner(ModelCascadeExecutor cascade, TextChunker chunker, int minTranscriptChars) {
    this.cascade = cascade;
    this.chunker = chunker;
    this.minTranscriptChars = minTranscriptChars;
  }

  /**
   * Format a raw transcript.
   *
   * @param raw the reconstructed transcript
   * @return the reassembled text and per-chunk counters
   */
  public RefinementResult refine(String raw) {
    if (raw == null || raw.trim().length() < minTranscriptChars) {
      LOGGER.info("Transcript too short to refine, keeping it as is");
      return new RefinementResult(raw == null ? "" : raw, 0, 0);
    }

    List<String> chunks = chunker.split(raw);
    List<String> refined = new ArrayList<>(chunks.size());
    int fallbacks = 0;

    LOGGER.info("Refining transcript: chars={}, chunks={}", raw.length(), chunks.size());

    for (int i = 0; i < chunks.size(); i++) {
      String chunk = chunks.get(i);
      String result = refineChunk(chunk, i, chunks.size());
      if (result == null) {
        refined.add(chunk.trim());
        fallbacks++;
      } else {
        refined.add(result);
      }
    }

    LOGGER.info("Refinement done: refined={}, fallback={}", chunks.size() - fallbacks, fallbacks);
    return new RefinementResult(String.join("\n\n", refined), chunks.size() - fallbacks, fallbacks);
  }

  /** Returns the formatted chunk, or null when the original text must be kept. */
  private String refineChunk(String chunk, int index, int total) {
    CascadeResult result = cascade.execute(RefinementPrompts.formatChunk(chunk, index, total));
    if (!result.isSuccess()) {
      structuredLogger.logRefineChunkFailed(index, chunk.length(), result.errorMessage());
      return null;
    }

    String text = result.text().trim();
    int expectedMarkers = TimestampFormat.count(chunk);
    int actualMarkers = TimestampFormat.count(text);
    if (actualMarkers != expectedMarkers) {
      structuredLogger.logRefineChunkFailed(
          index,
          chunk.length(),
          String.format("timestamp markers changed: %d -> %d", expectedMarkers, actualMarkers));
      return null;
    }
    if (text.length() < chunk.trim().length() * MIN_LENGTH_RATIO) {
      structuredLogger.logRefineChunkFailed(
          index,
          chunk.length(),
          String.format("answer too short: %d of %d chars", text.length(), chunk.length()));
      return null;
    }
    return text;
  }
}
