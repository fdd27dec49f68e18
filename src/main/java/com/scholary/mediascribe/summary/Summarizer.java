package com.scholary.mediascribe.summary;

import com.scholary.mediascribe.config.PipelineProperties;
import com.scholary.mediascribe.llm.CascadeResult;
import com.scholary.mediascribe.llm.ModelCascadeExecutor;
import com.scholary.mediascribe.refine.TextChunker;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Two-level map-reduce summarization.
 *
 * <p>A transcript longer than one chunk is summarized chunk by chunk (intermediate summaries), then
 * the joined intermediate summaries are summarized once more (final summary). A shorter transcript
 * gets one direct call. Every call goes through the model cascade; the first exhausted call ends
 * the request.
 */
@Component
public class Summarizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(Summarizer.class);

  static final String TOO_SHORT = "The transcript is too short to summarize.";

  private final ModelCascadeExecutor cascade;
  private final TextChunker chunker;
  private final int minTranscriptChars;

  @Autowired
  public Summarizer(ModelCascadeExecutor cascade, PipelineProperties properties) {
    this(
        cascade,
        new TextChunker(properties.refineChunkChars(), properties.boundaryAwareChunking()),
        properties.minTranscriptChars());
  }

  Summarizer(ModelCascadeExecutor cascade, TextChunker chunker, int minTranscriptChars) {
    this.cascade = cascade;
    this.chunker = chunker;
    this.minTranscriptChars = minTranscriptChars;
  }

  /**
   * Summarize a transcript.
   *
   * @param transcript the transcript text
   * @param kind brief or detailed
   * @return the final (or direct) cascade result, or the first exhausted one
   */
  public CascadeResult summarize(String transcript, SummaryKind kind) {
    if (transcript == null || transcript.trim().length() < minTranscriptChars) {
      return CascadeResult.success(TOO_SHORT, null, List.of());
    }

    if (transcript.length() <= chunker.maxChars()) {
      LOGGER.info("Direct summary: kind={}, chars={}", kind, transcript.length());
      return cascade.execute(SummaryPrompts.direct(transcript, kind));
    }

    List<String> chunks = chunker.split(transcript);
    LOGGER.info(
        "Map-reduce summary: kind={}, chars={}, chunks={}",
        kind,
        transcript.length(),
        chunks.size());

    List<String> intermediate = new ArrayList<>(chunks.size());
    for (int i = 0; i < chunks.size(); i++) {
      CascadeResult part =
          cascade.execute(SummaryPrompts.intermediate(chunks.get(i), i, chunks.size(), kind));
      if (!part.isSuccess()) {
        LOGGER.warn("Intermediate summary {} of {} failed", i + 1, chunks.size());
        return part;
      }
      intermediate.add(String.format("Part %d:%n%s", i + 1, part.text()));
    }

    return cascade.execute(SummaryPrompts.finalSummary(String.join("\n\n", intermediate), kind));
  }
}
