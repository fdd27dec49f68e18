package com.scholary.mediascribe.service;

import com.scholary.mediascribe.refine.RefinementResult;
import com.scholary.mediascribe.transcript.Transcript;

/**
 * Outcome of one pipeline run.
 *
 * @param version the result cache version the transcript was stored under
 * @param emptyWindows windows the transcription service returned nothing for
 */
public record PipelineResult(
    String correlationId,
    Transcript transcript,
    long version,
    int windowCount,
    int emptyWindows,
    RefinementResult refinement) {

  public boolean isDegraded() {
    return emptyWindows > 0 || refinement.isDegraded();
  }
}
