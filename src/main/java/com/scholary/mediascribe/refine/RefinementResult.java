package com.scholary.mediascribe.refine;

/**
 * Output of a refinement pass.
 *
 * @param text the reassembled transcript
 * @param refinedChunks chunks the model formatted
 * @param fallbackChunks chunks kept as original text because formatting failed
 */
public record RefinementResult(String text, int refinedChunks, int fallbackChunks) {

  public boolean isDegraded() {
    return fallbackChunks > 0;
  }
}
