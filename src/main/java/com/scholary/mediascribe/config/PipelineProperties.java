package com.scholary.mediascribe.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the transcription pipeline.
 *
 * <p>Controls window sizing, the synthetic timestamp axis, refinement chunking, and the bounds of
 * the in-memory stores.
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public record PipelineProperties(
    @NotBlank String workDir,
    @NotBlank String outputDir,
    @Positive int windowSeconds,
    @Positive int stepSeconds,
    @Positive int wordsPerParagraph,
    @Positive int refineChunkChars,
    boolean boundaryAwareChunking,
    @Positive int minTranscriptChars,
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize,
    @Valid @NotNull StoreProperties resultCache,
    @Valid @NotNull JobStoreProperties jobStore) {

  public record StoreProperties(@Positive long maxSize, @Positive int ttlHours) {}

  public record JobStoreProperties(@Positive long maxSize, @Positive int ttlMinutes) {}
}
