package com.scholary.mediascribe.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event puts its fields into the MDC only for the duration of the log call, so the
 * surrounding request context (correlationId, jobId) is never overwritten.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log window started event. */
  public void logWindowStarted(int windowIndex, double offsetSeconds, double durationSeconds) {
    try {
      MDC.put("event_type", "window_started");
      MDC.put("window_index", String.valueOf(windowIndex));
      MDC.put("offsetSeconds", String.valueOf(offsetSeconds));
      MDC.put("durationSeconds", String.valueOf(durationSeconds));

      logger.debug(
          "Window started: index={}, offset={}s, duration={}s",
          windowIndex,
          offsetSeconds,
          durationSeconds);
    } finally {
      clearEventFields();
    }
  }

  /** Log window finished event. */
  public void logWindowFinished(int windowIndex, int segmentCount, long transcribeMs) {
    try {
      MDC.put("event_type", "window_finished");
      MDC.put("window_index", String.valueOf(windowIndex));
      MDC.put("segmentCount", String.valueOf(segmentCount));
      MDC.put("transcribeMs", String.valueOf(transcribeMs));

      logger.info(
          "Window finished: index={}, segments={}, transcribe={}ms",
          windowIndex,
          segmentCount,
          transcribeMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log transcription failure event. The window degrades to empty text. */
  public void logTranscribeFailed(int windowIndex, String errorType, String message) {
    try {
      MDC.put("event_type", "transcribe_failed");
      MDC.put("window_index", String.valueOf(windowIndex));
      MDC.put("errorType", errorType);

      logger.warn(
          "Transcribe failed, continuing with empty window: window={}, error={}, message={}",
          windowIndex,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log refinement chunk fallback event. */
  public void logRefineChunkFailed(int chunkIndex, int chunkChars, String reason) {
    try {
      MDC.put("event_type", "refine_chunk_failed");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("chunkChars", String.valueOf(chunkChars));
      MDC.put("reason", reason);

      logger.warn(
          "Refine chunk failed, keeping original text: chunk={}, chars={}, reason={}",
          chunkIndex,
          chunkChars,
          reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log a single model attempt inside a cascade. */
  public void logCascadeAttempt(String model, String encoding, int status, String error) {
    try {
      MDC.put("event_type", "cascade_attempt");
      MDC.put("model", model);
      MDC.put("encoding", encoding);
      MDC.put("status", String.valueOf(status));

      logger.warn(
          "Model attempt failed: model={}, encoding={}, status={}, error={}",
          model,
          encoding,
          status,
          error);
    } finally {
      clearEventFields();
    }
  }

  /** Log cascade exhausted event. */
  public void logCascadeExhausted(int modelCount, int attemptCount) {
    try {
      MDC.put("event_type", "cascade_exhausted");
      MDC.put("modelCount", String.valueOf(modelCount));
      MDC.put("attemptCount", String.valueOf(attemptCount));

      logger.error(
          "Model cascade exhausted: models={}, attempts={}", modelCount, attemptCount);
    } finally {
      clearEventFields();
    }
  }

  /** Log a tagged relay message observed by the secondary account. */
  public void logRelayObserved(long copyMessageId, long originChatId, long originMessageId) {
    try {
      MDC.put("event_type", "relay_observed");
      MDC.put("copyMessageId", String.valueOf(copyMessageId));
      MDC.put("originChatId", String.valueOf(originChatId));
      MDC.put("originMessageId", String.valueOf(originMessageId));

      logger.info(
          "Relay message observed: copy={}, originChat={}, originMessage={}",
          copyMessageId,
          originChatId,
          originMessageId);
    } finally {
      clearEventFields();
    }
  }

  /** Log relay monitor restart event. */
  public void logMonitorRestart(int restartCount, int maxRestarts, long backoffMs, String error) {
    try {
      MDC.put("event_type", "monitor_restart");
      MDC.put("restartCount", String.valueOf(restartCount));
      MDC.put("maxRestarts", String.valueOf(maxRestarts));
      MDC.put("backoffMs", String.valueOf(backoffMs));

      logger.warn(
          "Relay monitor fault, restarting: restart={}/{}, backoff={}ms, error={}",
          restartCount,
          maxRestarts,
          backoffMs,
          error);
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event. */
  public void logJobProgress(String jobId, String phase, int percentComplete) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("phase", phase);
      MDC.put("percentComplete", String.valueOf(percentComplete));

      logger.info("Job progress: jobId={}, phase={}, progress={}%", jobId, phase, percentComplete);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String requesterId) {
    MDC.put("jobId", jobId);
    MDC.put("requesterId", requesterId);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("requesterId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("window_index");
    MDC.remove("chunk_index");
    MDC.remove("offsetSeconds");
    MDC.remove("durationSeconds");
    MDC.remove("segmentCount");
    MDC.remove("transcribeMs");
    MDC.remove("errorType");
    MDC.remove("chunkChars");
    MDC.remove("reason");
    MDC.remove("model");
    MDC.remove("encoding");
    MDC.remove("status");
    MDC.remove("modelCount");
    MDC.remove("attemptCount");
    MDC.remove("copyMessageId");
    MDC.remove("originChatId");
    MDC.remove("originMessageId");
    MDC.remove("restartCount");
    MDC.remove("maxRestarts");
    MDC.remove("backoffMs");
    MDC.remove("phase");
    MDC.remove("percentComplete");
  }
}
