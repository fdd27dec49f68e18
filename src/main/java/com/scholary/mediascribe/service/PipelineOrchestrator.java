package com.scholary.mediascribe.service;

import com.scholary.mediascribe.acquisition.MediaRequest;
import com.scholary.mediascribe.acquisition.MediaSourceResolver;
import com.scholary.mediascribe.audio.AudioExtractor;
import com.scholary.mediascribe.audio.AudioSegment;
import com.scholary.mediascribe.audio.Segmenter;
import com.scholary.mediascribe.cache.RequesterResultEntry;
import com.scholary.mediascribe.cache.ResultCache;
import com.scholary.mediascribe.config.PipelineProperties;
import com.scholary.mediascribe.logging.StructuredLogger;
import com.scholary.mediascribe.progress.ProgressReporter;
import com.scholary.mediascribe.refine.RefinementResult;
import com.scholary.mediascribe.refine.TextRefiner;
import com.scholary.mediascribe.transcript.TimestampReconstructor;
import com.scholary.mediascribe.transcript.Transcript;
import com.scholary.mediascribe.transcript.TranscriptWriter;
import com.scholary.mediascribe.transcript.WindowTranscript;
import com.scholary.mediascribe.whisper.TranscriptSegment;
import com.scholary.mediascribe.whisper.WhisperResponse;
import com.scholary.mediascribe.whisper.WhisperService;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Runs one request through the whole pipeline.
 *
 * <p>Stages run strictly in order: resolve, extract, segment, transcribe each window, reconstruct
 * timestamps, write the raw transcript and subtitles, refine, write the formatted transcript,
 * store the result. Acquisition and decode failures abort the run; transcription and refinement
 * failures only degrade the output. Temporary media and audio files are removed however the run
 * ends.
 */
@Service
public class PipelineOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineOrchestrator.class);

  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);
  private final MediaSourceResolver resolver;
  private final AudioExtractor audioExtractor;
  private final Segmenter segmenter;
  private final WhisperService whisperService;
  private final TimestampReconstructor reconstructor;
  private final TextRefiner refiner;
  private final TranscriptWriter writer;
  private final ResultCache resultCache;
  private final Duration window;

  public PipelineOrchestrator(
      MediaSourceResolver resolver,
      AudioExtractor audioExtractor,
      Segmenter segmenter,
      WhisperService whisperService,
      TimestampReconstructor reconstructor,
      TextRefiner refiner,
      TranscriptWriter writer,
      ResultCache resultCache,
      PipelineProperties properties) {
    this.resolver = resolver;
    this.audioExtractor = audioExtractor;
    this.segmenter = segmenter;
    this.whisperService = whisperService;
    this.reconstructor = reconstructor;
    this.refiner = refiner;
    this.writer = writer;
    this.resultCache = resultCache;
    this.window = Duration.ofSeconds(properties.windowSeconds());
  }

  /**
   * Transcribe the media of a request.
   *
   * @throws com.scholary.mediascribe.acquisition.AcquisitionException if the media cannot be
   *     obtained
   * @throws com.scholary.mediascribe.audio.DecodeException if the audio cannot be decoded
   * @throws UncheckedIOException if the transcript files cannot be written
   */
  public PipelineResult run(MediaRequest request, ProgressReporter progress) {
    String correlationId = UUID.randomUUID().toString();
    MDC.put("correlationId", correlationId);

    Path media = null;
    Path wav = null;
    List<AudioSegment> segments = List.of();
    try {
      long startedAt = System.currentTimeMillis();
      LOGGER.info(
          "Pipeline started: requester={}, route={}, source={}",
          request.requesterId(),
          request.route(),
          request.sourceName());

      progress.update("Preparing media...");
      media = resolver.resolve(request, progress);

      progress.update("Extracting audio...");
      wav = audioExtractor.extract(media);

      segments = segmenter.segment(wav, window);
      LOGGER.info("Audio split into {} windows of {}s", segments.size(), window.toSeconds());

      List<WindowTranscript> windows = transcribeAll(segments, progress);
      int emptyWindows = (int) windows.stream().filter(w -> w.text().isBlank()).count();

      String raw = reconstructor.reconstruct(windows);
      List<TranscriptSegment> absolute = reconstructor.shift(windows);
      String sourceName = request.sourceName();
      String runId = request.requesterId() + "_" + correlationId;
      Path rawPath = writer.writeRaw(runId, sourceName, raw);
      Path srtPath = writer.writeSrt(runId, sourceName, absolute);

      progress.update("Formatting transcript...");
      RefinementResult refinement = refiner.refine(raw);
      Path formattedPath = writer.writeFormatted(runId, sourceName, refinement.text());

      Transcript transcript =
          new Transcript(sourceName, raw, refinement.text(), rawPath, formattedPath, srtPath);
      RequesterResultEntry entry = resultCache.store(request.requesterId(), transcript);

      LOGGER.info(
          "Pipeline finished: windows={}, emptyWindows={}, refinedChunks={}, fallbackChunks={},"
              + " chars={}, took={}ms",
          windows.size(),
          emptyWindows,
          refinement.refinedChunks(),
          refinement.fallbackChunks(),
          refinement.text().length(),
          System.currentTimeMillis() - startedAt);

      return new PipelineResult(
          correlationId, transcript, entry.version(), windows.size(), emptyWindows, refinement);

    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write transcript files", e);
    } finally {
      for (AudioSegment segment : segments) {
        deleteQuietly(segment.file());
      }
      deleteQuietly(wav);
      deleteQuietly(media);
      MDC.remove("correlationId");
    }
  }

  private List<WindowTranscript> transcribeAll(
      List<AudioSegment> segments, ProgressReporter progress) {
    List<WindowTranscript> windows = new ArrayList<>(segments.size());

    for (AudioSegment segment : segments) {
      progress.update(
          String.format("Transcribing part %d of %d...", segment.index() + 1, segments.size()));
      structuredLogger.logWindowStarted(
          segment.index(), segment.offsetSeconds(), segment.durationSeconds());

      long start = System.currentTimeMillis();
      WhisperResponse response;
      try {
        response = whisperService.transcribe(segment);
      } finally {
        deleteQuietly(segment.file());
      }
      structuredLogger.logWindowFinished(
          segment.index(), response.segments().size(), System.currentTimeMillis() - start);

      windows.add(
          new WindowTranscript(
              segment.index(), segment.offsetSeconds(), response.text(), response.segments()));
    }
    return windows;
  }

  private static void deleteQuietly(Path file) {
    if (file == null) {
      return;
    }
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete temporary file {}: {}", file, e.getMessage());
    }
  }
}
