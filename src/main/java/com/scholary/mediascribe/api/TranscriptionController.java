package com.scholary.mediascribe.api;

import com.scholary.mediascribe.acquisition.MediaRequest;
import com.scholary.mediascribe.cache.ResultCache;
import com.scholary.mediascribe.config.PipelineProperties;
import com.scholary.mediascribe.job.TranscriptionJob;
import com.scholary.mediascribe.service.SummaryService;
import com.scholary.mediascribe.service.TranscriptionJobService;
import com.scholary.mediascribe.summary.SummaryKind;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST API for transcription.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Asynchronous transcription of links, Telegram files and uploads (returns job ID
 *       immediately)
 *   <li>Job status polling
 *   <li>The latest transcript of a requester and summaries of it
 * </ul>
 */
@RestController
@Tag(name = "Transcription", description = "Media transcription and summary API")
public class TranscriptionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionController.class);

  private final TranscriptionJobService jobService;
  private final ResultCache resultCache;
  private final SummaryService summaryService;
  private final Path workDir;

  public TranscriptionController(
      TranscriptionJobService jobService,
      ResultCache resultCache,
      SummaryService summaryService,
      PipelineProperties properties) {
    this.jobService = jobService;
    this.resultCache = resultCache;
    this.summaryService = summaryService;
    this.workDir = Path.of(properties.workDir());
  }

  /** Start asynchronous transcription of a link or a Telegram message. */
  @PostMapping("/api/transcriptions")
  @Operation(
      summary = "Start transcription",
      description = "Start asynchronous transcription job and return job ID for status polling")
  public ResponseEntity<AsyncJobResponse> transcribe(
      @Valid @RequestBody TranscriptionRequest request) {
    MediaRequest mediaRequest = request.toMediaRequest();
    LOGGER.info(
        "Transcription request: requester={}, route={}", request.requesterId(), request.route());

    TranscriptionJob job =
        mediaRequest.chatId() != null
            ? jobService.submitFromChat(mediaRequest)
            : jobService.submit(mediaRequest);
    return ResponseEntity.accepted().body(new AsyncJobResponse(job.getJobId()));
  }

  /** Start asynchronous transcription of an uploaded file. */
  @PostMapping(value = "/api/transcriptions/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Upload and transcribe",
      description = "Store the uploaded media and start an asynchronous transcription job")
  public ResponseEntity<AsyncJobResponse> upload(
      @RequestParam("file") MultipartFile file, @RequestParam("requesterId") String requesterId)
      throws IOException {
    if (file.isEmpty()) {
      throw new IllegalArgumentException("Uploaded file is empty");
    }
    if (requesterId.isBlank()) {
      throw new IllegalArgumentException("requesterId is required");
    }

    String originalName =
        file.getOriginalFilename() == null ? "upload" : file.getOriginalFilename();
    Files.createDirectories(workDir);
    Path target =
        workDir.resolve(
            "upload_" + UUID.randomUUID() + "_" + originalName.replaceAll("[^A-Za-z0-9._-]", "_"));
    try (InputStream in = file.getInputStream()) {
      Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
    }
    LOGGER.info(
        "Upload stored: requester={}, name={}, bytes={}",
        requesterId,
        originalName,
        file.getSize());

    TranscriptionJob job =
        jobService.submit(MediaRequest.upload(requesterId, target, originalName));
    return ResponseEntity.accepted().body(new AsyncJobResponse(job.getJobId()));
  }

  /**
   * Get job status.
   *
   * <p>If the job is completed, includes the transcript.
   */
  @GetMapping("/api/jobs/{id}")
  @Operation(summary = "Get job status", description = "Check the status of a transcription job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    return jobService
        .findJob(id)
        .map(
            job ->
                ResponseEntity.ok(
                    new JobStatusResponse(
                        job.getJobId(),
                        job.getStatus(),
                        job.getProgress(),
                        job.getStatusText(),
                        job.getResult() == null
                            ? null
                            : ResultResponse.of(
                                job.getRequest().requesterId(),
                                job.getResult().version(),
                                job.getResult().transcript(),
                                null),
                        job.getError())))
        .orElse(ResponseEntity.notFound().build());
  }

  @GetMapping("/api/results/{requesterId}")
  @Operation(
      summary = "Get latest transcript",
      description = "Return the latest raw and formatted transcript of a requester")
  public ResponseEntity<ResultResponse> getResult(@PathVariable String requesterId) {
    return resultCache
        .find(requesterId)
        .map(entry -> ResponseEntity.ok(ResultResponse.from(entry)))
        .orElse(ResponseEntity.notFound().build());
  }

  @PostMapping("/api/results/{requesterId}/summaries/{kind}")
  @Operation(
      summary = "Summarize latest transcript",
      description = "Return a brief or detailed summary, computing it on first request")
  public ResponseEntity<SummaryResponse> summarize(
      @PathVariable String requesterId, @PathVariable String kind) {
    SummaryKind summaryKind = SummaryKind.fromString(kind);
    return summaryService
        .summarize(requesterId, summaryKind)
        .map(outcome -> ResponseEntity.ok(SummaryResponse.from(requesterId, outcome)))
        .orElse(ResponseEntity.notFound().build());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException e) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", e.getMessage()));
  }
}
