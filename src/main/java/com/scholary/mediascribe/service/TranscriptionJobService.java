package com.scholary.mediascribe.service;

import com.scholary.mediascribe.acquisition.AcquisitionRoute;
import com.scholary.mediascribe.acquisition.MediaRequest;
import com.scholary.mediascribe.acquisition.MediaSourceResolver;
import com.scholary.mediascribe.api.JobStatusResponse.Status;
import com.scholary.mediascribe.job.JobProgressReporter;
import com.scholary.mediascribe.job.JobRepository;
import com.scholary.mediascribe.job.TranscriptionJob;
import com.scholary.mediascribe.logging.StructuredLogger;
import com.scholary.mediascribe.progress.NoopProgressReporter;
import com.scholary.mediascribe.progress.ProgressReporter;
import com.scholary.mediascribe.relay.RelayCorrelator;
import com.scholary.mediascribe.relay.RelayTag;
import com.scholary.mediascribe.relay.RelayedMediaHandler;
import com.scholary.mediascribe.telegram.ChannelProgressReporter;
import com.scholary.mediascribe.telegram.TelegramApiException;
import com.scholary.mediascribe.telegram.TelegramBotClient;
import com.scholary.mediascribe.telegram.TranscriptDelivery;
import java.nio.file.Path;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Creates transcription jobs and runs them on the pipeline executor.
 *
 * <p>Jobs from chats get a status message that is edited as the pipeline advances, and the result
 * (or the failure) is sent back to the chat. REST jobs only report through the job record.
 */
@Service
public class TranscriptionJobService implements RelayedMediaHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionJobService.class);

  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);
  private final PipelineOrchestrator orchestrator;
  private final JobRepository jobRepository;
  private final TelegramBotClient bot;
  private final TranscriptDelivery delivery;
  private final MediaSourceResolver resolver;
  private final RelayCorrelator relayCorrelator;
  private final Executor executor;

  public TranscriptionJobService(
      PipelineOrchestrator orchestrator,
      JobRepository jobRepository,
      TelegramBotClient bot,
      TranscriptDelivery delivery,
      MediaSourceResolver resolver,
      RelayCorrelator relayCorrelator,
      @Qualifier("taskExecutor") Executor executor) {
    this.orchestrator = orchestrator;
    this.jobRepository = jobRepository;
    this.bot = bot;
    this.delivery = delivery;
    this.resolver = resolver;
    this.relayCorrelator = relayCorrelator;
    this.executor = executor;
  }

  /** Start a job whose progress is only visible through {@link #findJob(String)}. */
  public TranscriptionJob submit(MediaRequest request) {
    return start(request, NoopProgressReporter.INSTANCE, null);
  }

  /** Start a job for a chat message, reporting progress and the result to that chat. */
  public TranscriptionJob submitFromChat(MediaRequest request) {
    if (request.chatId() == null) {
      return submit(request);
    }
    return start(request, openStatusMessage(request.chatId()), request.chatId());
  }

  public Optional<TranscriptionJob> findJob(String jobId) {
    return jobRepository.findById(jobId);
  }

  @Override
  public void handleRelayed(RelayTag origin, Path file) {
    LOGGER.info("Starting job for relayed file: origin={}, file={}", origin.format(), file);
    MediaRequest request =
        new MediaRequest(
            String.valueOf(origin.chatId()),
            origin.chatId(),
            origin.messageId(),
            0,
            0,
            AcquisitionRoute.DIRECT,
            null,
            null,
            null,
            file,
            null,
            null);
    submitFromChat(request);
  }

  private TranscriptionJob start(MediaRequest request, ProgressReporter progress, Long chatId) {
    TranscriptionJob job = new TranscriptionJob(UUID.randomUUID().toString(), request);
    jobRepository.save(job);
    LOGGER.info(
        "Created transcription job: jobId={}, requester={}, route={}",
        job.getJobId(),
        request.requesterId(),
        request.route());

    if (resolver.needsRelay(request)) {
      executor.execute(() -> startRelay(job, progress, chatId));
    } else {
      executor.execute(() -> runJob(job, request, progress, chatId));
    }
    return job;
  }

  /**
   * Copy the request into the relay chat and run the pipeline once the file arrives. No pipeline
   * thread is held while the relay is pending.
   */
  void startRelay(TranscriptionJob job, ProgressReporter progress, Long chatId) {
    MediaRequest request = job.getRequest();
    StructuredLogger.setJobContext(job.getJobId(), request.requesterId());
    CompletableFuture<Path> relayed;
    try {
      job.setStatus(Status.PROCESSING);
      job.setProgress(5);
      jobRepository.save(job);
      structuredLogger.logJobProgress(job.getJobId(), "relaying", 5);
      progress.update("Large file, fetching it through the relay...");
      relayed =
          relayCorrelator.acquireAsync(
              request.withRoute(AcquisitionRoute.RELAY), progress.statusMessageId());
    } catch (RuntimeException e) {
      fail(job, e, progress, chatId);
      return;
    } finally {
      StructuredLogger.clearJobContext();
    }

    relayed.whenCompleteAsync(
        (file, error) -> {
          if (error == null) {
            runJob(job, request.withLocalFile(file), progress, chatId);
            return;
          }
          StructuredLogger.setJobContext(job.getJobId(), request.requesterId());
          try {
            fail(job, unwrap(error), progress, chatId);
          } finally {
            StructuredLogger.clearJobContext();
          }
        },
        executor);
  }

  void runJob(TranscriptionJob job, MediaRequest request, ProgressReporter progress, Long chatId) {
    StructuredLogger.setJobContext(job.getJobId(), request.requesterId());
    try {
      job.setStatus(Status.PROCESSING);
      job.setProgress(10);
      jobRepository.save(job);
      structuredLogger.logJobProgress(job.getJobId(), "processing", 10);

      PipelineResult result = orchestrator.run(request, new JobProgressReporter(job, progress));

      job.setStatus(Status.COMPLETED);
      job.setProgress(100);
      job.setResult(result);
      jobRepository.save(job);
      structuredLogger.logJobProgress(job.getJobId(), "completed", 100);

      progress.update("Transcription complete.");
      if (chatId != null) {
        delivery.deliver(chatId, result.transcript());
      }

    } catch (RuntimeException e) {
      fail(job, e, progress, chatId);
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private void fail(TranscriptionJob job, Throwable error, ProgressReporter progress, Long chatId) {
    LOGGER.error("Transcription job failed: jobId={}", job.getJobId(), error);
    job.setStatus(Status.FAILED);
    job.setError(error.getMessage());
    jobRepository.save(job);

    progress.update("Transcription failed.");
    if (chatId != null) {
      delivery.deliverFailure(chatId, error.getMessage());
    }
  }

  private static Throwable unwrap(Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }

  private ProgressReporter openStatusMessage(long chatId) {
    try {
      long messageId = bot.sendMessage(chatId, "Request received, processing...");
      return new ChannelProgressReporter(bot, chatId, messageId);
    } catch (TelegramApiException e) {
      LOGGER.warn(
          "Could not send status message, continuing without progress: chat={}, error={}",
          chatId,
          e.getMessage());
      return NoopProgressReporter.INSTANCE;
    }
  }
}
