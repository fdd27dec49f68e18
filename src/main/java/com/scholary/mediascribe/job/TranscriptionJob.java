package com.scholary.mediascribe.job;

import com.scholary.mediascribe.acquisition.MediaRequest;
import com.scholary.mediascribe.api.JobStatusResponse.Status;
import com.scholary.mediascribe.service.PipelineResult;
import java.time.Instant;

/**
 * Represents an async transcription job.
 *
 * <p>Tracks the job's state, progress, and result. Stored in memory in the {@link JobRepository}.
 */
public class TranscriptionJob {

  private final String jobId;
  private final MediaRequest request;
  private final Instant createdAt;

  private volatile Status status;
  private volatile Integer progress; // 0-100
  private volatile String statusText;
  private volatile PipelineResult result;
  private volatile String error;

  public TranscriptionJob(String jobId, MediaRequest request) {
    this.jobId = jobId;
    this.request = request;
    this.createdAt = Instant.now();
    this.status = Status.PENDING;
    this.progress = 0;
  }

  public String getJobId() {
    return jobId;
  }

  public MediaRequest getRequest() {
    return request;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public Integer getProgress() {
    return progress;
  }

  public void setProgress(Integer progress) {
    this.progress = progress;
  }

  public String getStatusText() {
    return statusText;
  }

  public void setStatusText(String statusText) {
    this.statusText = statusText;
  }

  public PipelineResult getResult() {
    return result;
  }

  public void setResult(PipelineResult result) {
    this.result = result;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }
}
