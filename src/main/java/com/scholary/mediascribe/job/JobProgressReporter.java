package com.scholary.mediascribe.job;

import com.scholary.mediascribe.progress.ProgressReporter;

/** Records each status on the job before passing it on. */
public class JobProgressReporter implements ProgressReporter {

  private final TranscriptionJob job;
  private final ProgressReporter delegate;

  public JobProgressReporter(TranscriptionJob job, ProgressReporter delegate) {
    this.job = job;
    this.delegate = delegate;
  }

  @Override
  public void update(String status) {
    job.setStatusText(status);
    delegate.update(status);
  }

  @Override
  public Long statusMessageId() {
    return delegate.statusMessageId();
  }
}
