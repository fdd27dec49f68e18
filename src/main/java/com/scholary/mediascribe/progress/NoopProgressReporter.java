package com.scholary.mediascribe.progress;

/** Discards status updates. Used for API jobs and when no status message could be created. */
public final class NoopProgressReporter implements ProgressReporter {

  public static final NoopProgressReporter INSTANCE = new NoopProgressReporter();

  private NoopProgressReporter() {}

  @Override
  public void update(String status) {
    // nothing to report to
  }
}
