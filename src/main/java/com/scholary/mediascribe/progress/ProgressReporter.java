package com.scholary.mediascribe.progress;

/**
 * Receives human-readable status updates while a request moves through the pipeline.
 *
 * <p>Implementations must not throw: a status update that cannot be delivered is not a reason to
 * abort the work it describes.
 */
public interface ProgressReporter {

  void update(String status);

  /** Id of the chat message showing the status, or null when there is none. */
  default Long statusMessageId() {
    return null;
  }
}
