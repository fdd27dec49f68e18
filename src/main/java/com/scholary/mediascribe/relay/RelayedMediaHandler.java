package com.scholary.mediascribe.relay;

import java.nio.file.Path;

/** Receives relayed files that no request was waiting for. */
public interface RelayedMediaHandler {

  /**
   * Start processing a relayed file.
   *
   * @param origin the requester's original message
   * @param file the downloaded media
   */
  void handleRelayed(RelayTag origin, Path file);
}
