package com.scholary.mediascribe.relay;

/** Exception thrown when a relay monitor poll fails as a whole. */
public class RelayMonitorException extends RuntimeException {

  public RelayMonitorException(String message) {
    super(message);
  }

  public RelayMonitorException(String message, Throwable cause) {
    super(message, cause);
  }
}
