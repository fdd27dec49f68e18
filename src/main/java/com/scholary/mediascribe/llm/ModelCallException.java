package com.scholary.mediascribe.llm;

/**
 * Exception thrown when a single chat-completion call fails.
 *
 * <p>Carries the HTTP status, or {@link #TRANSPORT_FAILURE} when no response was received.
 */
public class ModelCallException extends RuntimeException {

  public static final int TRANSPORT_FAILURE = -1;

  private final int status;

  public ModelCallException(int status, String message) {
    super(message);
    this.status = status;
  }

  public ModelCallException(int status, String message, Throwable cause) {
    super(message, cause);
    this.status = status;
  }

  public int getStatus() {
    return status;
  }

  public boolean isAuthorizationFailure() {
    return status == 401;
  }
}
