package com.scholary.mediascribe.relay;

/** Exception thrown when the secondary account cannot be reached or refuses a call. */
public class SecondaryAccountException extends RuntimeException {

  public SecondaryAccountException(String message) {
    super(message);
  }

  public SecondaryAccountException(String message, Throwable cause) {
    super(message, cause);
  }
}
