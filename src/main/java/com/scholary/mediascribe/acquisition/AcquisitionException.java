package com.scholary.mediascribe.acquisition;

/**
 * Exception thrown when the media for a request cannot be brought to local disk.
 *
 * <p>Always fatal for the request.
 */
public class AcquisitionException extends RuntimeException {

  public AcquisitionException(String message) {
    super(message);
  }

  public AcquisitionException(String message, Throwable cause) {
    super(message, cause);
  }
}
