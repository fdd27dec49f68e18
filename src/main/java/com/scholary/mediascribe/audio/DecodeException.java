package com.scholary.mediascribe.audio;

/**
 * Exception thrown when media cannot be decoded into PCM audio.
 *
 * <p>Always fatal for the request: the pipeline has nothing to transcribe.
 */
public class DecodeException extends RuntimeException {

  public DecodeException(String message) {
    super(message);
  }

  public DecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
