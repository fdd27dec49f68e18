package com.scholary.mediascribe.whisper;

/**
 * A non-2xx answer from the transcription service.
 *
 * <p>Caught inside {@link WhisperClient}; the window it belongs to is transcribed as empty text.
 */
public class WhisperException extends RuntimeException {

  private final int statusCode;

  public WhisperException(int statusCode, String message) {
    super(message);
    this.statusCode = statusCode;
  }

  public int getStatusCode() {
    return statusCode;
  }
}
