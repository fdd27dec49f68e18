package com.scholary.mediascribe.telegram;

/**
 * Exception thrown when a Bot API call fails or answers {@code ok=false}.
 *
 * <p>{@code errorCode} is Telegram's {@code error_code} (or the HTTP status), -1 on transport
 * failure.
 */
public class TelegramApiException extends RuntimeException {

  private final int errorCode;

  public TelegramApiException(int errorCode, String message) {
    super(message);
    this.errorCode = errorCode;
  }

  public TelegramApiException(int errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  public int getErrorCode() {
    return errorCode;
  }
}
