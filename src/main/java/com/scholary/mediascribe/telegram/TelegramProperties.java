package com.scholary.mediascribe.telegram;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Telegram bot (the primary identity).
 *
 * <p>{@code directDownloadLimitBytes} is the largest file the Bot API lets the bot download; larger
 * files go through the relay.
 */
@ConfigurationProperties(prefix = "telegram")
@Validated
public record TelegramProperties(
    String botToken,
    @NotBlank String apiBaseUrl,
    @Positive long directDownloadLimitBytes,
    @Positive int longMessageThreshold,
    @Valid @NotNull Polling polling) {

  public record Polling(
      boolean enabled, @Positive int timeoutSeconds, @Positive long fixedDelayMillis) {}
}
