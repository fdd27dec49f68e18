package com.scholary.mediascribe.relay;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the relay path.
 *
 * <p>The relay chat is shared by the bot and the secondary account. The backoff and restart values
 * bound how the monitor recovers from faults before its circuit breaker opens.
 */
@ConfigurationProperties(prefix = "relay")
@Validated
public record RelayProperties(
    boolean enabled,
    long chatId,
    @NotBlank String gatewayBaseUrl,
    String gatewayToken,
    @Positive long pollIntervalMillis,
    @Positive int pollBatchSize,
    @Positive int scanDepth,
    @Positive int directFetchAttempts,
    @PositiveOrZero long directFetchDelayMillis,
    @Positive int correlationTimeoutMinutes,
    @Positive long backoffInitialMillis,
    @Positive long backoffMaxMillis,
    @Positive int maxConsecutiveRestarts) {}
