package com.scholary.mediascribe.acquisition;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for link downloads. */
@ConfigurationProperties(prefix = "downloader")
@Validated
public record DownloaderProperties(
    @NotBlank String ytdlpBinary,
    @Positive int ytdlpTimeoutMinutes,
    @Positive int httpTimeoutSeconds,
    @NotBlank String userAgent,
    @PositiveOrZero int maxRedirects) {}
