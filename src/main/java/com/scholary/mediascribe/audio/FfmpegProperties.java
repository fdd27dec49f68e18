package com.scholary.mediascribe.audio;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg decoding.
 *
 * <p>The defaults (16 kHz, mono) match what speech-to-text services expect.
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    @NotBlank String binary,
    @Positive int sampleRate,
    @Positive int channels,
    @Positive int timeoutSeconds) {}
