package com.scholary.mediascribe.config;

import com.scholary.mediascribe.audio.FfmpegProperties;
import com.scholary.mediascribe.whisper.WhisperProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Binds the decoding ({@code ffmpeg.*}) and speech-to-text ({@code whisper.*}) settings. */
@Configuration
@EnableConfigurationProperties({FfmpegProperties.class, WhisperProperties.class})
public class TranscriptionConfig {}
