package com.scholary.mediascribe.config;

import com.scholary.mediascribe.telegram.TelegramProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the Telegram bot.
 *
 * <p>Enables the TelegramProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(TelegramProperties.class)
public class TelegramConfig {}
