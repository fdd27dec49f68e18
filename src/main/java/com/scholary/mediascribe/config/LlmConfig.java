package com.scholary.mediascribe.config;

import com.scholary.mediascribe.llm.LlmProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the chat-completion client and model cascade.
 *
 * <p>Enables the LlmProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(LlmProperties.class)
public class LlmConfig {}
