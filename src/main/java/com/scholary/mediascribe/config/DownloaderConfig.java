package com.scholary.mediascribe.config;

import com.scholary.mediascribe.acquisition.DownloaderProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for link downloads.
 *
 * <p>Enables the DownloaderProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(DownloaderProperties.class)
public class DownloaderConfig {}
