package com.scholary.mediascribe.config;

import com.scholary.mediascribe.relay.RelayProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the relay path.
 *
 * <p>Enables the RelayProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(RelayProperties.class)
public class RelayConfig {}
