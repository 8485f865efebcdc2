package com.scholary.discussion.config;

import com.scholary.discussion.gladia.GladiaProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the Gladia client.
 *
 * <p>Enables the GladiaProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(GladiaProperties.class)
public class GladiaConfig {}
