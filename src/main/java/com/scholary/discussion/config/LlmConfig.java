package com.scholary.discussion.config;

import com.scholary.discussion.llm.LlmProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Enables the LlmProperties to be loaded from application.yml. */
@Configuration
@EnableConfigurationProperties(LlmProperties.class)
public class LlmConfig {}
