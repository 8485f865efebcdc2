package com.scholary.discussion.llm;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the chat-completions API used for analysis. */
@ConfigurationProperties(prefix = "llm")
@Validated
public record LlmProperties(
    @NotBlank String baseUrl,
    @NotBlank String apiKey,
    @NotBlank String model,
    @PositiveOrZero double temperature,
    @Positive int maxTokens,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries,
    @Positive long rateLimitBaseDelayMs) {}
