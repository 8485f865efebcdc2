package com.scholary.discussion.gladia;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Gladia transcription API.
 *
 * <p>Timeouts are in seconds. Upload retries back off from {@code retryBaseDelayMs}, doubling on
 * each attempt.
 */
@ConfigurationProperties(prefix = "gladia")
@Validated
public record GladiaProperties(
    @NotBlank String baseUrl,
    @NotBlank String apiKey,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries,
    @Positive long retryBaseDelayMs,
    @Positive int pollIntervalSeconds,
    @Positive int pollTimeoutMinutes,
    @NotBlank String language) {}
