package com.scholary.discussion.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for session processing.
 *
 * <p>Controls where files live, the transcript budget handed to the model, and how many sessions
 * are processed at once.
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public record PipelineProperties(
    @NotBlank String uploadsRoot,
    @NotBlank String clipsDir,
    @Positive int transcriptBudgetChars,
    @Positive long largeFileThresholdBytes,
    @Positive int executorThreads,
    @Positive int executorQueueSize,
    @Positive int stuckSessionMinutes) {}
