package com.scholary.discussion.archive;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the artifact archive ({@code archive.*}).
 *
 * <p>The archive is off unless {@code enabled} is set; the connection settings are only used then.
 */
@ConfigurationProperties(prefix = "archive")
@Validated
public record ObjectStoreProperties(
    boolean enabled,
    @NotBlank String endpoint,
    @NotBlank String accessKey,
    @NotBlank String secretKey,
    @NotBlank String bucket,
    String region,
    boolean pathStyleAccess,
    @Positive int presignTtlHours) {}
