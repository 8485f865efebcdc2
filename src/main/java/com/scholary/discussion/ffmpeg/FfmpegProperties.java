package com.scholary.discussion.ffmpeg;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg transcoding.
 *
 * <p>The defaults produce 192 kbit/s stereo MP3 at 44.1 kHz with a slight volume boost, which is
 * what the transcription service handles best for quiet room microphones.
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    @NotBlank String binary,
    @NotBlank String bitrate,
    @Positive int sampleRate,
    @Positive int channels,
    @Positive double volume,
    @Positive int timeoutMinutes) {}
