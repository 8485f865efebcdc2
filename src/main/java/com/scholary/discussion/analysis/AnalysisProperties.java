package com.scholary.discussion.analysis;

import jakarta.validation.constraints.Positive;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the analysis pass.
 *
 * <p>{@code speakerCorrections} maps names as the transcription service tends to mishear them to
 * the participant's real name.
 */
@ConfigurationProperties(prefix = "analysis")
@Validated
public record AnalysisProperties(
    @Positive int maxConcurrentCalls,
    List<String> discussionQuestions,
    Map<String, String> speakerCorrections) {

  public AnalysisProperties {
    discussionQuestions =
        discussionQuestions == null ? List.of() : List.copyOf(discussionQuestions);
    speakerCorrections = speakerCorrections == null ? Map.of() : Map.copyOf(speakerCorrections);
  }
}
