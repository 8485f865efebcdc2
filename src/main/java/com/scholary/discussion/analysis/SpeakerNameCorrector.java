package com.scholary.discussion.analysis;

import com.scholary.discussion.analysis.model.CategoryResults;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Replaces speaker names the transcription service commonly mishears with the participant's real
 * name, across every winner, runner-up, ranked entry and answer of a result.
 */
@Component
public class SpeakerNameCorrector {

  private final Map<String, String> corrections = new HashMap<>();

  public SpeakerNameCorrector(AnalysisProperties properties) {
    properties
        .speakerCorrections()
        .forEach((heard, actual) -> corrections.put(key(heard), actual));
  }

  public CategoryResults correct(CategoryResults results) {
    if (corrections.isEmpty()) {
      return results;
    }
    return results.mapSpeakers(this::correctName);
  }

  String correctName(String speaker) {
    if (speaker == null) {
      return null;
    }
    return corrections.getOrDefault(key(speaker), speaker);
  }

  private static String key(String name) {
    return name.trim().toLowerCase(Locale.ROOT);
  }
}
