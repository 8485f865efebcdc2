package com.scholary.discussion.stats;

import java.util.Map;

/**
 * Conversation statistics for a session.
 *
 * <p>Per-speaker maps are keyed by participant name. The "most" and "quietest" fields are null when
 * there is nothing to rank.
 */
public record SessionStats(
    String totalDuration,
    Map<String, Integer> wordCounts,
    Map<String, Integer> questionCounts,
    Map<String, Integer> laughterCounts,
    Map<String, Integer> profanityCounts,
    Map<String, Integer> interruptionCounts,
    int totalWords,
    int totalQuestions,
    int totalLaughter,
    int totalProfanity,
    int totalInterruptions,
    String mostTalkative,
    String quietest,
    String mostInquisitive,
    String biggestInterruptor,
    String mostProfane,
    EnergyLevel energyLevel,
    String conversationTone,
    String technicalQuality,
    int highlightMoments,
    String bestMomentsSummary) {

  public SessionStats {
    wordCounts = Map.copyOf(wordCounts);
    questionCounts = Map.copyOf(questionCounts);
    laughterCounts = Map.copyOf(laughterCounts);
    profanityCounts = Map.copyOf(profanityCounts);
    interruptionCounts = Map.copyOf(interruptionCounts);
  }
}
