package com.scholary.discussion.analysis.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Complete result of one analysis run.
 *
 * <p>Immutable. A rerun produces a new instance that replaces the previous one as a whole. A
 * degraded result is one built when the model output could not be used; it carries a reason and
 * placeholder entries that are clearly labelled as such.
 */
public record CategoryResults(
    Map<AnalysisCategory, CategoryWinner> winners,
    Map<TopFiveCategory, TopFiveList> topFiveLists,
    List<QuestionAnswer> openingQuestions,
    boolean degraded,
    String degradedReason) {

  public static final String UNAVAILABLE_LABEL = "Analysis unavailable";

  public CategoryResults {
    winners = copyOf(winners, AnalysisCategory.class);
    topFiveLists = copyOf(topFiveLists, TopFiveCategory.class);
    openingQuestions = openingQuestions == null ? List.of() : List.copyOf(openingQuestions);
  }

  public static CategoryResults of(
      Map<AnalysisCategory, CategoryWinner> winners,
      Map<TopFiveCategory, TopFiveList> topFiveLists,
      List<QuestionAnswer> openingQuestions) {
    return new CategoryResults(winners, topFiveLists, openingQuestions, false, null);
  }

  /**
   * Deterministic placeholder result used when no analysis could be produced.
   *
   * <p>Each ranked list holds one entry labelled {@value #UNAVAILABLE_LABEL} with a zero score. No
   * category winners are invented.
   */
  public static CategoryResults degraded(String reason) {
    Map<TopFiveCategory, TopFiveList> lists = new EnumMap<>(TopFiveCategory.class);
    for (TopFiveCategory category : TopFiveCategory.values()) {
      TopFiveEntry placeholder =
          new TopFiveEntry(
              1,
              UNAVAILABLE_LABEL,
              "0:00",
              "[" + UNAVAILABLE_LABEL + ": " + reason + "]",
              "",
              AudioQuality.CLEAR,
              0.0,
              reason,
              null,
              null,
              null,
              null);
      lists.put(category, new TopFiveList(List.of(placeholder)));
    }
    return new CategoryResults(Map.of(), lists, List.of(), true, reason);
  }

  public Optional<CategoryWinner> winner(AnalysisCategory category) {
    return Optional.ofNullable(winners.get(category));
  }

  public TopFiveList topFive(TopFiveCategory category) {
    return topFiveLists.getOrDefault(category, new TopFiveList(List.of()));
  }

  /** Number of categories and ranked lists that carry at least one result. */
  public int populatedCategoryCount() {
    int count = winners.size();
    for (TopFiveList list : topFiveLists.values()) {
      if (!list.isEmpty()) {
        count++;
      }
    }
    return count;
  }

  public boolean isEmpty() {
    return populatedCategoryCount() == 0 && openingQuestions.isEmpty();
  }

  /** Apply one speaker-name transform to every winner, runner-up, ranked entry and answer. */
  public CategoryResults mapSpeakers(UnaryOperator<String> speakerMapper) {
    Map<AnalysisCategory, CategoryWinner> mappedWinners = new EnumMap<>(AnalysisCategory.class);
    winners.forEach(
        (category, winner) ->
            mappedWinners.put(
                category,
                winner.withSpeakers(
                    speakerMapper.apply(winner.speaker()),
                    winner.runnersUp().stream()
                        .map(r -> r.withSpeaker(speakerMapper.apply(r.speaker())))
                        .collect(Collectors.toList()))));

    Map<TopFiveCategory, TopFiveList> mappedLists = new EnumMap<>(TopFiveCategory.class);
    topFiveLists.forEach(
        (category, list) ->
            mappedLists.put(
                category, list.map(e -> e.withSpeaker(speakerMapper.apply(e.speaker())))));

    List<QuestionAnswer> mappedQuestions =
        openingQuestions.stream()
            .map(q -> q.withSpeaker(speakerMapper.apply(q.speaker())))
            .collect(Collectors.toList());

    return new CategoryResults(
        mappedWinners, mappedLists, mappedQuestions, degraded, degradedReason);
  }

  /** Rebuild winners and ranked entries, typically to attach clip URLs. */
  public CategoryResults mapHighlights(
      BiFunction<AnalysisCategory, CategoryWinner, CategoryWinner> winnerMapper,
      BiFunction<TopFiveCategory, TopFiveEntry, TopFiveEntry> entryMapper) {
    Map<AnalysisCategory, CategoryWinner> mappedWinners = new EnumMap<>(AnalysisCategory.class);
    winners.forEach(
        (category, winner) -> mappedWinners.put(category, winnerMapper.apply(category, winner)));

    Map<TopFiveCategory, TopFiveList> mappedLists = new EnumMap<>(TopFiveCategory.class);
    topFiveLists.forEach(
        (category, list) ->
            mappedLists.put(category, list.map(e -> entryMapper.apply(category, e))));

    return new CategoryResults(
        mappedWinners, mappedLists, openingQuestions, degraded, degradedReason);
  }

  private static <K extends Enum<K>, V> Map<K, V> copyOf(Map<K, V> source, Class<K> keyType) {
    EnumMap<K, V> copy = new EnumMap<>(keyType);
    if (source != null) {
      source.forEach(
          (key, value) -> {
            if (value != null) {
              copy.put(key, value);
            }
          });
    }
    return Collections.unmodifiableMap(copy);
  }
}
