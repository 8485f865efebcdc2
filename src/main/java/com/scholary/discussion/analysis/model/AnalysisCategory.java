package com.scholary.discussion.analysis.model;

import java.util.Locale;

/**
 * Single-winner highlight categories.
 *
 * <p>Each category knows the key it has in the flat response shape, and the section and key it has
 * in the nested shape.
 */
public enum AnalysisCategory {
  BEST_JOKE("Best Joke", "BestJoke", Section.COMEDY, "best_joke"),
  MOST_OFFENSIVE_TAKE(
      "Most Offensive Take", "MostOffensiveTake", Section.COMEDY, "most_offensive_take"),
  BEST_ROAST("Best Roast", "BestRoast", Section.COMEDY, "best_roast"),
  FUNNIEST_RANDOM_TANGENT(
      "Funniest Random Tangent",
      "FunniestRandomTangent",
      Section.COMEDY,
      "funniest_random_tangent"),
  HOTTEST_TAKE("Hottest Take", "HottestTake", Section.OPINION, "hottest_take"),
  MOST_PASSIONATE_DEFENSE(
      "Most Passionate Defense",
      "MostPassionateDefense",
      Section.OPINION,
      "most_passionate_defense"),
  MOVIE_SNOB_MOMENT("Movie Snob Moment", "MovieSnobMoment", Section.OPINION, "movie_snob_moment"),
  GUILTY_PLEASURE_ADMISSION(
      "Guilty Pleasure Admission",
      "GuiltyPleasureAdmission",
      Section.OPINION,
      "guilty_pleasure_admission"),
  BEST_PLOT_TWIST_REVELATION(
      "Best Plot Twist Revelation", "BestPlotTwistRevelation", Section.INSIGHT, "best_plot_twist"),
  QUIETEST_PERSON_BEST_MOMENT(
      "Quietest Person's Best Moment",
      "QuietestPersonBestMoment",
      Section.INSIGHT,
      "quietest_person_best_moment"),
  BIGGEST_ARGUMENT_STARTER(
      "Biggest Argument Starter",
      "BiggestArgumentStarter",
      Section.DISCUSSION,
      "biggest_argument_starter"),
  BIGGEST_UNANIMOUS_REACTION(
      "Biggest Unanimous Reaction",
      "BiggestUnanimousReaction",
      Section.DISCUSSION,
      "biggest_unanimous_reaction"),
  MOST_BORING_STATEMENT(
      "Most Boring Statement", "MostBoringStatement", Section.DISCUSSION, "most_boring_statement");

  private final String displayName;
  private final String flatKey;
  private final Section section;
  private final String nestedKey;

  AnalysisCategory(String displayName, String flatKey, Section section, String nestedKey) {
    this.displayName = displayName;
    this.flatKey = flatKey;
    this.section = section;
    this.nestedKey = nestedKey;
  }

  public String displayName() {
    return displayName;
  }

  public String flatKey() {
    return flatKey;
  }

  public Section section() {
    return section;
  }

  public String nestedKey() {
    return nestedKey;
  }

  /**
   * Whether a free-text title (for example a {@code "category"} field) names this category.
   *
   * <p>Case, spaces, underscores, hyphens and apostrophes are ignored; the title may carry extra
   * words around the category name.
   */
  public boolean matchesTitle(String title) {
    return Section.titleMentions(title, nestedKey) || Section.titleMentions(title, displayName);
  }

  /** Sections of the nested response shape. */
  public enum Section {
    COMEDY("comedy_categories", "comedy"),
    OPINION("opinion_categories", "opinion", "opinions"),
    INSIGHT("insight_categories", "insight", "insights"),
    DISCUSSION("discussion_categories", "discussion"),
    TOP_FIVE("top_5_lists", "top_five_lists", "top5", "top_lists");

    private final String key;
    private final String[] aliases;

    Section(String key, String... aliases) {
      this.key = key;
      this.aliases = aliases;
    }

    public String key() {
      return key;
    }

    /** Whether a JSON property name refers to this section. */
    public boolean matchesKey(String propertyName) {
      String candidate = normalize(propertyName);
      if (candidate.equals(normalize(key))) {
        return true;
      }
      for (String alias : aliases) {
        if (candidate.equals(normalize(alias))) {
          return true;
        }
      }
      return false;
    }

    static boolean titleMentions(String title, String name) {
      if (title == null) {
        return false;
      }
      String normalizedTitle = normalize(title);
      String normalizedName = normalize(name);
      return !normalizedTitle.isEmpty() && normalizedTitle.contains(normalizedName);
    }

    public static String normalize(String value) {
      return value.toLowerCase(Locale.ROOT).replaceAll("[\\s_\\-']", "");
    }
  }
}
