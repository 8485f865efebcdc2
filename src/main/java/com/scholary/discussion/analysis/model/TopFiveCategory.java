package com.scholary.discussion.analysis.model;

/** Ranked categories, each holding up to five quotes. */
public enum TopFiveCategory {
  FUNNIEST_SENTENCES("Top 5 Funniest Sentences", "Top5FunniestSentences", "funniest_sentences"),
  MOST_BLAND_COMMENTS("Top 5 Most Bland Comments", "Top5MostBlandComments", "most_bland_comments");

  private final String displayName;
  private final String flatKey;
  private final String nestedKey;

  TopFiveCategory(String displayName, String flatKey, String nestedKey) {
    this.displayName = displayName;
    this.flatKey = flatKey;
    this.nestedKey = nestedKey;
  }

  public String displayName() {
    return displayName;
  }

  public String flatKey() {
    return flatKey;
  }

  public String nestedKey() {
    return nestedKey;
  }

  public boolean matchesTitle(String title) {
    return AnalysisCategory.Section.titleMentions(title, nestedKey);
  }
}
