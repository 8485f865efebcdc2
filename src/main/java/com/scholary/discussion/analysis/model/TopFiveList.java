package com.scholary.discussion.analysis.model;

import java.util.Comparator;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/** Up to five entries, sorted by rank. */
public record TopFiveList(List<TopFiveEntry> entries) {

  public static final int MAX_ENTRIES = 5;

  public TopFiveList {
    entries =
        entries == null
            ? List.of()
            : entries.stream()
                .sorted(Comparator.comparingInt(TopFiveEntry::rank))
                .limit(MAX_ENTRIES)
                .collect(Collectors.toUnmodifiableList());
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public TopFiveList map(UnaryOperator<TopFiveEntry> mapper) {
    return new TopFiveList(entries.stream().map(mapper).collect(Collectors.toList()));
  }
}
