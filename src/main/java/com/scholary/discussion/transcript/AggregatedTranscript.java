package com.scholary.discussion.transcript;

import java.util.List;

/**
 * The transcript document handed to the analysis model.
 *
 * @param text the document, never longer than the budget it was built for
 * @param truncated whether any transcript was shortened
 * @param fromMaster whether the master recording was used
 * @param includedFiles files whose transcript is in the document
 * @param skippedFiles files left out because the budget ran out
 */
public record AggregatedTranscript(
    String text,
    boolean truncated,
    boolean fromMaster,
    List<String> includedFiles,
    List<String> skippedFiles) {

  public AggregatedTranscript {
    includedFiles = List.copyOf(includedFiles);
    skippedFiles = List.copyOf(skippedFiles);
  }

  public boolean hasContent() {
    return !includedFiles.isEmpty();
  }
}
