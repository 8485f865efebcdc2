package com.scholary.discussion.analysis.model;

import java.util.List;

/**
 * The single best moment for one category.
 *
 * <p>{@code timestamp} refers to the master recording's timeline.
 */
public record CategoryWinner(
    String speaker,
    String timestamp,
    String quote,
    String setup,
    String groupReaction,
    String whyItsGreat,
    AudioQuality audioQuality,
    int entertainmentScore,
    List<RunnerUp> runnersUp,
    String clipUrl,
    String sourceAudioFile) {

  public CategoryWinner {
    runnersUp = runnersUp == null ? List.of() : List.copyOf(runnersUp);
  }

  public CategoryWinner withSpeakers(String newSpeaker, List<RunnerUp> newRunnersUp) {
    return new CategoryWinner(
        newSpeaker,
        timestamp,
        quote,
        setup,
        groupReaction,
        whyItsGreat,
        audioQuality,
        entertainmentScore,
        newRunnersUp,
        clipUrl,
        sourceAudioFile);
  }

  public CategoryWinner withClip(String newClipUrl, String newSourceAudioFile) {
    return new CategoryWinner(
        speaker,
        timestamp,
        quote,
        setup,
        groupReaction,
        whyItsGreat,
        audioQuality,
        entertainmentScore,
        runnersUp,
        newClipUrl,
        newSourceAudioFile);
  }
}
