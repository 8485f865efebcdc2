package com.scholary.discussion.analysis.model;

/** One ranked quote in a {@link TopFiveList}. Start and end are in seconds, when known. */
public record TopFiveEntry(
    int rank,
    String speaker,
    String timestamp,
    String quote,
    String context,
    AudioQuality audioQuality,
    double score,
    String reasoning,
    Double startSeconds,
    Double endSeconds,
    String clipUrl,
    String sourceAudioFile) {

  public TopFiveEntry withSpeaker(String newSpeaker) {
    return new TopFiveEntry(
        rank,
        newSpeaker,
        timestamp,
        quote,
        context,
        audioQuality,
        score,
        reasoning,
        startSeconds,
        endSeconds,
        clipUrl,
        sourceAudioFile);
  }

  public TopFiveEntry withClip(String newClipUrl, String newSourceAudioFile) {
    return new TopFiveEntry(
        rank,
        speaker,
        timestamp,
        quote,
        context,
        audioQuality,
        score,
        reasoning,
        startSeconds,
        endSeconds,
        newClipUrl,
        newSourceAudioFile);
  }
}
