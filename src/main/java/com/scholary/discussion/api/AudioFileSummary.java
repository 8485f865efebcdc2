package com.scholary.discussion.api;

import com.scholary.discussion.session.AudioFile;
import com.scholary.discussion.session.AudioProcessingStatus;

/** Per-file view returned with a session; transcript text is left out. */
public record AudioFileSummary(
    String fileName,
    Integer speakerNumber,
    boolean masterRecording,
    AudioProcessingStatus processingStatus,
    Double durationSeconds,
    boolean hasTranscript,
    String error,
    boolean retryEligible) {

  public static AudioFileSummary from(AudioFile file) {
    return new AudioFileSummary(
        file.getFileName(),
        file.getSpeakerNumber(),
        file.isMasterRecording(),
        file.getProcessingStatus(),
        file.getDurationSeconds(),
        file.hasTranscript(),
        file.getConversionError(),
        file.isRetryEligible());
  }
}
