package com.scholary.discussion.gladia;

import com.scholary.discussion.classify.AudioFileNames;

/**
 * Per-file options for a transcription job.
 *
 * @param speakerCount expected number of speakers
 * @param diarization whether the service should separate speakers
 */
public record TranscriptionOptions(int speakerCount, boolean diarization) {

  public static final int MAX_SPEAKERS = 8;

  /**
   * Options for a file. Single-source recordings (personal mics, phone, sound pad, USB inputs)
   * have one speaker and no diarization; mixes get at least two speakers.
   */
  public static TranscriptionOptions forFile(String fileName, int assignedParticipants) {
    if (AudioFileNames.isSingleSource(fileName)) {
      return new TranscriptionOptions(1, false);
    }
    return new TranscriptionOptions(Math.max(2, assignedParticipants), true);
  }

  public int minSpeakers() {
    return Math.max(1, speakerCount - 1);
  }

  public int maxSpeakers() {
    return Math.min(MAX_SPEAKERS, speakerCount + 1);
  }

  public boolean enhancedDiarization() {
    return speakerCount <= 2;
  }
}
