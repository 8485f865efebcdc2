package com.scholary.discussion.transcript;

import com.scholary.discussion.gladia.GladiaJob.Transcription;
import com.scholary.discussion.gladia.GladiaJob.Utterance;
import java.util.Map;

/** Turns a diarized transcription into one {@code label: text} line per utterance. */
public final class UtteranceFormatter {

  private UtteranceFormatter() {}

  /**
   * Format a transcription. Single-source files label every line with the source; mixed recordings
   * use the participant on the diarized speaker's slot, or {@code Speaker n+1}. Falls back to the
   * full transcript when the service returned no utterances.
   */
  public static String format(
      String fileName, Transcription transcription, Map<Integer, String> micAssignments) {
    if (transcription.utterances().isEmpty()) {
      return transcription.fullTranscript() == null ? "" : transcription.fullTranscript().trim();
    }

    String sourceLabel = SpeakerLabelMapper.sourceLabel(fileName, micAssignments);
    StringBuilder text = new StringBuilder();
    for (Utterance utterance : transcription.utterances()) {
      if (utterance.text() == null || utterance.text().isBlank()) {
        continue;
      }
      String label =
          sourceLabel != null ? sourceLabel : speakerLabel(utterance.speaker(), micAssignments);
      if (text.length() > 0) {
        text.append('\n');
      }
      text.append(label).append(": ").append(utterance.text().trim());
    }
    return text.toString();
  }

  public static String speakerLabel(Integer speaker, Map<Integer, String> micAssignments) {
    if (speaker == null) {
      return "Unknown";
    }
    String name = micAssignments == null ? null : micAssignments.get(speaker);
    return name == null || name.isBlank() ? "Speaker " + (speaker + 1) : name;
  }
}
