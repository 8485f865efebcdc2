package com.scholary.discussion.transcript;

import com.scholary.discussion.classify.AudioFileNames;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Rewrites generic {@code Speaker N} labels in a transcript into participant names.
 *
 * <p>Personal mic files carry one voice, so every label becomes the mic owner. The phone line and
 * the sound pad get fixed labels. In the master mix the diarized speaker {@code i} is taken to be
 * the participant on mic slot {@code i-1}. Mapping is pure and running it twice changes nothing.
 */
@Component
public class SpeakerLabelMapper {

  public static final String PHONE_LABEL = "Phone Input";
  public static final String SOUND_PAD_LABEL = "Sound Effects";

  static final int MAX_MASTER_SPEAKERS = 10;

  private static final List<Pattern> SINGLE_SOURCE_LABELS =
      List.of(
          Pattern.compile("\\bSpeaker \\d+:"),
          Pattern.compile("\\bspeaker \\d+:"),
          Pattern.compile("\\[Speaker \\d+\\]:"),
          Pattern.compile("\\(Speaker \\d+\\):"));

  private static final Pattern LINE_LEADING_LABEL =
      Pattern.compile("^Speaker \\d+(\\s)", Pattern.MULTILINE);

  /**
   * Map the labels of one file's transcript.
   *
   * @param fileName the audio file the transcript belongs to
   * @param text transcript text, may be null
   * @param micAssignments 0-based mic slot to participant name
   * @return the mapped text, or the input when nothing applies
   */
  public String map(String fileName, String text, Map<Integer, String> micAssignments) {
    if (text == null || text.isEmpty()) {
      return text;
    }
    String label = sourceLabel(fileName, micAssignments);
    if (label != null) {
      return replaceAllLabels(text, label);
    }
    return mapMasterLabels(text, micAssignments);
  }

  /**
   * Fixed label for a single-source file: the mic owner (or {@code Mic N} when the slot is
   * unassigned), {@value #PHONE_LABEL} or {@value #SOUND_PAD_LABEL}. Null for mixed recordings.
   */
  public static String sourceLabel(String fileName, Map<Integer, String> micAssignments) {
    OptionalInt mic = AudioFileNames.micNumber(fileName);
    if (mic.isPresent()) {
      String owner = micAssignments == null ? null : micAssignments.get(mic.getAsInt() - 1);
      return owner == null || owner.isBlank() ? "Mic " + mic.getAsInt() : owner;
    }
    if (AudioFileNames.isPhone(fileName)) {
      return PHONE_LABEL;
    }
    if (AudioFileNames.isSoundPad(fileName)) {
      return SOUND_PAD_LABEL;
    }
    return null;
  }

  private String replaceAllLabels(String text, String label) {
    String replacement = Matcher.quoteReplacement(label + ":");
    String mapped = text;
    for (Pattern pattern : SINGLE_SOURCE_LABELS) {
      mapped = pattern.matcher(mapped).replaceAll(replacement);
    }
    return LINE_LEADING_LABEL.matcher(mapped).replaceAll(Matcher.quoteReplacement(label) + "$1");
  }

  private String mapMasterLabels(String text, Map<Integer, String> micAssignments) {
    if (micAssignments == null || micAssignments.isEmpty()) {
      return text;
    }
    String mapped = text;
    for (int speaker = 1; speaker <= MAX_MASTER_SPEAKERS; speaker++) {
      String name = micAssignments.get(speaker - 1);
      if (name == null || name.isBlank()) {
        continue;
      }
      String replacement = Matcher.quoteReplacement(name + ":");
      for (Pattern pattern : masterPatterns(speaker)) {
        mapped = pattern.matcher(mapped).replaceAll(replacement);
      }
    }
    return mapped;
  }

  // The trailing ":" after an optional space keeps "Speaker 1" from matching "Speaker 10".
  private static List<Pattern> masterPatterns(int speaker) {
    return List.of(
        Pattern.compile("\\bSpeaker " + speaker + " ?:"),
        Pattern.compile("\\bspeaker " + speaker + ":"),
        Pattern.compile("\\[Speaker " + speaker + "\\]:"),
        Pattern.compile("\\(Speaker " + speaker + "\\):"));
  }
}
