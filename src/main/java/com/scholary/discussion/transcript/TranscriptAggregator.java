package com.scholary.discussion.transcript;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.discussion.session.AudioFile;
import com.scholary.discussion.session.Session;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds the bounded transcript document for analysis.
 *
 * <p>The master recording is preferred because it holds the whole conversation in order. When it
 * is too long the start and the end are kept (60/40) around a single truncation marker, since
 * openings and closing verdicts matter most. Without a usable master the individual mic transcripts
 * are merged in slot order until the budget runs out.
 */
@Component
public class TranscriptAggregator {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptAggregator.class);

  static final String CONTEXT_HEADER = "=== TRANSCRIPT ANALYSIS CONTEXT ===";
  static final String MASTER_HEADER = "=== MASTER RECORDING (Full Group Conversation) ===";
  static final String INDIVIDUAL_HEADER = "=== INDIVIDUAL RECORDINGS (Merged) ===";
  static final String TRUNCATION_MARKER = "[... TRANSCRIPT TRUNCATED: %d characters omitted ...]";
  static final String CUT_NOTE = "\n[... recording truncated ...]\n";
  static final int MIN_FILE_CHARS = 300;

  private static final double HEAD_SHARE = 0.6;
  private static final Comparator<Integer> BY_SLOT = Comparator.naturalOrder();

  private final SpeakerLabelMapper labelMapper;
  private final ObjectMapper objectMapper;

  public TranscriptAggregator(SpeakerLabelMapper labelMapper, ObjectMapper objectMapper) {
    this.labelMapper = labelMapper;
    this.objectMapper = objectMapper;
  }

  /**
   * Aggregate the transcripts of a session.
   *
   * @param session the session with transcribed files
   * @param budget maximum length of the returned text in characters
   */
  public AggregatedTranscript aggregate(Session session, int budget) {
    StringBuilder document = new StringBuilder(buildHeader(session));

    Optional<AudioFile> master = session.findMasterRecording().filter(AudioFile::hasTranscript);

    AggregatedTranscript result;
    if (master.isPresent()) {
      result = appendMaster(document, session, master.get(), budget);
    } else {
      LOGGER.warn(
          "No master transcript for session {}, merging individual recordings", session.getId());
      result = appendIndividuals(document, session, budget);
    }

    LOGGER.info(
        "Aggregated transcript: session={}, chars={}, master={}, truncated={}, included={},"
            + " skipped={}",
        session.getId(),
        result.text().length(),
        result.fromMaster(),
        result.truncated(),
        result.includedFiles().size(),
        result.skippedFiles().size());
    return result;
  }

  private AggregatedTranscript appendMaster(
      StringBuilder document, Session session, AudioFile master, int budget) {
    String body = readableText(master, session.getMicAssignments());
    document.append(MASTER_HEADER).append('\n');

    int available = budget - document.length();
    boolean truncated = false;
    if (body.length() <= available) {
      document.append(body);
    } else {
      String wholeBodyMarker = marker(body.length());
      if (available < wholeBodyMarker.length() + 2) {
        // No room for head and tail: the marker stands in for the whole body.
        document.setLength(Math.min(document.length(), budget - wholeBodyMarker.length()));
        document.append(wholeBodyMarker);
      } else {
        document.append(headAndTail(body, available));
      }
      truncated = true;
    }

    return new AggregatedTranscript(
        limit(document, budget), truncated, true, List.of(master.getFileName()), List.of());
  }

  /**
   * Keep the start and the end of {@code body} so that the result, marker included, fits in
   * {@code available} characters.
   */
  static String headAndTail(String body, int available) {
    // Sized for the largest possible omitted count; the real marker is never longer.
    int markerLength = marker(body.length()).length() + 2;
    int keep = Math.max(0, available - markerLength);
    int head = (int) (keep * HEAD_SHARE);
    int tail = keep - head;
    int omitted = body.length() - head - tail;

    return body.substring(0, head)
        + "\n"
        + marker(omitted)
        + "\n"
        + body.substring(body.length() - tail);
  }

  private static String marker(int omitted) {
    return String.format(TRUNCATION_MARKER, omitted);
  }

  private AggregatedTranscript appendIndividuals(
      StringBuilder document, Session session, int budget) {
    document.append(INDIVIDUAL_HEADER).append('\n');

    List<AudioFile> files =
        session.getAudioFiles().stream()
            .filter(file -> !file.isMasterRecording())
            .filter(AudioFile::hasTranscript)
            .sorted(
                Comparator.comparing(AudioFile::getSpeakerNumber, Comparator.nullsLast(BY_SLOT))
                    .thenComparing(AudioFile::getFileName))
            .collect(Collectors.toList());

    // Room for the skipped line even if every file ends up in it.
    int reserve =
        skippedLine(files.stream().map(AudioFile::getFileName).collect(Collectors.toList()))
            .length();
    int limit = budget - reserve;

    List<String> included = new ArrayList<>();
    List<String> skipped = new ArrayList<>();
    boolean truncated = false;

    for (AudioFile file : files) {
      int remaining = limit - document.length();
      if (remaining < MIN_FILE_CHARS) {
        skipped.add(file.getFileName());
        continue;
      }

      String sectionHeader =
          "--- " + speakerName(session, file) + " (" + file.getFileName() + ") ---\n";
      String body = readableText(file, session.getMicAssignments());
      String block = sectionHeader + body + "\n\n";

      if (block.length() <= remaining) {
        document.append(block);
      } else {
        int room = Math.max(0, remaining - sectionHeader.length() - CUT_NOTE.length());
        document
            .append(sectionHeader)
            .append(body, 0, Math.min(room, body.length()))
            .append(CUT_NOTE);
        truncated = true;
      }
      included.add(file.getFileName());
    }

    if (!skipped.isEmpty()) {
      document.append(skippedLine(skipped));
      truncated = true;
    }

    return new AggregatedTranscript(limit(document, budget), truncated, false, included, skipped);
  }

  private static String skippedLine(List<String> fileNames) {
    return "[Skipped recordings: " + String.join(", ", fileNames) + "]\n";
  }

  private static String speakerName(Session session, AudioFile file) {
    return session
        .participantForSlot(file.getSpeakerNumber())
        .orElseGet(
            () -> {
              String label =
                  SpeakerLabelMapper.sourceLabel(file.getFileName(), session.getMicAssignments());
              return label != null ? label : file.getBaseName();
            });
  }

  private String buildHeader(Session session) {
    String participants =
        session.getMicAssignments().values().stream()
            .filter(name -> name != null && !name.isBlank())
            .collect(Collectors.joining(", "));
    return CONTEXT_HEADER
        + "\n"
        + "Movie: "
        + (session.getMovieTitle() == null ? "Unknown" : session.getMovieTitle())
        + "\n"
        + "Date: "
        + (session.getSessionDate() == null ? "Unknown" : session.getSessionDate())
        + "\n"
        + "Participants: "
        + (participants.isEmpty() ? "Unknown" : participants)
        + "\n\n";
  }

  /** Transcript text with speaker labels mapped; a raw JSON response is flattened first. */
  String readableText(AudioFile file, Map<Integer, String> micAssignments) {
    String text = file.getTranscriptText().trim();
    if (text.startsWith("{")) {
      text = flattenJson(file.getFileName(), text, micAssignments);
    }
    return labelMapper.map(file.getFileName(), text, micAssignments);
  }

  private String flattenJson(String fileName, String json, Map<Integer, String> micAssignments) {
    JsonNode root;
    try {
      root = objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      LOGGER.warn("Transcript of {} looks like JSON but does not parse, using as text", fileName);
      return json;
    }

    JsonNode utterances = root.at("/result/transcription/utterances");
    if (utterances.isMissingNode()) {
      utterances = root.at("/transcription/utterances");
    }
    if (utterances.isMissingNode()) {
      utterances = root.path("utterances");
    }
    if (!utterances.isArray() || utterances.isEmpty()) {
      JsonNode full = root.at("/result/transcription/full_transcript");
      return full.isTextual() ? full.asText() : json;
    }

    String sourceLabel = SpeakerLabelMapper.sourceLabel(fileName, micAssignments);
    StringBuilder text = new StringBuilder();
    for (JsonNode utterance : utterances) {
      String line = utterance.path("text").asText("").trim();
      if (line.isEmpty()) {
        continue;
      }
      String label = sourceLabel;
      if (label == null) {
        JsonNode speaker = utterance.get("speaker");
        label =
            UtteranceFormatter.speakerLabel(
                speaker != null && speaker.isNumber() ? speaker.asInt() : null, micAssignments);
      }
      text.append(label).append(": ").append(line).append('\n');
    }
    return text.toString().trim();
  }

  private static String limit(StringBuilder document, int budget) {
    return document.length() <= budget ? document.toString() : document.substring(0, budget);
  }
}
