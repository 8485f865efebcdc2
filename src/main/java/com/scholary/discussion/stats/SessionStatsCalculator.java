package com.scholary.discussion.stats;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.discussion.analysis.model.AnalysisCategory;
import com.scholary.discussion.analysis.model.CategoryResults;
import com.scholary.discussion.analysis.model.CategoryWinner;
import com.scholary.discussion.analysis.model.TopFiveCategory;
import com.scholary.discussion.analysis.model.TopFiveEntry;
import com.scholary.discussion.analysis.model.TopFiveList;
import com.scholary.discussion.session.AudioFile;
import com.scholary.discussion.session.Session;
import com.scholary.discussion.transcript.SpeakerLabelMapper;
import com.scholary.discussion.transcript.UtteranceFormatter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Computes {@link SessionStats} from transcripts and analysis results.
 *
 * <p>Deterministic: the same session and results always give the same statistics. Per-speaker
 * counts come from the individual mic transcripts, one speaker per file; when only the master was
 * transcribed, its {@code Name: text} lines are used instead. Interruptions need timing, so they
 * are taken from the master's diarized utterances.
 */
@Component
public class SessionStatsCalculator {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionStatsCalculator.class);

  static final double INTERRUPTION_OVERLAP_SECONDS = 0.5;

  private static final Pattern LAUGHTER =
      Pattern.compile(
          "\\b(haha|hahaha|lol|lmao|laughing|chuckle|giggle)\\b", Pattern.CASE_INSENSITIVE);

  private static final Set<String> PROFANITY =
      Set.of(
          "damn", "dammit", "hell", "crap", "crappy", "pissed", "bloody", "ass", "bastard",
          "bitch", "sucks", "fuck", "fucking", "fucked", "shit", "shitty", "bullshit", "dick",
          "asshole", "dumbass", "jackass", "goddamn", "wtf");

  private static final Pattern WORD = Pattern.compile("[A-Za-z']+");
  private static final Pattern LABELLED_LINE = Pattern.compile("^([^:\\n]{1,40}):\\s*(.*)$");

  private final ObjectMapper objectMapper;

  public SessionStatsCalculator(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public SessionStats calculate(Session session, CategoryResults results) {
    Map<String, Integer> words = new LinkedHashMap<>();
    Map<String, Integer> questions = new LinkedHashMap<>();
    Map<String, Integer> laughter = new LinkedHashMap<>();
    Map<String, Integer> profanity = new LinkedHashMap<>();

    for (Map.Entry<String, String> speech : speechBySpeaker(session).entrySet()) {
      String speaker = speech.getKey();
      String text = speech.getValue();
      words.put(speaker, countWords(text));
      putIfPositive(questions, speaker, countChar(text, '?'));
      putIfPositive(laughter, speaker, countMatches(LAUGHTER.matcher(text)));
      putIfPositive(profanity, speaker, countProfanity(text));
    }

    Map<String, Integer> interruptions = countInterruptions(session);

    int totalInterruptions = sum(interruptions);
    int totalQuestions = sum(questions);
    int totalLaughter = sum(laughter);

    SessionStats stats =
        new SessionStats(
            totalDuration(session),
            words,
            questions,
            laughter,
            profanity,
            interruptions,
            sum(words),
            totalQuestions,
            totalLaughter,
            sum(profanity),
            totalInterruptions,
            top(words, true),
            top(words, false),
            top(questions, true),
            top(interruptions, true),
            top(profanity, true),
            energyLevel(results),
            conversationTone(totalLaughter, totalInterruptions, totalQuestions),
            technicalQuality(session),
            highlightMoments(results),
            bestMomentsSummary(results));

    LOGGER.info(
        "Session stats for {}: duration={}, energy={}, highlights={}, interruptions={}",
        session.getId(),
        stats.totalDuration(),
        stats.energyLevel(),
        stats.highlightMoments(),
        stats.totalInterruptions());
    return stats;
  }

  private Map<String, String> speechBySpeaker(Session session) {
    Map<String, String> speech = new LinkedHashMap<>();
    List<AudioFile> individual = new ArrayList<>();
    for (AudioFile file : session.getAudioFiles()) {
      if (!file.isMasterRecording() && file.hasTranscript()) {
        individual.add(file);
      }
    }

    if (!individual.isEmpty()) {
      individual.sort(
          Comparator.comparing(
              (AudioFile file) ->
                  file.getSpeakerNumber() == null ? Integer.MAX_VALUE : file.getSpeakerNumber()));
      for (AudioFile file : individual) {
        speech.merge(
            speakerName(session, file),
            withoutLabels(file.getTranscriptText()),
            (a, b) -> a + "\n" + b);
      }
      return speech;
    }

    Optional<AudioFile> master = session.findMasterRecording().filter(AudioFile::hasTranscript);
    if (master.isPresent()) {
      for (String line : master.get().getTranscriptText().split("\n")) {
        Matcher labelled = LABELLED_LINE.matcher(line.trim());
        if (labelled.matches()) {
          speech.merge(labelled.group(1).trim(), labelled.group(2), (a, b) -> a + "\n" + b);
        }
      }
    }
    return speech;
  }

  /** Mic transcripts are stored as {@code Name: text} lines; only the text counts. */
  static String withoutLabels(String transcript) {
    StringBuilder text = new StringBuilder();
    for (String line : transcript.split("\n")) {
      Matcher labelled = LABELLED_LINE.matcher(line.trim());
      if (text.length() > 0) {
        text.append('\n');
      }
      text.append(labelled.matches() ? labelled.group(2) : line);
    }
    return text.toString();
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

  /**
   * An interruption is a change of speaker where the new speaker starts more than half a second
   * before the previous one finished.
   */
  Map<String, Integer> countInterruptions(Session session) {
    Map<String, Integer> counts = new HashMap<>();
    Optional<AudioFile> master = session.findMasterRecording();
    if (master.isEmpty() || master.get().getTranscriptionJsonPath() == null) {
      return counts;
    }
    Path json = Path.of(master.get().getTranscriptionJsonPath());
    if (!Files.isRegularFile(json)) {
      return counts;
    }

    JsonNode utterances;
    try {
      utterances = objectMapper.readTree(json.toFile()).at("/result/transcription/utterances");
    } catch (IOException e) {
      LOGGER.warn("Cannot read master transcription {}: {}", json, e.getMessage());
      return counts;
    }
    if (!utterances.isArray()) {
      return counts;
    }

    JsonNode previous = null;
    for (JsonNode current : utterances) {
      if (previous != null) {
        JsonNode speaker = current.get("speaker");
        JsonNode previousSpeaker = previous.get("speaker");
        boolean speakerChanged =
            speaker != null
                && previousSpeaker != null
                && speaker.asInt() != previousSpeaker.asInt();
        if (speakerChanged
            && current.path("start").asDouble()
                < previous.path("end").asDouble() - INTERRUPTION_OVERLAP_SECONDS) {
          String name =
              UtteranceFormatter.speakerLabel(speaker.asInt(), session.getMicAssignments());
          counts.merge(name, 1, Integer::sum);
        }
      }
      previous = current;
    }
    return counts;
  }

  /** Longest recording, since the master spans the whole session. */
  static String totalDuration(Session session) {
    double longest =
        session.getAudioFiles().stream()
            .map(AudioFile::getDurationSeconds)
            .filter(duration -> duration != null)
            .mapToDouble(Double::doubleValue)
            .max()
            .orElse(0);
    int totalMinutes = (int) (longest / 60);
    if (totalMinutes >= 60) {
      return (totalMinutes / 60) + "h " + (totalMinutes % 60) + "m";
    }
    return totalMinutes + "m";
  }

  static EnergyLevel energyLevel(CategoryResults results) {
    if (results == null || results.degraded()) {
      return EnergyLevel.MEDIUM;
    }
    int total = 0;
    int count = 0;
    for (AnalysisCategory category :
        List.of(
            AnalysisCategory.BEST_JOKE,
            AnalysisCategory.HOTTEST_TAKE,
            AnalysisCategory.BEST_PLOT_TWIST_REVELATION)) {
      Optional<CategoryWinner> winner = results.winner(category);
      if (winner.isPresent()) {
        total += winner.get().entertainmentScore();
        count++;
      }
    }
    for (TopFiveEntry entry : results.topFive(TopFiveCategory.FUNNIEST_SENTENCES).entries()) {
      total += (int) entry.score();
      count++;
    }
    if (count == 0) {
      return EnergyLevel.MEDIUM;
    }
    return EnergyLevel.fromAverageScore((double) total / count);
  }

  static String conversationTone(int laughter, int interruptions, int questions) {
    if (laughter > 10 && interruptions < 5) {
      return "Light-hearted and fun";
    }
    if (interruptions > 10) {
      return "Heated and passionate";
    }
    if (questions > 15) {
      return "Analytical and thoughtful";
    }
    if (laughter > 5) {
      return "Engaging with good humor";
    }
    return "Calm and focused discussion";
  }

  static String technicalQuality(Session session) {
    int total = session.getAudioFiles().size();
    if (total == 0) {
      return "Unknown";
    }
    long clear = session.getAudioFiles().stream().filter(AudioFile::hasTranscript).count();
    double percentage = clear * 100.0 / total;
    if (percentage >= 90) {
      return "Excellent - all audio clear";
    }
    if (percentage >= 70) {
      return "Good - most audio clear";
    }
    if (percentage >= 50) {
      return "Fair - some audio issues";
    }
    return "Poor - significant audio problems";
  }

  static int highlightMoments(CategoryResults results) {
    if (results == null || results.degraded()) {
      return 0;
    }
    int count = results.winners().size();
    for (TopFiveList list : results.topFiveLists().values()) {
      count += list.entries().size();
    }
    return count;
  }

  static String bestMomentsSummary(CategoryResults results) {
    List<String> parts = new ArrayList<>();
    if (results != null && !results.degraded()) {
      results
          .winner(AnalysisCategory.BEST_JOKE)
          .ifPresent(w -> parts.add("Best joke by " + w.speaker()));
      results
          .winner(AnalysisCategory.HOTTEST_TAKE)
          .ifPresent(w -> parts.add("Hot take from " + w.speaker()));
      results
          .winner(AnalysisCategory.BEST_PLOT_TWIST_REVELATION)
          .ifPresent(w -> parts.add("Great insight by " + w.speaker()));
      int funny = results.topFive(TopFiveCategory.FUNNIEST_SENTENCES).entries().size();
      if (funny > 0) {
        parts.add(funny + " hilarious moments");
      }
    }
    if (parts.isEmpty()) {
      return "Session analyzed but no standout moments identified";
    }
    return String.join(", ", parts) + ".";
  }

  private static int countWords(String text) {
    String trimmed = text.trim();
    return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
  }

  private static int countChar(String text, char c) {
    int count = 0;
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == c) {
        count++;
      }
    }
    return count;
  }

  private static int countMatches(Matcher matcher) {
    int count = 0;
    while (matcher.find()) {
      count++;
    }
    return count;
  }

  private static int countProfanity(String text) {
    int count = 0;
    Matcher matcher = WORD.matcher(text);
    while (matcher.find()) {
      if (PROFANITY.contains(matcher.group().toLowerCase(Locale.ROOT))) {
        count++;
      }
    }
    return count;
  }

  private static void putIfPositive(Map<String, Integer> counts, String speaker, int value) {
    if (value > 0) {
      counts.merge(speaker, value, Integer::sum);
    }
  }

  private static int sum(Map<String, Integer> counts) {
    return counts.values().stream().mapToInt(Integer::intValue).sum();
  }

  private static String top(Map<String, Integer> counts, boolean highest) {
    Comparator<Map.Entry<String, Integer>> byCount = Map.Entry.comparingByValue();
    Comparator<Map.Entry<String, Integer>> byName = Map.Entry.comparingByKey();
    Comparator<Map.Entry<String, Integer>> order =
        (highest ? byCount.reversed() : byCount).thenComparing(byName);
    return counts.entrySet().stream().min(order).map(Map.Entry::getKey).orElse(null);
  }
}
