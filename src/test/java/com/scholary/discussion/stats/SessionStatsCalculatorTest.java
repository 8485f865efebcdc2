package com.scholary.discussion.stats;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.discussion.analysis.model.AnalysisCategory;
import com.scholary.discussion.analysis.model.AudioQuality;
import com.scholary.discussion.analysis.model.CategoryResults;
import com.scholary.discussion.analysis.model.CategoryWinner;
import com.scholary.discussion.gladia.GladiaJob.Transcription;
import com.scholary.discussion.gladia.GladiaJob.Utterance;
import com.scholary.discussion.session.AudioFile;
import com.scholary.discussion.session.Session;
import com.scholary.discussion.transcript.SpeakerLabelMapper;
import com.scholary.discussion.transcript.UtteranceFormatter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SessionStatsCalculatorTest {

  @TempDir Path tempDir;

  private SessionStatsCalculator calculator;
  private Session session;

  @BeforeEach
  void setUp() {
    calculator = new SessionStatsCalculator(new ObjectMapper());
    session = new Session("s1", Instant.EPOCH);
    session.setMicAssignments(Map.of(0, "Alice", 1, "Bob"));
  }

  @Test
  void calculate_shouldCountPerSpeakerFromMicTranscripts() {
    session
        .getAudioFiles()
        .add(mic("MIC1.wav", 0, "Haha that was great. Was it though? lol", 600.0));
    session.getAudioFiles().add(mic("MIC2.wav", 1, "Damn that ending sucks", 3700.0));

    SessionStats stats = calculator.calculate(session, null);

    assertThat(stats.wordCounts()).containsEntry("Alice", 8).containsEntry("Bob", 4);
    assertThat(stats.totalWords()).isEqualTo(12);
    assertThat(stats.questionCounts()).containsOnly(Map.entry("Alice", 1));
    assertThat(stats.laughterCounts()).containsOnly(Map.entry("Alice", 2));
    assertThat(stats.profanityCounts()).containsOnly(Map.entry("Bob", 2));
    assertThat(stats.mostTalkative()).isEqualTo("Alice");
    assertThat(stats.quietest()).isEqualTo("Bob");
    assertThat(stats.mostProfane()).isEqualTo("Bob");
    assertThat(stats.totalDuration()).isEqualTo("1h 1m");
    assertThat(stats.technicalQuality()).isEqualTo("Excellent - all audio clear");
    assertThat(stats.energyLevel()).isEqualTo(EnergyLevel.MEDIUM);
    assertThat(stats.highlightMoments()).isZero();
  }

  @Test
  void calculate_shouldNotCountSpeakerLabelsOfMicTranscripts() {
    Transcription transcription =
        new Transcription(
            "hello there general",
            List.of(
                new Utterance(0.0, 1.0, "hello there", 0, 0.9),
                new Utterance(1.5, 2.0, "general", 0, 0.9)));
    String text =
        new SpeakerLabelMapper()
            .map(
                "MIC1.wav",
                UtteranceFormatter.format("MIC1.wav", transcription, session.getMicAssignments()),
                session.getMicAssignments());
    session.getAudioFiles().add(mic("MIC1.wav", 0, text, 60.0));
    session.getAudioFiles().add(mic("MIC2.wav", 1, "Bob: one two three four", 60.0));

    SessionStats stats = calculator.calculate(session, null);

    assertThat(text).isEqualTo("Alice: hello there\nAlice: general");
    assertThat(stats.wordCounts()).containsEntry("Alice", 3).containsEntry("Bob", 4);
    assertThat(stats.mostTalkative()).isEqualTo("Bob");
  }

  @Test
  void calculate_shouldFallBackToLabelledMasterLines() {
    AudioFile master = new AudioFile("MASTER_MIX.wav", "/tmp/MASTER_MIX.wav", 10);
    master.setMasterRecording(true);
    master.setTranscriptText("Alice: one two three\nBob: four\nAlice: five?");
    session.getAudioFiles().add(master);

    SessionStats stats = calculator.calculate(session, null);

    assertThat(stats.wordCounts()).containsEntry("Alice", 4).containsEntry("Bob", 1);
    assertThat(stats.mostInquisitive()).isEqualTo("Alice");
  }

  @Test
  void calculate_shouldCountInterruptionsFromMasterUtterances() throws IOException {
    Path json = tempDir.resolve("MASTER_MIX.json");
    Files.writeString(
        json,
        "{\"result\": {\"transcription\": {\"utterances\": ["
            + "{\"speaker\": 0, \"start\": 0.0, \"end\": 5.0, \"text\": \"so anyway\"},"
            + "{\"speaker\": 1, \"start\": 3.0, \"end\": 6.0, \"text\": \"no wait\"},"
            + "{\"speaker\": 0, \"start\": 5.8, \"end\": 8.0, \"text\": \"let me finish\"},"
            + "{\"speaker\": 2, \"start\": 9.0, \"end\": 10.0, \"text\": \"hi\"}"
            + "]}}}");
    AudioFile master = new AudioFile("MASTER_MIX.wav", "/tmp/MASTER_MIX.wav", 10);
    master.setMasterRecording(true);
    master.setTranscriptionJsonPath(json.toString());
    session.getAudioFiles().add(master);

    Map<String, Integer> interruptions = calculator.countInterruptions(session);

    assertThat(interruptions).containsOnly(Map.entry("Bob", 1));
  }

  @Test
  void calculate_shouldDeriveEnergyAndHighlightsFromResults() {
    CategoryResults results =
        CategoryResults.of(
            Map.of(
                AnalysisCategory.BEST_JOKE, winner("Alice", 9),
                AnalysisCategory.HOTTEST_TAKE, winner("Bob", 8)),
            Map.of(),
            List.of());

    SessionStats stats = calculator.calculate(session, results);

    assertThat(stats.energyLevel()).isEqualTo(EnergyLevel.HIGH);
    assertThat(stats.highlightMoments()).isEqualTo(2);
    assertThat(stats.bestMomentsSummary())
        .isEqualTo("Best joke by Alice, Hot take from Bob.");
  }

  @Test
  void calculate_shouldTreatDegradedResultsAsNeutral() {
    SessionStats stats = calculator.calculate(session, CategoryResults.degraded("call failed"));

    assertThat(stats.energyLevel()).isEqualTo(EnergyLevel.MEDIUM);
    assertThat(stats.highlightMoments()).isZero();
    assertThat(stats.bestMomentsSummary())
        .isEqualTo("Session analyzed but no standout moments identified");
    assertThat(stats.technicalQuality()).isEqualTo("Unknown");
    assertThat(stats.mostTalkative()).isNull();
  }

  @Test
  void conversationTone_shouldFollowThresholds() {
    assertThat(SessionStatsCalculator.conversationTone(11, 2, 0))
        .isEqualTo("Light-hearted and fun");
    assertThat(SessionStatsCalculator.conversationTone(11, 11, 0))
        .isEqualTo("Heated and passionate");
    assertThat(SessionStatsCalculator.conversationTone(0, 0, 16))
        .isEqualTo("Analytical and thoughtful");
    assertThat(SessionStatsCalculator.conversationTone(6, 5, 0))
        .isEqualTo("Engaging with good humor");
    assertThat(SessionStatsCalculator.conversationTone(0, 0, 0))
        .isEqualTo("Calm and focused discussion");
  }

  private static AudioFile mic(String name, int slot, String transcript, Double duration) {
    AudioFile file = new AudioFile(name, "/tmp/" + name, 10);
    file.setSpeakerNumber(slot);
    file.setIdentified(true);
    file.setTranscriptText(transcript);
    file.setDurationSeconds(duration);
    return file;
  }

  private static CategoryWinner winner(String speaker, int score) {
    return new CategoryWinner(
        speaker, "1:00", "q", "", "", "", AudioQuality.CLEAR, score, List.of(), null, null);
  }
}
