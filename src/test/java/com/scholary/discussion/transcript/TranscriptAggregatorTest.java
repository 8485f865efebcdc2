package com.scholary.discussion.transcript;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.discussion.session.AudioFile;
import com.scholary.discussion.session.Session;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TranscriptAggregatorTest {

  private TranscriptAggregator aggregator;
  private Session session;

  @BeforeEach
  void setUp() {
    aggregator = new TranscriptAggregator(new SpeakerLabelMapper(), new ObjectMapper());
    session = new Session("s1", Instant.EPOCH);
    session.setMovieTitle("Dune");
    session.setSessionDate(LocalDate.of(2024, 3, 15));
    session.setMicAssignments(Map.of(0, "Alice", 1, "Bob", 2, "Carol"));
  }

  @Test
  void aggregate_shouldUseWholeMasterWhenItFits() {
    session.getAudioFiles().add(master("Speaker 1: great film\nSpeaker 2: boring"));
    session.getAudioFiles().add(mic("MIC1.wav", 0, "should not be used"));

    AggregatedTranscript result = aggregator.aggregate(session, 10_000);

    assertThat(result.fromMaster()).isTrue();
    assertThat(result.truncated()).isFalse();
    assertThat(result.text())
        .startsWith(TranscriptAggregator.CONTEXT_HEADER)
        .contains("Movie: Dune", "Participants: Alice, Bob, Carol")
        .contains(TranscriptAggregator.MASTER_HEADER)
        .contains("Alice: great film\nBob: boring")
        .doesNotContain("should not be used");
  }

  @Test
  void aggregate_shouldKeepHeadAndTailOfLongMasterWithSingleMarker() {
    String body = "OPENING " + "x".repeat(20_000) + " CLOSING";
    session.getAudioFiles().add(master(body));

    AggregatedTranscript result = aggregator.aggregate(session, 2_000);

    assertThat(result.truncated()).isTrue();
    assertThat(result.text().length()).isLessThanOrEqualTo(2_000);
    assertThat(result.text()).contains("OPENING").endsWith("CLOSING");
    assertThat(countOccurrences(result.text(), "TRANSCRIPT TRUNCATED")).isEqualTo(1);
  }

  @Test
  void aggregate_shouldKeepSingleMarkerWhenBudgetBarelyFitsHeaders() {
    session.getAudioFiles().add(master("word ".repeat(5_000)));

    for (int budget = 80; budget <= 400; budget += 10) {
      String text = aggregator.aggregate(session, budget).text();

      assertThat(text.length()).isLessThanOrEqualTo(budget);
      assertThat(countOccurrences(text, "TRANSCRIPT TRUNCATED")).isEqualTo(1);
    }
  }

  @Test
  void headAndTail_shouldSplitSixtyForty() {
    String body = "a".repeat(5_000) + "b".repeat(5_000);

    String kept = TranscriptAggregator.headAndTail(body, 1_000);

    assertThat(kept.length()).isLessThanOrEqualTo(1_000);
    int markerStart = kept.indexOf("\n[...");
    int markerEnd = kept.indexOf("...]\n") + 5;
    int head = markerStart;
    int tail = kept.length() - markerEnd;
    assertThat(head).isGreaterThan(tail);
    assertThat((double) head / (head + tail)).isBetween(0.59, 0.61);
    assertThat(kept.substring(0, head)).matches("a+");
    assertThat(kept.substring(markerEnd)).matches("b+");
  }

  @Test
  void aggregate_shouldMergeIndividualsInSlotOrderWithoutMaster() {
    session.getAudioFiles().add(mic("MIC3.wav", 2, "third"));
    session.getAudioFiles().add(mic("MIC1.wav", 0, "first"));
    session.getAudioFiles().add(mic("MIC2.wav", 1, "second"));

    AggregatedTranscript result = aggregator.aggregate(session, 10_000);

    assertThat(result.fromMaster()).isFalse();
    assertThat(result.includedFiles()).containsExactly("MIC1.wav", "MIC2.wav", "MIC3.wav");
    String text = result.text();
    assertThat(text).contains(TranscriptAggregator.INDIVIDUAL_HEADER);
    assertThat(text.indexOf("--- Alice (MIC1.wav) ---"))
        .isLessThan(text.indexOf("--- Bob (MIC2.wav) ---"));
    assertThat(text.indexOf("--- Bob (MIC2.wav) ---"))
        .isLessThan(text.indexOf("--- Carol (MIC3.wav) ---"));
  }

  @Test
  void aggregate_shouldCutAndSkipIndividualsWhenBudgetRunsOut() {
    session.getAudioFiles().add(mic("MIC1.wav", 0, "a ".repeat(500)));
    session.getAudioFiles().add(mic("MIC2.wav", 1, "b ".repeat(500)));
    session.getAudioFiles().add(mic("MIC3.wav", 2, "c ".repeat(500)));

    AggregatedTranscript result = aggregator.aggregate(session, 1_800);

    assertThat(result.text().length()).isLessThanOrEqualTo(1_800);
    assertThat(result.truncated()).isTrue();
    assertThat(result.includedFiles()).containsExactly("MIC1.wav", "MIC2.wav");
    assertThat(result.skippedFiles()).containsExactly("MIC3.wav");
    assertThat(result.text()).contains("[Skipped recordings: MIC3.wav]");
  }

  @Test
  void aggregate_shouldNeverExceedBudget() {
    session.getAudioFiles().add(mic("MIC1.wav", 0, "word ".repeat(2_000)));
    session.getAudioFiles().add(mic("MIC2.wav", 1, "word ".repeat(2_000)));
    session.getAudioFiles().add(mic("PHONE.wav", null, "word ".repeat(2_000)));

    for (int budget = 200; budget <= 25_000; budget += 700) {
      assertThat(aggregator.aggregate(session, budget).text().length())
          .isLessThanOrEqualTo(budget);
    }

    session.getAudioFiles().add(master("word ".repeat(5_000)));
    for (int budget = 200; budget <= 30_000; budget += 700) {
      assertThat(aggregator.aggregate(session, budget).text().length())
          .isLessThanOrEqualTo(budget);
    }
  }

  @Test
  void aggregate_shouldFlattenJsonTranscripts() {
    String json =
        "{\"result\":{\"transcription\":{\"utterances\":["
            + "{\"text\":\"what a twist\",\"speaker\":1},"
            + "{\"text\":\"totally\",\"speaker\":4}]}}}";
    session.getAudioFiles().add(master(json));

    AggregatedTranscript result = aggregator.aggregate(session, 10_000);

    assertThat(result.text()).contains("Bob: what a twist\nSpeaker 5: totally");
  }

  @Test
  void aggregate_shouldReportNoContentWithoutTranscripts() {
    session.getAudioFiles().add(new AudioFile("MIC1.wav", "/tmp/MIC1.wav", 10));

    AggregatedTranscript result = aggregator.aggregate(session, 10_000);

    assertThat(result.hasContent()).isFalse();
  }

  private static AudioFile master(String transcript) {
    AudioFile file = new AudioFile("MASTER_MIX.wav", "/tmp/MASTER_MIX.wav", 100);
    file.setMasterRecording(true);
    file.setTranscriptText(transcript);
    return file;
  }

  private static AudioFile mic(String name, Integer slot, String transcript) {
    AudioFile file = new AudioFile(name, "/tmp/" + name, 10);
    file.setSpeakerNumber(slot);
    file.setTranscriptText(transcript);
    return file;
  }

  private static int countOccurrences(String text, String token) {
    int count = 0;
    int index = text.indexOf(token);
    while (index >= 0) {
      count++;
      index = text.indexOf(token, index + token.length());
    }
    return count;
  }
}
