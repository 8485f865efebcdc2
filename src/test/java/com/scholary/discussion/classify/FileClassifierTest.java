package com.scholary.discussion.classify;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.discussion.session.AudioFile;
import com.scholary.discussion.session.Session;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileClassifierTest {

  @TempDir Path root;

  private Path folder;
  private FileClassifier classifier;

  @BeforeEach
  void setUp() throws IOException {
    folder = Files.createDirectory(root.resolve("2024-March-Dune"));
    classifier = new FileClassifier();
  }

  @Test
  void classify_shouldAssignSlotsFromMicNumbers() throws IOException {
    write("MIC1.wav", 10);
    write("mic3.WAV", 10);
    write("2_Speaker.wav", 10);
    write("2024_0315_1900.wav", 50);

    ClassificationResult result = classifier.classify(session());

    assertThat(file(result, "MIC1.wav").getSpeakerNumber()).isEqualTo(0);
    assertThat(file(result, "mic3.WAV").getSpeakerNumber()).isEqualTo(2);
    assertThat(file(result, "2_Speaker.wav").getSpeakerNumber()).isEqualTo(1);
    assertThat(result.roles().get("MIC1.wav")).isEqualTo(FileRole.INDIVIDUAL_MIC);
  }

  @Test
  void classify_shouldRenameTimestampedMasterToMasterMix() throws IOException {
    write("MIC1.wav", 10);
    write("2024_0315_1900.wav", 50);

    ClassificationResult result = classifier.classify(session());

    assertThat(result.master()).isPresent();
    AudioFile master = result.master().get();
    assertThat(master.getFileName()).isEqualTo("MASTER_MIX.wav");
    assertThat(master.isMasterRecording()).isTrue();
    assertThat(Files.exists(folder.resolve("MASTER_MIX.wav"))).isTrue();
    assertThat(Files.exists(folder.resolve("2024_0315_1900.wav"))).isFalse();
  }

  @Test
  void classify_shouldKeepSingleMasterWhenNameMatchAndLeftoverCoexist() throws IOException {
    write("MIC1.wav", 10);
    write("2024_0315_1900.wav", 50);
    write("hallway.wav", 500);

    ClassificationResult result = classifier.classify(session());

    assertThat(result.master().orElseThrow().getFileName()).isEqualTo("MASTER_MIX.wav");
    assertThat(result.files()).filteredOn(AudioFile::isMasterRecording).hasSize(1);
    assertThat(file(result, "hallway.wav").isMasterRecording()).isFalse();
    assertThat(result.roles().get("hallway.wav")).isEqualTo(FileRole.UNIDENTIFIED);
    assertThat(result.warnings()).anyMatch(w -> w.startsWith("Unidentified file hallway.wav"));
  }

  @Test
  void classify_shouldPickSingleUnidentifiedFileAsMaster() throws IOException {
    write("MIC1.wav", 10);
    write("recording.m4a", 5);

    ClassificationResult result = classifier.classify(session());

    assertThat(result.master()).isPresent();
    assertThat(result.master().get().getFileName()).isEqualTo("MASTER_MIX.m4a");
  }

  @Test
  void classify_shouldPickLargestOfSeveralUnidentifiedFiles() throws IOException {
    write("a.wav", 10);
    write("b.wav", 30);
    write("c.wav", 20);

    ClassificationResult result = classifier.classify(session());

    assertThat(result.master()).isPresent();
    assertThat(Files.exists(folder.resolve("MASTER_MIX.wav"))).isTrue();
    assertThat(Files.size(folder.resolve("MASTER_MIX.wav"))).isEqualTo(30);
  }

  @Test
  void classify_shouldKeepOriginalNameWhenMasterMixExists() throws IOException {
    write("MASTER_MIX.wav", 10);
    write("group_recording.wav", 40);

    ClassificationResult result = classifier.classify(session());

    assertThat(result.master()).isPresent();
    assertThat(result.master().get().getFileName()).isEqualTo("group_recording.wav");
    assertThat(result.warnings()).anyMatch(w -> w.contains("MASTER_MIX.wav already exists"));
  }

  @Test
  void classify_shouldMarkAuxiliaryInputsWithoutSlot() throws IOException {
    write("PHONE.wav", 10);
    write("SOUND_PAD.wav", 10);
    write("MIC1.wav", 10);
    write("master.wav", 20);

    ClassificationResult result = classifier.classify(session());

    assertThat(result.roles().get("PHONE.wav")).isEqualTo(FileRole.AUXILIARY);
    assertThat(result.roles().get("SOUND_PAD.wav")).isEqualTo(FileRole.AUXILIARY);
    assertThat(file(result, "PHONE.wav").getSpeakerNumber()).isNull();
  }

  @Test
  void classify_shouldSkipTemporaryAndNonAudioFiles() throws IOException {
    write("MIC1.wav", 10);
    write("temp_MIC2.wav", 10);
    write("MIC3_temp.wav", 10);
    write("notes.txt", 10);
    write("master.wav", 20);

    ClassificationResult result = classifier.classify(session());

    assertThat(result.files())
        .extracting(AudioFile::getFileName)
        .containsExactlyInAnyOrder("MIC1.wav", "MASTER_MIX.wav");
  }

  @Test
  void classify_shouldWarnWhenNoMasterFound() throws IOException {
    write("MIC1.wav", 10);
    write("MIC2.wav", 10);

    Session session = session();
    ClassificationResult result = classifier.classify(session);

    assertThat(result.master()).isEmpty();
    assertThat(result.warnings()).anyMatch(w -> w.startsWith("No master recording"));
    assertThat(session.getAudioFiles()).hasSize(2);
  }

  @Test
  void classify_shouldRejectMissingFolder() {
    Session session = new Session("s1", Instant.EPOCH);
    session.setFolderPath(root.resolve("missing").toString());

    assertThatThrownBy(() -> classifier.classify(session))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private Session session() {
    Session session = new Session("s1", Instant.EPOCH);
    session.setFolderPath(folder.toString());
    return session;
  }

  private void write(String name, int size) throws IOException {
    Files.write(folder.resolve(name), new byte[size]);
  }

  private static AudioFile file(ClassificationResult result, String name) {
    return result.files().stream()
        .filter(f -> f.getFileName().equals(name))
        .findFirst()
        .orElseThrow();
  }
}
