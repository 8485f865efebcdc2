package com.scholary.discussion.clip;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.discussion.config.PipelineProperties;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ClipExtractorTest {

  @TempDir Path tempDir;

  private Path clipsDir;
  private ClipExtractor extractor;

  @BeforeEach
  void setUp() {
    clipsDir = tempDir.resolve("clips");
    extractor =
        new ClipExtractor(
            new PipelineProperties(
                tempDir.toString(), clipsDir.toString(), 1000, 1000L, 1, 1, 60));
  }

  @Test
  void extract_shouldCopyWholeSecondWindowWithCanonicalHeader() throws IOException {
    Path wav = WavFixtures.write(tempDir.resolve("MASTER_MIX.wav"), 10);

    String url = extractor.extract("s1", wav, 2.5, 4.2);

    assertThat(url).isEqualTo("/clips/s1/MASTER_MIX_2_5.wav");
    Path clip = clipsDir.resolve("s1").resolve("MASTER_MIX_2_5.wav");
    byte[] clipBytes = Files.readAllBytes(clip);
    assertThat(clipBytes).hasSize(44 + 3 * WavFixtures.SAMPLE_RATE);

    byte[] source = Files.readAllBytes(wav);
    int sourceStart = 44 + 2 * WavFixtures.SAMPLE_RATE;
    assertThat(Arrays.copyOfRange(clipBytes, 44, clipBytes.length))
        .isEqualTo(
            Arrays.copyOfRange(source, sourceStart, sourceStart + 3 * WavFixtures.SAMPLE_RATE));

    try (FileChannel channel = FileChannel.open(clip, StandardOpenOption.READ)) {
      WavHeader header = WavHeader.read(channel);
      assertThat(header.sampleRate()).isEqualTo(WavFixtures.SAMPLE_RATE);
      assertThat(header.durationSeconds()).isEqualTo(3.0);
    }
  }

  @Test
  void extract_shouldClampWindowToRecordingEnd() throws IOException {
    Path wav = WavFixtures.write(tempDir.resolve("MASTER_MIX.wav"), 5);

    String url = extractor.extract("s1", wav, 3, 20);

    assertThat(url).isEqualTo("/clips/s1/MASTER_MIX_3_5.wav");
    assertThat(Files.size(clipsDir.resolve("s1").resolve("MASTER_MIX_3_5.wav")))
        .isEqualTo(44L + 2 * WavFixtures.SAMPLE_RATE);
  }

  @Test
  void extract_shouldSkipExtraChunksBeforeData() throws IOException {
    Path wav = WavFixtures.write(tempDir.resolve("MIC1.wav"), 4, true);

    extractor.extract("s1", wav, 0, 1);

    byte[] clipBytes = Files.readAllBytes(clipsDir.resolve("s1").resolve("MIC1_0_1.wav"));
    assertThat(clipBytes).hasSize(44 + WavFixtures.SAMPLE_RATE);
    assertThat(clipBytes[44]).isEqualTo((byte) 0);
    assertThat(clipBytes[45]).isEqualTo((byte) 1);
  }

  @Test
  void extract_shouldRejectEmptyOrOverlongWindows() throws IOException {
    Path wav = WavFixtures.write(tempDir.resolve("MASTER_MIX.wav"), 1);

    assertThatThrownBy(() -> extractor.extract("s1", wav, 5, 5))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> extractor.extract("s1", wav, 10, 4))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> extractor.extract("s1", wav, 0, 300.5))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void extract_shouldFailForWindowPastTheEnd() throws IOException {
    Path wav = WavFixtures.write(tempDir.resolve("MASTER_MIX.wav"), 2);

    assertThatThrownBy(() -> extractor.extract("s1", wav, 30, 40))
        .isInstanceOf(ClipExtractionException.class)
        .hasMessageContaining("outside");
  }

  @Test
  void extract_shouldFailForNonWavInput() throws IOException {
    Path notWav = tempDir.resolve("notes.wav");
    Files.writeString(notWav, "this is not a riff file at all, just some text");

    assertThatThrownBy(() -> extractor.extract("s1", notWav, 0, 1))
        .isInstanceOf(ClipExtractionException.class);
  }
}
