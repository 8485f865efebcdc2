package com.scholary.discussion.gladia;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TranscriptionOptionsTest {

  @Test
  void forFile_shouldUseSingleSpeakerForSingleSourceFiles() {
    assertThat(TranscriptionOptions.forFile("MIC3.wav", 5))
        .isEqualTo(new TranscriptionOptions(1, false));
    assertThat(TranscriptionOptions.forFile("PHONE.wav", 5).diarization()).isFalse();
    assertThat(TranscriptionOptions.forFile("USB_1.wav", 5).diarization()).isFalse();
    assertThat(TranscriptionOptions.forFile("MASTER_MIX.wav", 0).speakerCount()).isEqualTo(2);
    assertThat(TranscriptionOptions.forFile("MASTER_MIX.wav", 9).maxSpeakers()).isEqualTo(8);
  }
}
