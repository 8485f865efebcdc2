package com.scholary.discussion.gladia;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class UploadNamesTest {

  @Test
  void displayName_shouldPrefixTitleFromSessionFolder() {
    assertThat(UploadNames.displayName("2024-March-The-Dark-Knight", "MIC1.mp3"))
        .isEqualTo("The Dark Knight_MIC1.mp3");
  }

  @Test
  void displayName_shouldKeepFileNameForOtherFolders() {
    assertThat(UploadNames.displayName("session42", "MIC1.mp3")).isEqualTo("MIC1.mp3");
    assertThat(UploadNames.displayName(null, "MIC1.mp3")).isEqualTo("MIC1.mp3");
  }
}
