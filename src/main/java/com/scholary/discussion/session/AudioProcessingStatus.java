package com.scholary.discussion.session;

/**
 * Per-file processing status.
 *
 * <p>Every status lives in exactly one physical folder under {@code root/{folder}/{session}/}. The
 * WAV stage ({@link #PENDING}, {@link #FAILED}) and the MP3 stage ({@link #PENDING_MP3}, {@link
 * #FAILED_MP3}, {@link #PROCESSED_MP3}) never share a folder.
 */
public enum AudioProcessingStatus {
  PENDING("pending", Stage.WAV),
  FAILED("failed", Stage.WAV),
  PENDING_MP3("pending_mp3", Stage.MP3),
  FAILED_MP3("failed_mp3", Stage.MP3),
  UPLOADED_TO_GLADIA("pending_mp3", Stage.ANY),
  TRANSCRIPTION_COMPLETE("processed_mp3", Stage.ANY),
  PROCESSED_MP3("processed_mp3", Stage.MP3);

  /** Which kind of file a status folder may hold. */
  public enum Stage {
    WAV,
    MP3,
    ANY
  }

  private final String folderName;
  private final Stage stage;

  AudioProcessingStatus(String folderName, Stage stage) {
    this.folderName = folderName;
    this.stage = stage;
  }

  public String folderName() {
    return folderName;
  }

  public Stage stage() {
    return stage;
  }

  public boolean isFailure() {
    return this == FAILED || this == FAILED_MP3;
  }

  /** True once the file has a usable transcript. */
  public boolean isTranscribed() {
    return this == TRANSCRIPTION_COMPLETE || this == PROCESSED_MP3;
  }
}
