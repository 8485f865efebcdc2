package com.scholary.discussion.session;

/**
 * One recording within a session.
 *
 * <p>Mutated in place by each pipeline phase and persisted with its session after every change.
 */
public class AudioFile {

  private String fileName;
  private String filePath;
  private String mp3FilePath;
  private long fileSize;
  private Double durationSeconds;
  private Integer speakerNumber; // 0-based mic slot
  private boolean masterRecording;
  private boolean identified;
  private AudioProcessingStatus processingStatus = AudioProcessingStatus.PENDING;
  private String transcriptText;
  private String transcriptId;
  private String audioUrl;
  private String transcriptionJsonPath;
  private String conversionError;
  private boolean retryEligible = true;

  public AudioFile() {}

  public AudioFile(String fileName, String filePath, long fileSize) {
    this.fileName = fileName;
    this.filePath = filePath;
    this.fileSize = fileSize;
  }

  public String getFileName() {
    return fileName;
  }

  public void setFileName(String fileName) {
    this.fileName = fileName;
  }

  public String getFilePath() {
    return filePath;
  }

  public void setFilePath(String filePath) {
    this.filePath = filePath;
  }

  public String getMp3FilePath() {
    return mp3FilePath;
  }

  public void setMp3FilePath(String mp3FilePath) {
    this.mp3FilePath = mp3FilePath;
  }

  public long getFileSize() {
    return fileSize;
  }

  public void setFileSize(long fileSize) {
    this.fileSize = fileSize;
  }

  public Double getDurationSeconds() {
    return durationSeconds;
  }

  public void setDurationSeconds(Double durationSeconds) {
    this.durationSeconds = durationSeconds;
  }

  public Integer getSpeakerNumber() {
    return speakerNumber;
  }

  public void setSpeakerNumber(Integer speakerNumber) {
    this.speakerNumber = speakerNumber;
  }

  public boolean isMasterRecording() {
    return masterRecording;
  }

  public void setMasterRecording(boolean masterRecording) {
    this.masterRecording = masterRecording;
  }

  public boolean isIdentified() {
    return identified;
  }

  public void setIdentified(boolean identified) {
    this.identified = identified;
  }

  public AudioProcessingStatus getProcessingStatus() {
    return processingStatus;
  }

  public void setProcessingStatus(AudioProcessingStatus processingStatus) {
    this.processingStatus = processingStatus;
  }

  public String getTranscriptText() {
    return transcriptText;
  }

  public void setTranscriptText(String transcriptText) {
    this.transcriptText = transcriptText;
  }

  public String getTranscriptId() {
    return transcriptId;
  }

  public void setTranscriptId(String transcriptId) {
    this.transcriptId = transcriptId;
  }

  public String getAudioUrl() {
    return audioUrl;
  }

  public void setAudioUrl(String audioUrl) {
    this.audioUrl = audioUrl;
  }

  public String getTranscriptionJsonPath() {
    return transcriptionJsonPath;
  }

  public void setTranscriptionJsonPath(String transcriptionJsonPath) {
    this.transcriptionJsonPath = transcriptionJsonPath;
  }

  public String getConversionError() {
    return conversionError;
  }

  public void setConversionError(String conversionError) {
    this.conversionError = conversionError;
  }

  public boolean isRetryEligible() {
    return retryEligible;
  }

  public void setRetryEligible(boolean retryEligible) {
    this.retryEligible = retryEligible;
  }

  public boolean hasTranscript() {
    return transcriptText != null && !transcriptText.isBlank();
  }

  /** The file that is actually sent for transcription: the MP3 when one was produced. */
  public String getUploadPath() {
    return mp3FilePath != null ? mp3FilePath : filePath;
  }

  /** File name without its extension. */
  public String getBaseName() {
    int dot = fileName.lastIndexOf('.');
    return dot > 0 ? fileName.substring(0, dot) : fileName;
  }

  @Override
  public String toString() {
    return "AudioFile{" + fileName + ", status=" + processingStatus + "}";
  }
}
