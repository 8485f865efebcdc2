package com.scholary.discussion.session;

import com.scholary.discussion.analysis.model.CategoryResults;
import com.scholary.discussion.stats.SessionStats;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * One recorded discussion event.
 *
 * <p>Owned by the pipeline while processing and written back to the {@link SessionRepository} at
 * every phase boundary so that a restart resumes instead of redoing work.
 */
public class Session {

  private final String id;
  private final Instant createdAt;

  private String movieTitle;
  private LocalDate sessionDate;
  private String folderPath;
  private ProcessingStatus status = ProcessingStatus.PENDING;
  private List<AudioFile> audioFiles = new ArrayList<>();
  private Map<Integer, String> micAssignments = new TreeMap<>();
  private List<String> participantsPresent = new ArrayList<>();
  private List<String> participantsAbsent = new ArrayList<>();
  private CategoryResults categoryResults;
  private SessionStats sessionStats;
  private String errorMessage;
  private Instant updatedAt;
  private Instant processedAt;

  public Session(String id, Instant createdAt) {
    this.id = id;
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
  }

  public String getId() {
    return id;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public String getMovieTitle() {
    return movieTitle;
  }

  public void setMovieTitle(String movieTitle) {
    this.movieTitle = movieTitle;
  }

  public LocalDate getSessionDate() {
    return sessionDate;
  }

  public void setSessionDate(LocalDate sessionDate) {
    this.sessionDate = sessionDate;
  }

  public String getFolderPath() {
    return folderPath;
  }

  public void setFolderPath(String folderPath) {
    this.folderPath = folderPath;
  }

  public ProcessingStatus getStatus() {
    return status;
  }

  public void setStatus(ProcessingStatus status) {
    this.status = status;
  }

  public List<AudioFile> getAudioFiles() {
    return audioFiles;
  }

  public void setAudioFiles(List<AudioFile> audioFiles) {
    this.audioFiles = audioFiles;
  }

  public Map<Integer, String> getMicAssignments() {
    return micAssignments;
  }

  public void setMicAssignments(Map<Integer, String> micAssignments) {
    this.micAssignments = new TreeMap<>(micAssignments);
  }

  public List<String> getParticipantsPresent() {
    return participantsPresent;
  }

  public void setParticipantsPresent(List<String> participantsPresent) {
    this.participantsPresent = participantsPresent;
  }

  public List<String> getParticipantsAbsent() {
    return participantsAbsent;
  }

  public void setParticipantsAbsent(List<String> participantsAbsent) {
    this.participantsAbsent = participantsAbsent;
  }

  public CategoryResults getCategoryResults() {
    return categoryResults;
  }

  public void setCategoryResults(CategoryResults categoryResults) {
    this.categoryResults = categoryResults;
  }

  public SessionStats getSessionStats() {
    return sessionStats;
  }

  public void setSessionStats(SessionStats sessionStats) {
    this.sessionStats = sessionStats;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public void setErrorMessage(String errorMessage) {
    this.errorMessage = errorMessage;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void setUpdatedAt(Instant updatedAt) {
    this.updatedAt = updatedAt;
  }

  public Instant getProcessedAt() {
    return processedAt;
  }

  public void setProcessedAt(Instant processedAt) {
    this.processedAt = processedAt;
  }

  public Optional<AudioFile> findMasterRecording() {
    return audioFiles.stream().filter(AudioFile::isMasterRecording).findFirst();
  }

  /** Participant name for a 0-based mic slot, if one is assigned. */
  public Optional<String> participantForSlot(Integer slot) {
    if (slot == null) {
      return Optional.empty();
    }
    String name = micAssignments.get(slot);
    return name == null || name.isBlank() ? Optional.empty() : Optional.of(name);
  }

  /** Session folder name, used as the sub-folder below every status folder. */
  public String getSessionName() {
    if (folderPath == null) {
      return id;
    }
    return Path.of(folderPath).getFileName().toString();
  }
}
