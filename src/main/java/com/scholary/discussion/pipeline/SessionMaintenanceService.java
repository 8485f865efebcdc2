package com.scholary.discussion.pipeline;

import com.scholary.discussion.analysis.model.CategoryResults;
import com.scholary.discussion.clip.HighlightClipService;
import com.scholary.discussion.folder.StatusFolderOrganizer;
import com.scholary.discussion.folder.StatusFolderViolationException;
import com.scholary.discussion.session.AudioFile;
import com.scholary.discussion.session.AudioProcessingStatus;
import com.scholary.discussion.session.ProcessingStatus;
import com.scholary.discussion.session.Session;
import com.scholary.discussion.session.SessionNotFoundException;
import com.scholary.discussion.session.SessionRepository;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Operator actions on stored sessions: recovery, stuck-session cleanup and partial reruns. */
@Service
public class SessionMaintenanceService {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionMaintenanceService.class);

  private final SessionRepository repository;
  private final SessionPipelineDriver driver;
  private final HighlightClipService highlightClipService;
  private final StatusFolderOrganizer organizer;
  private final SessionRunRegistry runRegistry;
  private final Clock clock;

  public SessionMaintenanceService(
      SessionRepository repository,
      SessionPipelineDriver driver,
      HighlightClipService highlightClipService,
      StatusFolderOrganizer organizer,
      SessionRunRegistry runRegistry,
      Clock clock) {
    this.repository = repository;
    this.driver = driver;
    this.highlightClipService = highlightClipService;
    this.organizer = organizer;
    this.runRegistry = runRegistry;
    this.clock = clock;
  }

  /**
   * Reset retry-eligible failed files to the pending status of their stage, moving them back into
   * the pending folders. A failed session with recovered files returns to {@code PENDING}.
   *
   * @return number of files recovered
   */
  public int recoverFailedAudioFiles(String sessionId) {
    Session session = load(sessionId);
    runRegistry.claim(sessionId);
    try {
      return recover(session);
    } finally {
      runRegistry.release(sessionId);
    }
  }

  private int recover(Session session) {
    String sessionId = session.getId();
    Path sessionFolder = Path.of(session.getFolderPath());
    int recovered = 0;

    for (AudioFile file : session.getAudioFiles()) {
      if (!file.getProcessingStatus().isFailure() || !file.isRetryEligible()) {
        continue;
      }
      AudioProcessingStatus target =
          file.getProcessingStatus() == AudioProcessingStatus.FAILED_MP3
              ? AudioProcessingStatus.PENDING_MP3
              : AudioProcessingStatus.PENDING;
      try {
        organizer.moveAudioFile(file, target, sessionFolder);
      } catch (StatusFolderViolationException | UncheckedIOException e) {
        LOGGER.warn("Could not recover {}: {}", file.getFileName(), e.getMessage());
        continue;
      }
      file.setConversionError(null);
      recovered++;
    }

    if (recovered > 0 && session.getStatus() == ProcessingStatus.FAILED) {
      session.setStatus(ProcessingStatus.PENDING);
      session.setErrorMessage(null);
    }
    repository.upsert(session);
    LOGGER.info("Recovered {} failed files in session {}", recovered, sessionId);
    return recovered;
  }

  /**
   * Fail sessions that have been in progress without an update for longer than {@code threshold}.
   *
   * @return ids of the sessions marked failed
   */
  public List<String> failStuckSessions(Duration threshold) {
    Instant cutoff = clock.instant().minus(threshold);
    List<Session> stuck =
        repository.findBy(
            session ->
                session.getStatus().isInProgress() && session.getUpdatedAt().isBefore(cutoff));

    for (Session session : stuck) {
      LOGGER.warn(
          "Session {} stuck in {} since {}, marking failed",
          session.getId(),
          session.getStatus(),
          session.getUpdatedAt());
      session.setErrorMessage(
          String.format(
              "Stuck in %s for more than %d minutes", session.getStatus(), threshold.toMinutes()));
      session.setStatus(ProcessingStatus.FAILED);
      repository.upsert(session);
    }
    return stuck.stream().map(Session::getId).collect(Collectors.toList());
  }

  /** Run only the analysis phase again from the stored transcripts. */
  public Session rerunAnalysis(String sessionId) {
    Session session = load(sessionId);
    if (session.getStatus().isInProgress()) {
      throw new IllegalStateException("Session " + sessionId + " is still being processed");
    }
    runRegistry.claim(sessionId);
    try {
      LOGGER.info("Re-running analysis for session {}", sessionId);
      return driver.reanalyze(session);
    } finally {
      runRegistry.release(sessionId);
    }
  }

  /** Cut the clips of the stored analysis results again. */
  public Session regenerateClips(String sessionId) {
    Session session = load(sessionId);
    CategoryResults results = session.getCategoryResults();
    if (results == null) {
      throw new IllegalStateException("Session " + sessionId + " has no analysis results");
    }
    session.setCategoryResults(highlightClipService.attachClips(session, results));
    repository.upsert(session);
    LOGGER.info("Regenerated clips for session {}", sessionId);
    return session;
  }

  private Session load(String sessionId) {
    return repository.getById(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
  }
}
