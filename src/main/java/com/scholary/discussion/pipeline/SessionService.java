package com.scholary.discussion.pipeline;

import com.scholary.discussion.session.ProcessingStatus;
import com.scholary.discussion.session.Session;
import com.scholary.discussion.session.SessionNotFoundException;
import com.scholary.discussion.session.SessionRepository;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Creates sessions and runs them on the pipeline executor.
 *
 * <p>{@link #processAsync} is invoked through the Spring proxy, so it must be called from another
 * bean for {@code @Async} to apply. Callers claim the session with {@link #claimForProcessing}
 * first; the claim is released when the run ends.
 */
@Service
public class SessionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionService.class);

  private final SessionRepository repository;
  private final SessionPipelineDriver driver;
  private final SessionRunRegistry runRegistry;
  private final Clock clock;

  public SessionService(
      SessionRepository repository,
      SessionPipelineDriver driver,
      SessionRunRegistry runRegistry,
      Clock clock) {
    this.repository = repository;
    this.driver = driver;
    this.runRegistry = runRegistry;
    this.clock = clock;
  }

  /**
   * Register a new session for a folder of recordings.
   *
   * @param micAssignments 0-based mic slot to participant name
   * @throws IllegalArgumentException if the folder does not exist
   */
  public Session create(
      String folderPath,
      String movieTitle,
      LocalDate sessionDate,
      Map<Integer, String> micAssignments) {
    if (!Files.isDirectory(Path.of(folderPath))) {
      throw new IllegalArgumentException("Session folder does not exist: " + folderPath);
    }
    Session session = new Session(UUID.randomUUID().toString(), clock.instant());
    session.setFolderPath(folderPath);
    session.setMovieTitle(movieTitle);
    session.setSessionDate(sessionDate);
    if (micAssignments != null) {
      session.setMicAssignments(micAssignments);
    }
    repository.upsert(session);
    LOGGER.info("Created session {} for {}", session.getId(), folderPath);
    return session;
  }

  public Session get(String sessionId) {
    return repository.getById(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
  }

  /** Sessions in a status, newest first; all sessions when {@code status} is null. */
  public List<Session> list(ProcessingStatus status) {
    return repository.findBy(session -> status == null || session.getStatus() == status);
  }

  /**
   * Reserve a session for one pipeline run.
   *
   * @throws SessionNotFoundException if the session does not exist
   * @throws IllegalStateException if the session is already queued or being processed
   */
  public Session claimForProcessing(String sessionId) {
    Session session = get(sessionId);
    if (session.getStatus().isInProgress()) {
      throw new IllegalStateException("Session " + sessionId + " is still being processed");
    }
    runRegistry.claim(sessionId);
    return session;
  }

  /** Give up a claim whose run was never dispatched. */
  public void releaseClaim(String sessionId) {
    runRegistry.release(sessionId);
  }

  /** Run the whole pipeline for a claimed session on the pipeline executor. */
  @Async("pipelineExecutor")
  public void processAsync(String sessionId) {
    try {
      Session session = get(sessionId);
      LOGGER.info("Starting pipeline for session {}", sessionId);
      Session processed = driver.process(session);
      LOGGER.info("Pipeline finished for session {}: {}", sessionId, processed.getStatus());
    } finally {
      runRegistry.release(sessionId);
    }
  }
}
