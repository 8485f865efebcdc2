package com.scholary.discussion.api;

import com.scholary.discussion.archive.ArchivedArtifact;
import com.scholary.discussion.archive.ArtifactArchiver;
import com.scholary.discussion.config.PipelineProperties;
import com.scholary.discussion.pipeline.SessionMaintenanceService;
import com.scholary.discussion.pipeline.SessionService;
import com.scholary.discussion.session.ProcessingStatus;
import com.scholary.discussion.session.Session;
import com.scholary.discussion.session.SessionNotFoundException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for discussion sessions.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Creating a session and processing it asynchronously
 *   <li>Session lookup and listing by status
 *   <li>Maintenance: re-running analysis, recovering failed files, failing stuck sessions,
 *       regenerating clips and archiving artifacts
 * </ul>
 */
@RestController
@RequestMapping("/api/sessions")
@Tag(name = "Sessions", description = "Discussion session processing API")
public class SessionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionController.class);

  private final SessionService sessionService;
  private final SessionMaintenanceService maintenanceService;
  private final ArtifactArchiver archiver;
  private final PipelineProperties properties;

  public SessionController(
      SessionService sessionService,
      SessionMaintenanceService maintenanceService,
      ArtifactArchiver archiver,
      PipelineProperties properties) {
    this.sessionService = sessionService;
    this.maintenanceService = maintenanceService;
    this.archiver = archiver;
    this.properties = properties;
  }

  @PostMapping
  @Operation(
      summary = "Create and process a session",
      description =
          "Register a folder of recordings with its mic assignments and start processing it in "
              + "the background. Poll the returned session for progress.")
  public ResponseEntity<SessionResponse> create(@Valid @RequestBody CreateSessionRequest request) {
    LOGGER.info(
        "Create session request: folder={}, movie={}", request.folderPath(), request.movieTitle());
    Session session =
        sessionService.create(
            request.folderPath(),
            request.movieTitle(),
            request.sessionDate(),
            request.micAssignments());
    sessionService.claimForProcessing(session.getId());
    dispatch(session.getId());
    return ResponseEntity.accepted().body(SessionResponse.from(session));
  }

  @GetMapping("/{id}")
  @Operation(summary = "Get session", description = "Current state of a session")
  public ResponseEntity<SessionResponse> get(@PathVariable String id) {
    return ResponseEntity.ok(SessionResponse.from(sessionService.get(id)));
  }

  @GetMapping
  @Operation(summary = "List sessions", description = "Sessions newest first, optionally by status")
  public List<SessionResponse> list(@RequestParam(required = false) ProcessingStatus status) {
    return sessionService.list(status).stream()
        .map(SessionResponse::from)
        .collect(Collectors.toList());
  }

  @PostMapping("/{id}/process")
  @Operation(
      summary = "Process session again",
      description =
          "Resume the pipeline for a session; finished steps are skipped. Refused while the "
              + "session is queued or running.")
  public ResponseEntity<SessionResponse> process(@PathVariable String id) {
    Session session = sessionService.claimForProcessing(id);
    dispatch(id);
    return ResponseEntity.accepted().body(SessionResponse.from(session));
  }

  @PostMapping("/{id}/analysis")
  @Operation(
      summary = "Re-run analysis",
      description = "Run the analysis phase again from the stored transcripts")
  public ResponseEntity<SessionResponse> rerunAnalysis(@PathVariable String id) {
    return ResponseEntity.ok(SessionResponse.from(maintenanceService.rerunAnalysis(id)));
  }

  @PostMapping("/{id}/recover")
  @Operation(
      summary = "Recover failed files",
      description = "Reset retry-eligible failed files to pending so the next run picks them up")
  public ResponseEntity<MaintenanceResponse> recover(@PathVariable String id) {
    int recovered = maintenanceService.recoverFailedAudioFiles(id);
    return ResponseEntity.ok(new MaintenanceResponse(recovered, List.of(id)));
  }

  @PostMapping("/stuck")
  @Operation(
      summary = "Fail stuck sessions",
      description = "Mark sessions in progress for longer than the threshold as failed")
  public ResponseEntity<MaintenanceResponse> failStuck(
      @RequestParam(required = false) Integer olderThanMinutes) {
    int minutes = olderThanMinutes != null ? olderThanMinutes : properties.stuckSessionMinutes();
    if (minutes <= 0) {
      throw new IllegalArgumentException("olderThanMinutes must be positive");
    }
    List<String> failed = maintenanceService.failStuckSessions(Duration.ofMinutes(minutes));
    return ResponseEntity.ok(new MaintenanceResponse(failed.size(), failed));
  }

  @PostMapping("/{id}/clips")
  @Operation(
      summary = "Regenerate clips",
      description = "Cut the highlight clips of the stored analysis again")
  public ResponseEntity<SessionResponse> regenerateClips(@PathVariable String id) {
    return ResponseEntity.ok(SessionResponse.from(maintenanceService.regenerateClips(id)));
  }

  @PostMapping("/{id}/archive")
  @Operation(
      summary = "Archive artifacts",
      description = "Copy transcripts, analysis records and clips to the archive bucket")
  public ResponseEntity<List<ArchivedArtifact>> archive(@PathVariable String id) {
    if (!archiver.isEnabled()) {
      throw new IllegalStateException("Archive is disabled");
    }
    return ResponseEntity.ok(archiver.archive(sessionService.get(id)));
  }

  private void dispatch(String sessionId) {
    try {
      sessionService.processAsync(sessionId);
    } catch (TaskRejectedException e) {
      sessionService.releaseClaim(sessionId);
      LOGGER.warn("Pipeline queue full, session {} not started", sessionId);
      throw new IllegalStateException("Pipeline queue is full, try again later", e);
    }
  }

  @ExceptionHandler(SessionNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleNotFound(SessionNotFoundException e) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse(e.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException e) {
    return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
  }

  @ExceptionHandler(IllegalStateException.class)
  public ResponseEntity<ErrorResponse> handleConflict(IllegalStateException e) {
    return ResponseEntity.status(HttpStatus.CONFLICT).body(new ErrorResponse(e.getMessage()));
  }
}
