package com.scholary.discussion.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.discussion.archive.ArtifactArchiver;
import com.scholary.discussion.config.PipelineProperties;
import com.scholary.discussion.pipeline.SessionMaintenanceService;
import com.scholary.discussion.pipeline.SessionService;
import com.scholary.discussion.session.ProcessingStatus;
import com.scholary.discussion.session.Session;
import com.scholary.discussion.session.SessionNotFoundException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class SessionControllerTest {

  @Mock private SessionService sessionService;
  @Mock private SessionMaintenanceService maintenanceService;
  @Mock private ArtifactArchiver archiver;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    PipelineProperties properties =
        new PipelineProperties("./uploads", "./clips", 1000, 1000L, 1, 1, 120);
    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new SessionController(sessionService, maintenanceService, archiver, properties))
            .build();
  }

  @Test
  void create_shouldRegisterSessionAndStartProcessing() throws Exception {
    Session session = new Session("s1", Instant.EPOCH);
    session.setMovieTitle("Dune");
    when(sessionService.create(
            eq("/data/movie-night"),
            eq("Dune"),
            eq(LocalDate.of(2024, 3, 15)),
            eq(Map.of(0, "Alice", 1, "Bob"))))
        .thenReturn(session);

    mockMvc
        .perform(
            post("/api/sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"folderPath\": \"/data/movie-night\", \"movieTitle\": \"Dune\","
                        + " \"sessionDate\": \"2024-03-15\","
                        + " \"micAssignments\": {\"0\": \"Alice\", \"1\": \"Bob\"}}"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.id").value("s1"))
        .andExpect(jsonPath("$.status").value("PENDING"));

    verify(sessionService).claimForProcessing("s1");
    verify(sessionService).processAsync("s1");
  }

  @Test
  void create_shouldRejectMissingTitle() throws Exception {
    mockMvc
        .perform(
            post("/api/sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"folderPath\": \"/data/movie-night\"}"))
        .andExpect(status().isBadRequest());

    verify(sessionService, never()).processAsync(anyString());
  }

  @Test
  void create_shouldReturnBadRequestForMissingFolder() throws Exception {
    when(sessionService.create(any(), any(), any(), any()))
        .thenThrow(new IllegalArgumentException("Session folder does not exist: /nope"));

    mockMvc
        .perform(
            post("/api/sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"folderPath\": \"/nope\", \"movieTitle\": \"Dune\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Session folder does not exist: /nope"));
  }

  @Test
  void get_shouldReturnNotFoundForUnknownSession() throws Exception {
    when(sessionService.get("missing")).thenThrow(new SessionNotFoundException("missing"));

    mockMvc.perform(get("/api/sessions/missing")).andExpect(status().isNotFound());
  }

  @Test
  void list_shouldFilterByStatus() throws Exception {
    Session done = new Session("s2", Instant.EPOCH);
    done.setStatus(ProcessingStatus.COMPLETE);
    when(sessionService.list(ProcessingStatus.COMPLETE)).thenReturn(List.of(done));

    mockMvc
        .perform(get("/api/sessions").param("status", "COMPLETE"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].id").value("s2"));
  }

  @Test
  void process_shouldRefuseSessionInProgress() throws Exception {
    when(sessionService.claimForProcessing("s1"))
        .thenThrow(new IllegalStateException("Session s1 is already queued or being processed"));

    mockMvc
        .perform(post("/api/sessions/s1/process"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.error").value("Session s1 is already queued or being processed"));

    verify(sessionService, never()).processAsync(anyString());
  }

  @Test
  void process_shouldReleaseClaimWhenQueueIsFull() throws Exception {
    when(sessionService.claimForProcessing("s1")).thenReturn(new Session("s1", Instant.EPOCH));
    doThrow(new TaskRejectedException("queue full")).when(sessionService).processAsync("s1");

    mockMvc.perform(post("/api/sessions/s1/process")).andExpect(status().isConflict());

    verify(sessionService).releaseClaim("s1");
  }

  @Test
  void failStuck_shouldUseConfiguredThresholdByDefault() throws Exception {
    when(maintenanceService.failStuckSessions(Duration.ofMinutes(120)))
        .thenReturn(List.of("s1", "s3"));

    mockMvc
        .perform(post("/api/sessions/stuck"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.affected").value(2))
        .andExpect(jsonPath("$.sessionIds[1]").value("s3"));
  }

  @Test
  void failStuck_shouldRejectNonPositiveThreshold() throws Exception {
    mockMvc
        .perform(post("/api/sessions/stuck").param("olderThanMinutes", "0"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void recover_shouldReportRecoveredFiles() throws Exception {
    when(maintenanceService.recoverFailedAudioFiles("s1")).thenReturn(3);

    mockMvc
        .perform(post("/api/sessions/s1/recover"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.affected").value(3));
  }

  @Test
  void archive_shouldConflictWhenDisabled() throws Exception {
    when(archiver.isEnabled()).thenReturn(false);

    mockMvc.perform(post("/api/sessions/s1/archive")).andExpect(status().isConflict());
  }
}
