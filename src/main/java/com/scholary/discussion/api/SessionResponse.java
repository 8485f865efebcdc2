package com.scholary.discussion.api;

import com.scholary.discussion.analysis.model.CategoryResults;
import com.scholary.discussion.session.ProcessingStatus;
import com.scholary.discussion.session.Session;
import com.scholary.discussion.stats.SessionStats;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** A session as returned by the API. */
public record SessionResponse(
    String id,
    String movieTitle,
    LocalDate sessionDate,
    ProcessingStatus status,
    String errorMessage,
    Map<Integer, String> micAssignments,
    List<String> participantsPresent,
    List<String> participantsAbsent,
    List<AudioFileSummary> audioFiles,
    CategoryResults categoryResults,
    SessionStats sessionStats,
    Instant createdAt,
    Instant updatedAt,
    Instant processedAt) {

  public static SessionResponse from(Session session) {
    return new SessionResponse(
        session.getId(),
        session.getMovieTitle(),
        session.getSessionDate(),
        session.getStatus(),
        session.getErrorMessage(),
        session.getMicAssignments(),
        session.getParticipantsPresent(),
        session.getParticipantsAbsent(),
        session.getAudioFiles().stream().map(AudioFileSummary::from).collect(Collectors.toList()),
        session.getCategoryResults(),
        session.getSessionStats(),
        session.getCreatedAt(),
        session.getUpdatedAt(),
        session.getProcessedAt());
  }
}
