package com.scholary.discussion.api;

import jakarta.validation.constraints.NotBlank;
import java.time.LocalDate;
import java.util.Map;

/**
 * Request to register and process a session.
 *
 * @param folderPath folder holding the raw recordings
 * @param micAssignments 0-based mic slot to participant name
 */
public record CreateSessionRequest(
    @NotBlank String folderPath,
    @NotBlank String movieTitle,
    LocalDate sessionDate,
    Map<Integer, String> micAssignments) {}
