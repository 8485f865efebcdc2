package com.scholary.discussion.api;

import java.util.List;

/**
 * Result of a maintenance action.
 *
 * @param affected number of files or sessions changed
 * @param sessionIds sessions changed, where the action spans sessions
 */
public record MaintenanceResponse(int affected, List<String> sessionIds) {}
