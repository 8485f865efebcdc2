package com.scholary.discussion.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Structured logging of pipeline events through MDC.
 *
 * <p>Each event sets an {@code event_type} plus a few queryable fields, logs one line, and clears
 * its fields again. The session id is set once per run with {@link #setSessionContext}.
 */
public class PipelineEventLogger {

  private final Logger logger;

  public PipelineEventLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a session phase transition. */
  public void logPhaseStarted(String sessionId, String phase) {
    try {
      MDC.put("event_type", "phase_started");
      MDC.put("phase", phase);

      logger.info("Phase started: session={}, phase={}", sessionId, phase);
    } finally {
      clearEventFields();
    }
  }

  /** Log a file moving from one processing status to another. */
  public void logFileStatusChanged(String fileName, String fromStatus, String toStatus) {
    try {
      MDC.put("event_type", "file_status_changed");
      MDC.put("file", fileName);
      MDC.put("fromStatus", fromStatus);
      MDC.put("toStatus", toStatus);

      logger.info("File status changed: file={}, {} -> {}", fileName, fromStatus, toStatus);
    } finally {
      clearEventFields();
    }
  }

  /** Log a retried upload or LLM call. */
  public void logRetry(
      String operation, String target, int attempt, int maxAttempts, long delayMs, String message) {
    try {
      MDC.put("event_type", "retry");
      MDC.put("operation", operation);
      MDC.put("file", target);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxAttempts", String.valueOf(maxAttempts));

      logger.warn(
          "Retrying {}: target={}, attempt={}/{}, delay={}ms, error={}",
          operation,
          target,
          attempt,
          maxAttempts,
          delayMs,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a single poll of a transcription job. */
  public void logPoll(String transcriptId, String status, long elapsedSeconds) {
    try {
      MDC.put("event_type", "transcription_poll");
      MDC.put("transcriptId", transcriptId);
      MDC.put("jobStatus", status);

      logger.debug(
          "Transcription poll: id={}, status={}, elapsed={}s",
          transcriptId,
          status,
          elapsedSeconds);
    } finally {
      clearEventFields();
    }
  }

  /** Log a per-file failure that is recorded on the file and does not stop the session. */
  public void logFileFailed(String fileName, String phase, String message) {
    try {
      MDC.put("event_type", "file_failed");
      MDC.put("file", fileName);
      MDC.put("phase", phase);

      logger.error("File failed: file={}, phase={}, error={}", fileName, phase, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log the outcome of parsing an analysis response. */
  public void logAnalysisParsed(String outcome, int populatedCategories, int responseLength) {
    try {
      MDC.put("event_type", "analysis_parsed");
      MDC.put("outcome", outcome);
      MDC.put("populatedCategories", String.valueOf(populatedCategories));

      logger.info(
          "Analysis parsed: outcome={}, categories={}, responseChars={}",
          outcome,
          populatedCategories,
          responseLength);
    } finally {
      clearEventFields();
    }
  }

  /** Set session context in MDC. */
  public static void setSessionContext(String sessionId, String sessionName) {
    MDC.put("sessionId", sessionId);
    MDC.put("sessionName", sessionName);
  }

  /** Clear session context from MDC. */
  public static void clearSessionContext() {
    MDC.remove("sessionId");
    MDC.remove("sessionName");
  }

  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("phase");
    MDC.remove("file");
    MDC.remove("fromStatus");
    MDC.remove("toStatus");
    MDC.remove("operation");
    MDC.remove("attempt");
    MDC.remove("maxAttempts");
    MDC.remove("transcriptId");
    MDC.remove("jobStatus");
    MDC.remove("outcome");
    MDC.remove("populatedCategories");
  }
}
