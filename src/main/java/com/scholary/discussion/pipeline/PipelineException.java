package com.scholary.discussion.pipeline;

/**
 * Exception thrown when a session cannot continue past a phase.
 *
 * <p>The message names the phase; it becomes the session's error message.
 */
public class PipelineException extends RuntimeException {

  public PipelineException(String message) {
    super(message);
  }

  public PipelineException(String message, Throwable cause) {
    super(message, cause);
  }
}
