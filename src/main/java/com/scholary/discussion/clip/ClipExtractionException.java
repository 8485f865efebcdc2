package com.scholary.discussion.clip;

/** Exception thrown when a clip cannot be cut from a recording. */
public class ClipExtractionException extends RuntimeException {

  public ClipExtractionException(String message) {
    super(message);
  }

  public ClipExtractionException(String message, Throwable cause) {
    super(message, cause);
  }
}
