package com.scholary.discussion.gladia;

/** Thrown when a transcription job is still not finished when the poll ceiling is reached. */
public class TranscriptionTimeoutException extends GladiaException {

  public TranscriptionTimeoutException(String message) {
    super(message);
  }
}
