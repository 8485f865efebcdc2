package com.scholary.discussion.session;

/** Overall lifecycle of a discussion session. */
public enum ProcessingStatus {
  PENDING,
  VALIDATING,
  TRANSCRIBING,
  ANALYZING,
  COMPLETE,
  FAILED;

  /** Whether a session in this status is still being worked on by the pipeline. */
  public boolean isInProgress() {
    return this == VALIDATING || this == TRANSCRIBING || this == ANALYZING;
  }
}
