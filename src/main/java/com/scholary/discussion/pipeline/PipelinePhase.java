package com.scholary.discussion.pipeline;

/** Phases of a session run, in execution order. */
public enum PipelinePhase {
  VALIDATE("validation"),
  CONVERT("conversion"),
  UPLOAD("upload"),
  TRANSCRIBE("transcription"),
  ANALYZE("analysis"),
  COMPLETE("completion");

  private final String label;

  PipelinePhase(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
