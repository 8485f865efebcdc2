package com.scholary.discussion.classify;

/** What a recording in a session folder captured. */
public enum FileRole {
  INDIVIDUAL_MIC,
  AUXILIARY,
  MASTER,
  UNIDENTIFIED
}
