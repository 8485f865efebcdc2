package com.scholary.discussion.analysis.model;

import java.util.Locale;

/** Audio quality the model reports for a quoted moment. */
public enum AudioQuality {
  CLEAR,
  MUFFLED,
  BACKGROUND_NOISE;

  /** Lenient parse; anything unrecognised counts as clear. */
  public static AudioQuality fromLabel(String label) {
    if (label == null) {
      return CLEAR;
    }
    String normalized = label.trim().toLowerCase(Locale.ROOT).replace(" ", "_");
    switch (normalized) {
      case "muffled":
      case "distorted":
        return MUFFLED;
      case "background_noise":
      case "backgroundnoise":
        return BACKGROUND_NOISE;
      default:
        return CLEAR;
    }
  }
}
