package com.scholary.discussion.stats;

/** Overall energy of a session, from the entertainment scores of its highlights. */
public enum EnergyLevel {
  LOW,
  MEDIUM,
  HIGH;

  static EnergyLevel fromAverageScore(double average) {
    if (average >= 8.0) {
      return HIGH;
    }
    if (average >= 6.0) {
      return MEDIUM;
    }
    return LOW;
  }
}
