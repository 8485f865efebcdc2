package com.scholary.discussion.analysis.model;

/** A runner-up for a category, ranked from place 2 onwards. */
public record RunnerUp(String speaker, String timestamp, String briefDescription, int place) {

  public RunnerUp withSpeaker(String newSpeaker) {
    return new RunnerUp(newSpeaker, timestamp, briefDescription, place);
  }
}
