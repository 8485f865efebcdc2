package com.scholary.discussion.analysis.model;

/** How a participant answered one of the opening discussion questions. */
public record QuestionAnswer(
    String question, String speaker, String answer, String timestamp, int entertainmentValue) {

  public QuestionAnswer withSpeaker(String newSpeaker) {
    return new QuestionAnswer(question, newSpeaker, answer, timestamp, entertainmentValue);
  }
}
