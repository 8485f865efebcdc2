package com.scholary.discussion.llm;

/** Exception thrown when a chat-completions call fails. */
public class LlmException extends RuntimeException {

  public LlmException(String message) {
    super(message);
  }

  public LlmException(String message, Throwable cause) {
    super(message, cause);
  }
}
