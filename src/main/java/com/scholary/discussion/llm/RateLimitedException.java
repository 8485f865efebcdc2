package com.scholary.discussion.llm;

/** The API answered 429; the call may succeed after backing off. */
public class RateLimitedException extends LlmException {

  public RateLimitedException(String message) {
    super(message);
  }

  public RateLimitedException(String message, Throwable cause) {
    super(message, cause);
  }
}
