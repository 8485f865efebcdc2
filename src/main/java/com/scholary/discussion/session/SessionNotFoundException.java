package com.scholary.discussion.session;

/** Thrown when a session id does not resolve to a stored session. */
public class SessionNotFoundException extends RuntimeException {

  public SessionNotFoundException(String sessionId) {
    super("Session not found: " + sessionId);
  }
}
