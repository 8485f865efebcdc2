package com.scholary.discussion.pipeline;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Sessions that are queued for, or running, a pipeline or maintenance task.
 *
 * <p>A session has at most one writer: a task claims the session id before it is dispatched and
 * releases it when done. A second claim on the same id fails until then.
 */
@Component
public class SessionRunRegistry {

  private final Set<String> claimed = ConcurrentHashMap.newKeySet();

  /** @return true if the caller now owns the session, false if another task does */
  public boolean tryClaim(String sessionId) {
    return claimed.add(sessionId);
  }

  public void release(String sessionId) {
    claimed.remove(sessionId);
  }

  public boolean isClaimed(String sessionId) {
    return claimed.contains(sessionId);
  }

  /**
   * Claim the session or fail.
   *
   * @throws IllegalStateException if the session is already queued or being processed
   */
  public void claim(String sessionId) {
    if (!tryClaim(sessionId)) {
      throw new IllegalStateException(
          "Session " + sessionId + " is already queued or being processed");
    }
  }
}
