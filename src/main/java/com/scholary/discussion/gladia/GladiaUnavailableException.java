package com.scholary.discussion.gladia;

/**
 * Exception thrown when Gladia could not be reached, even after retries.
 *
 * <p>The request itself may be fine; a later attempt with the same job id can still succeed.
 */
public class GladiaUnavailableException extends GladiaException {

  public GladiaUnavailableException(String message) {
    super(message);
  }

  public GladiaUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
