package com.scholary.discussion.gladia;

/**
 * Exception thrown when a Gladia API call fails.
 *
 * <p>Raised for non-success HTTP responses (carrying status and body), for malformed responses,
 * and once transient failures have used up their retries.
 */
public class GladiaException extends RuntimeException {

  public GladiaException(String message) {
    super(message);
  }

  public GladiaException(String message, Throwable cause) {
    super(message, cause);
  }
}
