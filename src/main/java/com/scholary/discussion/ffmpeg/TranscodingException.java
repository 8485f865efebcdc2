package com.scholary.discussion.ffmpeg;

/**
 * Exception thrown when transcoding fails.
 *
 * <p>The message carries the tool's captured output so the failure can be diagnosed from the
 * file's recorded error alone.
 */
public class TranscodingException extends RuntimeException {

  public TranscodingException(String message) {
    super(message);
  }

  public TranscodingException(String message, Throwable cause) {
    super(message, cause);
  }
}
