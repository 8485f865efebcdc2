package com.scholary.discussion.folder;

/**
 * Thrown when a move would put a file into a status folder of the wrong stage, such as an MP3 into
 * the WAV-only {@code pending} folder. The file is left where it was.
 */
public class StatusFolderViolationException extends RuntimeException {

  public StatusFolderViolationException(String message) {
    super(message);
  }
}
