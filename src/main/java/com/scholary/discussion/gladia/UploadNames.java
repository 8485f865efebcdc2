package com.scholary.discussion.gladia;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Display names for uploaded recordings, so jobs are recognisable in the Gladia dashboard. */
public final class UploadNames {

  private static final Pattern SESSION_FOLDER = Pattern.compile("(\\d{4})-([A-Za-z]+)-(.+)");

  private UploadNames() {}

  /**
   * {@code 2024-March-The-Dark-Knight} and {@code MIC1.mp3} give {@code The Dark Knight_MIC1.mp3}.
   * Folders not following the year-month-title convention leave the file name as it is.
   */
  public static String displayName(String sessionFolderName, String fileName) {
    if (sessionFolderName == null) {
      return fileName;
    }
    Matcher matcher = SESSION_FOLDER.matcher(sessionFolderName);
    if (!matcher.matches()) {
      return fileName;
    }
    String title = matcher.group(3).replace('-', ' ').trim();
    return title + "_" + fileName;
  }
}
