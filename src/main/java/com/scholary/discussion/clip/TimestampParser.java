package com.scholary.discussion.clip;

import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Parses highlight timestamps such as {@code 4:05}, {@code 12:30} or {@code 1:02:03}. */
public final class TimestampParser {

  private static final Pattern TIMESTAMP =
      Pattern.compile("(?:(\\d+):)?(\\d{1,3}):(\\d{2})(?:\\.\\d+)?");

  private TimestampParser() {}

  /** Seconds from the start, or empty for anything that is not {@code M:SS} or {@code H:MM:SS}. */
  public static OptionalDouble parse(String timestamp) {
    if (timestamp == null) {
      return OptionalDouble.empty();
    }
    Matcher matcher = TIMESTAMP.matcher(timestamp.trim());
    if (!matcher.matches()) {
      return OptionalDouble.empty();
    }
    int hours = matcher.group(1) == null ? 0 : Integer.parseInt(matcher.group(1));
    int minutes = Integer.parseInt(matcher.group(2));
    int seconds = Integer.parseInt(matcher.group(3));
    if (seconds >= 60 || (matcher.group(1) != null && minutes >= 60)) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of(hours * 3600.0 + minutes * 60.0 + seconds);
  }
}
