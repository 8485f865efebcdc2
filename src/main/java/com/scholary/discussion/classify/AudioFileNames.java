package com.scholary.discussion.classify;

import java.util.Locale;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Naming conventions of the recorder's output files. */
public final class AudioFileNames {

  public static final Set<String> AUDIO_EXTENSIONS =
      Set.of("mp3", "wav", "ogg", "flac", "aac", "m4a", "wma");

  public static final String MASTER_BASE_NAME = "MASTER_MIX";

  private static final Pattern MIC_PATTERN =
      Pattern.compile("^MIC(\\d+)\\.[A-Z0-9]+$", Pattern.CASE_INSENSITIVE);
  private static final Pattern LEGACY_SPEAKER_PATTERN =
      Pattern.compile("^(\\d)_Speaker\\d*.*$", Pattern.CASE_INSENSITIVE);
  private static final Pattern TIMESTAMPED_MASTER_PATTERN =
      Pattern.compile("^\\d{4}_\\d{4}_\\d{4}\\.[A-Z0-9]+$", Pattern.CASE_INSENSITIVE);
  private static final Set<String> MASTER_KEYWORDS = Set.of("master", "combined", "full", "group");

  private AudioFileNames() {}

  public static String extension(String fileName) {
    int dot = fileName.lastIndexOf('.');
    return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
  }

  public static String baseName(String fileName) {
    int dot = fileName.lastIndexOf('.');
    return dot > 0 ? fileName.substring(0, dot) : fileName;
  }

  public static boolean isAudioFile(String fileName) {
    return AUDIO_EXTENSIONS.contains(extension(fileName));
  }

  /** Files the pipeline leaves behind while working, never classified. */
  public static boolean isTemporary(String fileName) {
    String lower = fileName.toLowerCase(Locale.ROOT);
    return lower.startsWith("temp_") || lower.contains("_temp") || lower.endsWith(".tmp");
  }

  /** 1-based microphone number of a {@code MIC<N>} or legacy {@code <N>_Speaker} file. */
  public static OptionalInt micNumber(String fileName) {
    Matcher mic = MIC_PATTERN.matcher(fileName);
    if (mic.matches()) {
      int number = Integer.parseInt(mic.group(1));
      return number > 0 ? OptionalInt.of(number) : OptionalInt.empty();
    }
    Matcher legacy = LEGACY_SPEAKER_PATTERN.matcher(fileName);
    if (legacy.matches()) {
      int number = Integer.parseInt(legacy.group(1));
      return number > 0 ? OptionalInt.of(number) : OptionalInt.empty();
    }
    return OptionalInt.empty();
  }

  public static boolean isPhone(String fileName) {
    return baseName(fileName).equalsIgnoreCase("PHONE");
  }

  public static boolean isSoundPad(String fileName) {
    String base = baseName(fileName);
    return base.equalsIgnoreCase("SOUND_PAD") || base.equalsIgnoreCase("SOUNDPAD");
  }

  public static boolean isAuxiliary(String fileName) {
    return isPhone(fileName) || isSoundPad(fileName);
  }

  /** A file that captures one source only: a personal mic, the phone line or a USB input. */
  public static boolean isSingleSource(String fileName) {
    String upper = baseName(fileName).toUpperCase(Locale.ROOT);
    return micNumber(fileName).isPresent() || isAuxiliary(fileName) || upper.startsWith("USB");
  }

  public static boolean looksLikeMaster(String fileName) {
    if (TIMESTAMPED_MASTER_PATTERN.matcher(fileName).matches()) {
      return true;
    }
    String lower = baseName(fileName).toLowerCase(Locale.ROOT);
    return MASTER_KEYWORDS.stream().anyMatch(lower::contains);
  }

  public static String masterFileName(String originalFileName) {
    return MASTER_BASE_NAME + "." + extension(originalFileName);
  }
}
