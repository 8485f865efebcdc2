package com.scholary.discussion.ffmpeg;

import java.nio.file.Path;
import java.util.OptionalDouble;

/**
 * Converts recordings into a format the transcription service accepts.
 *
 * <p>Implementations shell out to an external tool, so availability is probed rather than assumed.
 */
public interface AudioTranscoder {

  /** Whether the external tool can be started. Probed on every call. */
  boolean isAvailable();

  /**
   * Convert an audio file to MP3.
   *
   * @param input the source recording
   * @param output where the MP3 is written; overwritten if present
   * @throws TranscodingException if the tool fails, times out or is missing
   */
  void convertToMp3(Path input, Path output);

  /** Duration of a recording in seconds, empty if it cannot be determined. */
  OptionalDouble probeDurationSeconds(Path input);
}
