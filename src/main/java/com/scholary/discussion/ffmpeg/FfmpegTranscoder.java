package com.scholary.discussion.ffmpeg;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalDouble;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * ffmpeg-backed transcoder.
 *
 * <p>Conversion writes the process output to a log file next to the target so that a hung ffmpeg
 * can be killed after {@code ffmpeg.timeoutMinutes} without blocking on its pipes.
 */
@Component
public class FfmpegTranscoder implements AudioTranscoder {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegTranscoder.class);

  private static final int MAX_OUTPUT_CHARS = 2000;

  private final FfmpegProperties properties;

  public FfmpegTranscoder(FfmpegProperties properties) {
    this.properties = properties;
  }

  @Override
  public boolean isAvailable() {
    ProcessBuilder pb = new ProcessBuilder(properties.binary(), "-version");
    pb.redirectErrorStream(true);
    try {
      Process process = pb.start();
      process.getInputStream().readAllBytes();
      int exitCode = process.waitFor();
      if (exitCode != 0) {
        LOGGER.warn("ffmpeg probe exited with code {}", exitCode);
      }
      return exitCode == 0;
    } catch (IOException e) {
      LOGGER.warn("ffmpeg not available: {}", e.getMessage());
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  @Override
  public void convertToMp3(Path input, Path output) {
    List<String> command = buildConvertCommand(input, output);
    LOGGER.info("Converting {} to MP3: {}", input.getFileName(), output);
    LOGGER.debug("Executing: {}", String.join(" ", command));

    Path logFile = output.resolveSibling(output.getFileName() + ".ffmpeg.log");
    ProcessBuilder pb = new ProcessBuilder(command);
    pb.redirectErrorStream(true);
    pb.redirectOutput(logFile.toFile());

    long startMs = System.currentTimeMillis();
    try {
      Files.createDirectories(output.toAbsolutePath().getParent());
      Process process = pb.start();
      boolean finished = process.waitFor(properties.timeoutMinutes(), TimeUnit.MINUTES);
      if (!finished) {
        process.destroyForcibly();
        throw new TranscodingException(
            String.format(
                "ffmpeg timed out after %d minutes converting %s",
                properties.timeoutMinutes(), input.getFileName()));
      }
      int exitCode = process.exitValue();
      if (exitCode != 0) {
        throw new TranscodingException(
            String.format(
                "ffmpeg exited with code %d converting %s: %s",
                exitCode, input.getFileName(), readTail(logFile)));
      }
      if (!Files.exists(output) || Files.size(output) == 0) {
        throw new TranscodingException("ffmpeg produced no output for " + input.getFileName());
      }
      LOGGER.info(
          "Converted {} in {}ms: {} -> {} bytes",
          input.getFileName(),
          System.currentTimeMillis() - startMs,
          Files.size(input),
          Files.size(output));
    } catch (IOException e) {
      throw new TranscodingException("Failed to run ffmpeg for " + input.getFileName(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TranscodingException("Conversion interrupted for " + input.getFileName(), e);
    } finally {
      deleteQuietly(logFile);
    }
  }

  @Override
  public OptionalDouble probeDurationSeconds(Path input) {
    ProcessBuilder pb =
        new ProcessBuilder(
            probeBinary(),
            "-v", "error",
            "-show_entries", "format=duration",
            "-of", "default=noprint_wrappers=1:nokey=1",
            input.toString());
    pb.redirectErrorStream(true);

    try {
      Process process = pb.start();
      String output =
          new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).trim();
      int exitCode = process.waitFor();
      if (exitCode != 0) {
        LOGGER.debug("ffprobe failed for {}: {}", input.getFileName(), output);
        return OptionalDouble.empty();
      }
      return OptionalDouble.of(Double.parseDouble(output));
    } catch (IOException | NumberFormatException e) {
      LOGGER.debug("Could not probe duration of {}: {}", input.getFileName(), e.getMessage());
      return OptionalDouble.empty();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return OptionalDouble.empty();
    }
  }

  List<String> buildConvertCommand(Path input, Path output) {
    return List.of(
        properties.binary(),
        "-y",
        "-i", input.toString(),
        "-codec:a", "libmp3lame",
        "-b:a", properties.bitrate(),
        "-ar", String.valueOf(properties.sampleRate()),
        "-ac", String.valueOf(properties.channels()),
        "-af", "volume=" + properties.volume(),
        output.toString());
  }

  private String probeBinary() {
    String binary = properties.binary();
    int index = binary.lastIndexOf("ffmpeg");
    if (index < 0) {
      return "ffprobe";
    }
    return binary.substring(0, index) + "ffprobe" + binary.substring(index + 6);
  }

  private String readTail(Path logFile) {
    try {
      String output = Files.readString(logFile, StandardCharsets.UTF_8).trim();
      return output.length() > MAX_OUTPUT_CHARS
          ? output.substring(output.length() - MAX_OUTPUT_CHARS)
          : output;
    } catch (IOException e) {
      return "(no output captured: " + e.getMessage() + ")";
    }
  }

  private void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      LOGGER.debug("Could not delete {}: {}", file, e.getMessage());
    }
  }
}
