package com.scholary.discussion.clip;

import com.scholary.discussion.classify.AudioFileNames;
import com.scholary.discussion.config.PipelineProperties;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Cuts WAV clips out of a recording without decoding it.
 *
 * <p>The window is widened to whole seconds and copied byte for byte from the data chunk, so the
 * clip keeps the source format. Clips land in {@code {clipsDir}/{sessionId}/} and are served under
 * {@code /clips/}.
 */
@Component
public class ClipExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(ClipExtractor.class);

  public static final double MAX_CLIP_SECONDS = 300;
  public static final String URL_PREFIX = "/clips/";

  private final Path clipsDir;

  public ClipExtractor(PipelineProperties properties) {
    this.clipsDir = Path.of(properties.clipsDir());
  }

  /**
   * Cut {@code [startSeconds, endSeconds]} out of {@code wav}.
   *
   * @return the clip's URL, {@code /clips/{sessionId}/{clipId}.wav}
   * @throws IllegalArgumentException if the window is empty, negative or longer than five minutes
   * @throws ClipExtractionException if the source cannot be read or the window lies past its end
   */
  public String extract(String sessionId, Path wav, double startSeconds, double endSeconds) {
    double requested = endSeconds - startSeconds;
    if (requested <= 0 || requested > MAX_CLIP_SECONDS) {
      throw new IllegalArgumentException(
          String.format(
              "Clip duration must be in (0, %.0f] seconds, was %.2f", MAX_CLIP_SECONDS, requested));
    }

    try (FileChannel source = FileChannel.open(wav, StandardOpenOption.READ)) {
      WavHeader header = WavHeader.read(source);

      long totalSeconds = header.dataLength() / header.byteRate();
      long startSecond = Math.max(0, Math.min((long) Math.floor(startSeconds), totalSeconds));
      long endSecond = Math.max(0, Math.min((long) Math.ceil(endSeconds), totalSeconds));
      long startByte = startSecond * header.byteRate();
      long endByte = Math.min(endSecond * header.byteRate(), header.dataLength());
      long length = endByte - startByte;
      if (length <= 0) {
        throw new ClipExtractionException(
            String.format(
                "Window %.1f-%.1fs is outside %s (%.1fs long)",
                startSeconds, endSeconds, wav.getFileName(), header.durationSeconds()));
      }

      String clipId =
          AudioFileNames.baseName(wav.getFileName().toString())
              + "_"
              + startSecond
              + "_"
              + endSecond;
      Path sessionClips = clipsDir.resolve(sessionId);
      Files.createDirectories(sessionClips);
      Path target = sessionClips.resolve(clipId + ".wav");

      try (FileChannel out =
          FileChannel.open(
              target,
              StandardOpenOption.CREATE,
              StandardOpenOption.WRITE,
              StandardOpenOption.TRUNCATE_EXISTING)) {
        header.writeCanonical(out, length);
        long position = header.dataOffset() + startByte;
        long remaining = length;
        while (remaining > 0) {
          long copied = source.transferTo(position, remaining, out);
          if (copied <= 0) {
            throw new ClipExtractionException("Short read copying clip from " + wav);
          }
          position += copied;
          remaining -= copied;
        }
      }

      LOGGER.info(
          "Extracted clip {} ({}s-{}s) from {}", target, startSecond, endSecond, wav.getFileName());
      return URL_PREFIX + sessionId + "/" + clipId + ".wav";
    } catch (IOException e) {
      throw new ClipExtractionException("Failed to extract clip from " + wav, e);
    }
  }
}
