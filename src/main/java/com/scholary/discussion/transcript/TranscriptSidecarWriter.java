package com.scholary.discussion.transcript;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.discussion.session.AudioFile;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes transcript sidecar files next to an audio file.
 *
 * <p>{@code {base}_transcription.json} holds the full service response, pretty printed, and
 * {@code {base}.txt} the mapped transcript text.
 */
@Component
public class TranscriptSidecarWriter {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptSidecarWriter.class);

  private final ObjectMapper objectMapper;

  public TranscriptSidecarWriter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Write both sidecars into {@code directory} and record the JSON path on the file.
   *
   * @return the path of the JSON sidecar
   */
  public Path write(AudioFile file, Path directory, String rawJson, String text)
      throws IOException {
    Files.createDirectories(directory);

    Path jsonPath = directory.resolve(file.getBaseName() + "_transcription.json");
    JsonNode response = objectMapper.readTree(rawJson);
    byte[] pretty = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(response);
    Files.write(jsonPath, pretty);

    Path textPath = directory.resolve(file.getBaseName() + ".txt");
    Files.writeString(textPath, text == null ? "" : text, StandardCharsets.UTF_8);

    file.setTranscriptionJsonPath(jsonPath.toString());
    LOGGER.debug("Wrote transcript sidecars for {} to {}", file.getFileName(), directory);
    return jsonPath;
  }
}
