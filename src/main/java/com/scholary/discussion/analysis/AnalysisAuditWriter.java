package com.scholary.discussion.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Keeps a record of every analysis call: the prompt, the raw response and how it was parsed.
 *
 * <p>Written as {@code openai_analysis_{yyyyMMdd_HHmmss}.json} into the session folder.
 */
@Component
public class AnalysisAuditWriter {

  private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisAuditWriter.class);

  private static final DateTimeFormatter FILE_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  private final ObjectMapper objectMapper;
  private final Clock clock;

  public AnalysisAuditWriter(ObjectMapper objectMapper, Clock clock) {
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /**
   * Write the audit record.
   *
   * @param rawResponse the model's reply, null when the call itself failed
   * @return the written file
   */
  public Path write(
      Path sessionFolder,
      String sessionId,
      AnalysisPrompt prompt,
      String rawResponse,
      String outcome,
      String detail)
      throws IOException {
    LocalDateTime now = LocalDateTime.now(clock);

    ObjectNode record = objectMapper.createObjectNode();
    record.put("sessionId", sessionId);
    record.put("timestamp", clock.instant().toString());
    record.put("outcome", outcome);
    if (detail != null) {
      record.put("detail", detail);
    }
    record.put("systemPrompt", prompt.system());
    record.put("prompt", prompt.user());
    record.put("promptLength", prompt.user().length());
    if (rawResponse != null) {
      record.put("rawResponse", rawResponse);
      record.put("responseLength", rawResponse.length());
    } else {
      record.putNull("rawResponse");
    }

    Files.createDirectories(sessionFolder);
    Path file = sessionFolder.resolve("openai_analysis_" + now.format(FILE_TIMESTAMP) + ".json");
    Files.write(file, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(record));
    LOGGER.info("Wrote analysis audit record {}", file);
    return file;
  }
}
