package com.scholary.discussion.gladia;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * A pre-recorded transcription job as returned by {@code GET /v2/pre-recorded/{id}}.
 *
 * <p>Only the fields the pipeline reads are mapped; the full response is kept as raw JSON by the
 * caller.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GladiaJob(String id, String status, Result result, JsonNode error) {

  public static final String STATUS_DONE = "done";
  public static final String STATUS_ERROR = "error";

  public boolean isDone() {
    return STATUS_DONE.equalsIgnoreCase(status);
  }

  public boolean isError() {
    return STATUS_ERROR.equalsIgnoreCase(status);
  }

  /** Error text reported by the service, whether it sent a string or an object. */
  public String errorMessage() {
    if (error == null || error.isNull()) {
      return "unknown error";
    }
    if (error.isTextual()) {
      return error.asText();
    }
    JsonNode message = error.get("message");
    return message != null ? message.asText() : error.toString();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Result(Transcription transcription) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Transcription(
      @JsonProperty("full_transcript") String fullTranscript, List<Utterance> utterances) {

    public Transcription {
      utterances = utterances == null ? List.of() : List.copyOf(utterances);
    }
  }

  /** One diarized utterance; {@code speaker} is the service's 0-based speaker index. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Utterance(
      double start, double end, String text, Integer speaker, Double confidence) {}
}
