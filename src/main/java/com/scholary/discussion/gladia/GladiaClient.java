package com.scholary.discussion.gladia;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.discussion.classify.AudioFileNames;
import com.scholary.discussion.logging.PipelineEventLogger;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the Gladia v2 API.
 *
 * <p>Uploads are multipart with the file streamed from disk, so large recordings are never held in
 * memory. Transient failures (timeouts, refused or reset connections) on any call are retried with
 * exponential backoff; error responses from the service are not, since repeating the same request
 * would get the same answer.
 */
@Component
public class GladiaClient implements GladiaService {

  private static final Logger LOGGER = LoggerFactory.getLogger(GladiaClient.class);
  private static final PipelineEventLogger EVENTS = new PipelineEventLogger(LOGGER);

  static final String API_KEY_HEADER = "x-gladia-key";

  private static final Map<String, String> CONTENT_TYPES =
      Map.of(
          "wav", "audio/wav",
          "mp3", "audio/mpeg",
          "m4a", "audio/mp4",
          "aac", "audio/aac",
          "ogg", "audio/ogg",
          "flac", "audio/flac");

  private final HttpClient httpClient;
  private final GladiaProperties properties;
  private final ObjectMapper objectMapper;

  @Autowired
  public GladiaClient(GladiaProperties properties, ObjectMapper objectMapper) {
    this(
        properties,
        objectMapper,
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build());
  }

  GladiaClient(GladiaProperties properties, ObjectMapper objectMapper, HttpClient httpClient) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient = httpClient;
    LOGGER.info("Initialized Gladia client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public String upload(Path audioFile, String displayName) {
    LOGGER.info("Uploading {} as {}", audioFile.getFileName(), displayName);
    String audioUrl =
        withRetries(
            "Upload",
            audioFile.getFileName().toString(),
            () -> attemptUpload(audioFile, displayName));
    LOGGER.info("Upload succeeded: {}", audioUrl);
    return audioUrl;
  }

  @Override
  public String submit(String audioUrl, TranscriptionOptions options) {
    String body = buildSubmitBody(audioUrl, options);
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/v2/pre-recorded"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header(API_KEY_HEADER, properties.apiKey())
            .header("Content-Type", "application/json")
            .POST(BodyPublishers.ofString(body, StandardCharsets.UTF_8))
            .build();

    JsonNode response =
        readJson(
            withRetries("Submit", audioUrl, () -> send(request, "submit transcription")),
            "submit transcription");
    JsonNode id = response.get("id");
    if (id == null || id.asText().isBlank()) {
      throw new GladiaException("Submit response has no id: " + response);
    }
    LOGGER.info(
        "Submitted transcription job {}: speakers={}, diarization={}",
        id.asText(),
        options.speakerCount(),
        options.diarization());
    return id.asText();
  }

  @Override
  public TranscriptionPoll fetch(String transcriptId) {
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/v2/pre-recorded/" + transcriptId))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header(API_KEY_HEADER, properties.apiKey())
            .GET()
            .build();

    String body =
        withRetries(
            "Fetch", transcriptId, () -> send(request, "fetch transcription " + transcriptId));
    try {
      return new TranscriptionPoll(objectMapper.readValue(body, GladiaJob.class), body);
    } catch (JsonProcessingException e) {
      throw new GladiaException("Malformed transcription response for " + transcriptId, e);
    }
  }

  String buildSubmitBody(String audioUrl, TranscriptionOptions options) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("audio_url", audioUrl);
    body.put("diarization", options.diarization());
    body.put("language", properties.language());
    body.put("sentences", true);
    body.put("summarization", true);
    body.put("audio_enhancer", true);
    body.put("chapterization", true);
    body.put("name_consistency", true);
    body.put("sentiment_analysis", true);
    body.put("punctuation_enhanced", true);
    body.put("named_entity_recognition", true);
    body.put("speaker_reidentification", options.diarization());
    body.put("accurate_words_timestamps", true);
    if (options.diarization()) {
      body.put("diarization_enhanced", options.enhancedDiarization());
      ObjectNode config = body.putObject("diarization_config");
      config.put("enhanced", options.enhancedDiarization());
      config.put("number_of_speakers", options.speakerCount());
      config.put("min_speakers", options.minSpeakers());
      config.put("max_speakers", options.maxSpeakers());
    }
    return body.toString();
  }

  private String attemptUpload(Path audioFile, String displayName)
      throws IOException, InterruptedException {
    String boundary = UUID.randomUUID().toString();
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/v2/upload"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header(API_KEY_HEADER, properties.apiKey())
            .header("Content-Type", "multipart/form-data; boundary=" + boundary)
            .POST(buildMultipartBody(audioFile, displayName, boundary))
            .build();

    HttpResponse<String> response =
        httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));

    if (response.statusCode() < 200 || response.statusCode() >= 300) {
      throw new GladiaException(
          String.format(
              "Gladia upload returned status %d: %s", response.statusCode(), response.body()));
    }

    JsonNode audioUrl = readJson(response.body(), "upload").get("audio_url");
    if (audioUrl == null || audioUrl.asText().isBlank()) {
      throw new GladiaException("Upload response has no audio_url: " + response.body());
    }
    return audioUrl.asText();
  }

  /**
   * Multipart body with a single {@code audio} part.
   *
   * <p>The file part is a file publisher between two small byte-array publishers, so the content is
   * read from disk while it is sent.
   */
  private BodyPublisher buildMultipartBody(Path audioFile, String displayName, String boundary)
      throws IOException {
    String contentType =
        CONTENT_TYPES.getOrDefault(
            AudioFileNames.extension(audioFile.getFileName().toString()),
            "application/octet-stream");

    String prefix =
        "--"
            + boundary
            + "\r\n"
            + "Content-Disposition: form-data; name=\"audio\"; filename=\""
            + displayName
            + "\"\r\n"
            + "Content-Type: "
            + contentType
            + "\r\n\r\n";
    String suffix = "\r\n--" + boundary + "--\r\n";

    return BodyPublishers.concat(
        BodyPublishers.ofByteArray(prefix.getBytes(StandardCharsets.UTF_8)),
        BodyPublishers.ofFile(audioFile),
        BodyPublishers.ofByteArray(suffix.getBytes(StandardCharsets.UTF_8)));
  }

  /** A request that may fail with a transient I/O error. */
  @FunctionalInterface
  private interface GladiaCall<T> {
    T run() throws IOException, InterruptedException;
  }

  /**
   * Run {@code call}, retrying transient I/O failures with exponential backoff.
   *
   * <p>Error responses are thrown as {@link GladiaException} straight away. Running out of attempts
   * throws {@link GladiaUnavailableException}.
   */
  private <T> T withRetries(String operation, String target, GladiaCall<T> call) {
    int attempt = 0;
    IOException lastException = null;

    while (attempt < properties.maxRetries()) {
      attempt++;
      try {
        return call.run();
      } catch (IOException e) {
        lastException = e;
        if (attempt < properties.maxRetries()) {
          long backoffMs = properties.retryBaseDelayMs() * (1L << (attempt - 1));
          EVENTS.logRetry(
              operation.toLowerCase(),
              target,
              attempt,
              properties.maxRetries(),
              backoffMs,
              e.getClass().getSimpleName() + ": " + e.getMessage());
          sleep(backoffMs, operation);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new GladiaException(operation + " interrupted for " + target, e);
      }
    }

    throw new GladiaUnavailableException(
        String.format(
            "%s of %s failed after %d attempts: %s",
            operation,
            target,
            properties.maxRetries(),
            lastException == null ? "unknown" : lastException.getMessage()),
        lastException);
  }

  private String send(HttpRequest request, String operation)
      throws IOException, InterruptedException {
    HttpResponse<String> response =
        httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    if (response.statusCode() < 200 || response.statusCode() >= 300) {
      throw new GladiaException(
          String.format(
              "Gladia %s returned status %d: %s",
              operation, response.statusCode(), response.body()));
    }
    return response.body();
  }

  private JsonNode readJson(String body, String operation) {
    try {
      return objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new GladiaException("Malformed " + operation + " response: " + body, e);
    }
  }

  private void sleep(long millis, String operation) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new GladiaException(operation + " retry interrupted", e);
    }
  }
}
