package com.scholary.discussion.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.discussion.logging.PipelineEventLogger;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Client for an OpenAI-compatible {@code /v1/chat/completions} endpoint.
 *
 * <p>Rate limiting (429) backs off exponentially from {@code rateLimitBaseDelayMs}; network errors
 * and timeouts back off linearly. Any other error status fails at once.
 */
@Component
public class LlmClient implements LlmService {

  private static final Logger LOGGER = LoggerFactory.getLogger(LlmClient.class);
  private static final PipelineEventLogger EVENTS = new PipelineEventLogger(LOGGER);

  private static final int TOO_MANY_REQUESTS = 429;

  private final HttpClient httpClient;
  private final LlmProperties properties;
  private final ObjectMapper objectMapper;

  @Autowired
  public LlmClient(LlmProperties properties, ObjectMapper objectMapper) {
    this(
        properties,
        objectMapper,
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build());
  }

  LlmClient(LlmProperties properties, ObjectMapper objectMapper, HttpClient httpClient) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient = httpClient;
    LOGGER.info(
        "Initialized LLM client: baseUrl={}, model={}", properties.baseUrl(), properties.model());
  }

  @Override
  public String complete(String systemPrompt, String userPrompt) {
    String body = buildRequestBody(systemPrompt, userPrompt);
    LOGGER.info(
        "Calling {} with ~{} prompt tokens",
        properties.model(),
        estimateTokens(systemPrompt + userPrompt));

    int attempt = 0;
    while (true) {
      attempt++;
      try {
        String content = attemptCall(body);
        LOGGER.info("LLM call succeeded on attempt {}: {} characters", attempt, content.length());
        return content;
      } catch (RateLimitedException e) {
        if (attempt >= properties.maxRetries()) {
          throw new RateLimitedException(
              "Rate limited after " + properties.maxRetries() + " attempts", e);
        }
        long backoffMs = properties.rateLimitBaseDelayMs() * (1L << (attempt - 1));
        EVENTS.logRetry(
            "llm", properties.model(), attempt, properties.maxRetries(), backoffMs, e.getMessage());
        sleep(backoffMs);
      } catch (IOException e) {
        if (attempt >= properties.maxRetries()) {
          throw new LlmException(
              "LLM call failed after " + properties.maxRetries() + " attempts: " + e.getMessage(),
              e);
        }
        long backoffMs = properties.rateLimitBaseDelayMs() * attempt;
        EVENTS.logRetry(
            "llm",
            properties.model(),
            attempt,
            properties.maxRetries(),
            backoffMs,
            e.getClass().getSimpleName() + ": " + e.getMessage());
        sleep(backoffMs);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new LlmException("LLM call interrupted", e);
      }
    }
  }

  String buildRequestBody(String systemPrompt, String userPrompt) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("model", properties.model());
    body.put("temperature", properties.temperature());
    body.put("max_tokens", properties.maxTokens());
    body.putObject("response_format").put("type", "json_object");

    ArrayNode messages = body.putArray("messages");
    messages.addObject().put("role", "system").put("content", systemPrompt);
    messages.addObject().put("role", "user").put("content", userPrompt);
    return body.toString();
  }

  private String attemptCall(String body) throws IOException, InterruptedException {
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/v1/chat/completions"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Authorization", "Bearer " + properties.apiKey())
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
            .build();

    HttpResponse<String> response =
        httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));

    if (response.statusCode() == TOO_MANY_REQUESTS) {
      throw new RateLimitedException("LLM API rate limit exceeded: " + response.body());
    }
    if (response.statusCode() < 200 || response.statusCode() >= 300) {
      throw new LlmException(
          String.format(
              "LLM API returned status %d: %s", response.statusCode(), response.body()));
    }
    return extractContent(response.body());
  }

  private String extractContent(String responseBody) {
    JsonNode root;
    try {
      root = objectMapper.readTree(responseBody);
    } catch (JsonProcessingException e) {
      throw new LlmException("Malformed LLM response", e);
    }
    JsonNode content = root.at("/choices/0/message/content");
    if (!content.isTextual() || content.asText().isBlank()) {
      throw new LlmException("LLM response has no content: " + responseBody);
    }
    return content.asText();
  }

  private static int estimateTokens(String text) {
    return text.length() / 4;
  }

  private void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LlmException("LLM retry interrupted", e);
    }
  }
}
