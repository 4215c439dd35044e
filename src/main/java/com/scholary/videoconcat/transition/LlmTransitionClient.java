package com.scholary.videoconcat.transition;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for an OpenAI-compatible chat completions API.
 *
 * <p>Sends one user message holding the transition prompt and returns the first choice's content.
 * Transient failures (I/O errors, non-200 responses) are retried with exponential backoff and
 * jitter. A 200 response without text is not retried.
 */
public class LlmTransitionClient implements TransitionClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(LlmTransitionClient.class);

  static final String COMPLETIONS_PATH = "/v1/chat/completions";

  private final HttpClient httpClient;
  private final TransitionProperties properties;
  private final ObjectMapper objectMapper;
  private final long backoffBaseMs;

  public LlmTransitionClient(TransitionProperties properties, ObjectMapper objectMapper) {
    this(properties, objectMapper, 1000);
  }

  LlmTransitionClient(
      TransitionProperties properties, ObjectMapper objectMapper, long backoffBaseMs) {
    if (properties.baseUrl() == null || properties.baseUrl().isBlank()) {
      throw new IllegalArgumentException("transition.base-url is required when enabled");
    }
    if (properties.model() == null || properties.model().isBlank()) {
      throw new IllegalArgumentException("transition.model is required when enabled");
    }
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.backoffBaseMs = backoffBaseMs;

    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized transition client: baseUrl={}, model={}",
        properties.baseUrl(),
        properties.model());
  }

  @Override
  public String generateTransition(String previousDescription, String currentDescription) {
    String prompt = TransitionPrompt.build(previousDescription, currentDescription);

    int attempt = 0;
    Exception lastException = null;

    while (attempt < properties.maxRetries()) {
      try {
        return attemptCompletion(prompt);
      } catch (IOException | InterruptedException e) {
        if (e instanceof InterruptedException) {
          Thread.currentThread().interrupt();
          throw new TransitionException("Transition request interrupted", e);
        }
        lastException = e;
        attempt++;
        if (attempt < properties.maxRetries()) {
          // Exponential backoff with jitter
          long backoffMs =
              (long) (Math.pow(2, attempt) * backoffBaseMs + Math.random() * backoffBaseMs);
          LOGGER.warn(
              "Transition attempt {} failed, retrying in {}ms: {}",
              attempt,
              backoffMs,
              e.getMessage());
          try {
            Thread.sleep(backoffMs);
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new TransitionException("Transition request interrupted", ie);
          }
        }
      }
    }

    throw new TransitionException(
        String.format("Transition generation failed after %d attempts", properties.maxRetries()),
        lastException);
  }

  private String attemptCompletion(String prompt) throws IOException, InterruptedException {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("model", properties.model());
    ObjectNode message = body.putArray("messages").addObject();
    message.put("role", "user");
    message.put("content", prompt);

    HttpRequest.Builder builder =
        HttpRequest.newBuilder()
            .uri(URI.create(trimTrailingSlash(properties.baseUrl()) + COMPLETIONS_PATH))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "application/json")
            .POST(BodyPublishers.ofByteArray(objectMapper.writeValueAsBytes(body)));
    if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
      builder.header("Authorization", "Bearer " + properties.apiKey());
    }
    HttpRequest request = builder.build();

    LOGGER.debug("Sending transition request to {}", request.uri());

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    if (response.statusCode() != 200) {
      throw new IOException(
          String.format(
              "Transition API returned status %d: %s", response.statusCode(), response.body()));
    }

    JsonNode content = objectMapper.readTree(response.body()).at("/choices/0/message/content");
    if (!content.isTextual() || content.asText().isBlank()) {
      throw new TransitionException("Transition API response has no message content");
    }
    return content.asText().trim();
  }

  private static String trimTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
