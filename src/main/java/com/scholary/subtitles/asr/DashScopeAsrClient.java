package com.scholary.subtitles.asr;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.subtitles.logging.StructuredLogger;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * HTTP client for DashScope asynchronous file transcription.
 *
 * <p>A task is submitted with {@code X-DashScope-Async: enable} and then polled until it reaches
 * a terminal status. Polls and downloads are retried a bounded number of times with a fixed delay
 * on I/O failures and 5xx statuses. A submission is only retried when the connection was refused.
 */
@Component
public class DashScopeAsrClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(DashScopeAsrClient.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  static final String SUBMIT_PATH = "/api/v1/services/audio/asr/transcription";
  static final String TASK_PATH = "/api/v1/tasks/";

  private final HttpClient httpClient;
  private final AsrProperties properties;
  private final ObjectMapper objectMapper;

  @Autowired
  public DashScopeAsrClient(AsrProperties properties, ObjectMapper objectMapper) {
    this(
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build(),
        properties,
        objectMapper);
  }

  DashScopeAsrClient(HttpClient httpClient, AsrProperties properties, ObjectMapper objectMapper) {
    this.httpClient = httpClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
    LOGGER.info(
        "Initialized DashScope client: baseUrl={}, model={}",
        properties.baseUrl(),
        properties.model());
  }

  /**
   * Submit a transcription task for one audio URL.
   *
   * @return the task id
   */
  public String submitTask(String fileUrl) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("model", properties.model());
    body.putObject("input").putArray("file_urls").add(fileUrl);
    ObjectNode parameters = body.putObject("parameters");
    properties.languageHints().forEach(parameters.putArray("language_hints")::add);

    HttpRequest request =
        authorized(URI.create(properties.baseUrl() + SUBMIT_PATH))
            .header("Content-Type", "application/json")
            .header("X-DashScope-Async", "enable")
            .POST(BodyPublishers.ofString(body.toString()))
            .build();

    JsonNode response = readJson(sendWithRetry("submit", request, false));
    String taskId = response.path("output").path("task_id").asText(null);
    if (taskId == null || taskId.isBlank()) {
      throw new AsrException("Submission response carries no task id: " + response);
    }
    LOGGER.info("Transcription task submitted: taskId={}", taskId);
    return taskId;
  }

  /**
   * Poll a task until it finishes.
   *
   * @return the transcription result URL of the first (only) file
   * @throws AsrException if the task or its subtask failed, or the wait limit is exceeded
   */
  public String awaitTranscriptionUrl(String taskId) {
    long deadline = System.nanoTime() + Duration.ofMinutes(properties.maxWaitMinutes()).toNanos();

    while (true) {
      HttpRequest request =
          authorized(URI.create(properties.baseUrl() + TASK_PATH + taskId)).GET().build();
      JsonNode output = readJson(sendWithRetry("poll", request, true)).path("output");
      String status = output.path("task_status").asText("UNKNOWN");
      LOGGER.debug("Task status: taskId={}, status={}", taskId, status);

      switch (status) {
        case "SUCCEEDED":
          return transcriptionUrl(taskId, output);
        case "FAILED":
        case "CANCELED":
        case "UNKNOWN":
          throw new AsrException(
              String.format(
                  "Transcription task %s ended with status %s: %s",
                  taskId, status, output.path("message").asText("")));
        default:
          break;
      }

      if (System.nanoTime() > deadline) {
        throw new AsrException(
            String.format(
                "Transcription task %s not finished after %d minutes",
                taskId, properties.maxWaitMinutes()));
      }
      sleep(Duration.ofSeconds(properties.pollIntervalSeconds()));
    }
  }

  /** Download the transcription JSON. */
  public String fetchTranscription(String transcriptionUrl) {
    HttpRequest request =
        HttpRequest.newBuilder(URI.create(transcriptionUrl))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .GET()
            .build();
    return sendWithRetry("fetch", request, true);
  }

  private static String transcriptionUrl(String taskId, JsonNode output) {
    JsonNode result = output.path("results").path(0);
    String subtaskStatus = result.path("subtask_status").asText("UNKNOWN");
    if (!"SUCCEEDED".equals(subtaskStatus)) {
      throw new AsrException(
          String.format(
              "Transcription failed with status %s: task=%s, detail=%s",
              subtaskStatus, taskId, result));
    }
    String url = result.path("transcription_url").asText(null);
    if (url == null || url.isBlank()) {
      throw new AsrException("Task " + taskId + " succeeded without a transcription URL");
    }
    return url;
  }

  private HttpRequest.Builder authorized(URI uri) {
    String apiKey = properties.apiKey();
    if (apiKey == null || apiKey.isBlank()) {
      throw new AsrException("asr.apiKey is not configured");
    }
    return HttpRequest.newBuilder(uri)
        .timeout(Duration.ofSeconds(properties.readTimeout()))
        .header("Authorization", "Bearer " + apiKey);
  }

  /**
   * Send a request, retrying transient failures.
   *
   * <p>A non-idempotent request is only resent when the connection could not be opened. Once it
   * may have reached the server, a timeout or 5xx fails at once.
   */
  private String sendWithRetry(String operation, HttpRequest request, boolean idempotent) {
    int attempt = 0;
    Exception lastException = null;

    while (attempt < properties.maxRetries()) {
      attempt++;
      try {
        HttpResponse<String> response =
            httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
          return response.body();
        }
        if (status < 500 || !idempotent) {
          throw new AsrException(
              String.format(
                  "DashScope %s returned status %d: %s", operation, status, response.body()));
        }
        lastException =
            new IOException(String.format("DashScope %s returned status %d", operation, status));
      } catch (ConnectException e) {
        lastException = e;
      } catch (IOException e) {
        if (!idempotent) {
          throw new AsrException(
              String.format("DashScope %s may have been delivered, not resending", operation), e);
        }
        lastException = e;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new AsrException("Interrupted during DashScope " + operation, e);
      }

      if (attempt < properties.maxRetries()) {
        STRUCTURED_LOGGER.logExternalRetry(
            "dashscope_" + operation,
            attempt,
            properties.maxRetries(),
            lastException.getClass().getSimpleName(),
            lastException.getMessage());
        sleep(Duration.ofMillis(properties.retryDelayMs()));
      }
    }

    throw new AsrException(
        String.format(
            "DashScope %s failed after %d attempts", operation, properties.maxRetries()),
        lastException);
  }

  private JsonNode readJson(String body) {
    try {
      return objectMapper.readTree(body);
    } catch (IOException e) {
      throw new AsrException("Unreadable DashScope response", e);
    }
  }

  private static void sleep(Duration duration) {
    try {
      Thread.sleep(duration.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AsrException("Interrupted while waiting for DashScope", e);
    }
  }
}
