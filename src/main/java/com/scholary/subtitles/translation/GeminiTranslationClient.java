package com.scholary.subtitles.translation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the Gemini REST API: the Files API for the audio and {@code generateContent}
 * for the conversation.
 *
 * <p>Every request carries all four harm categories at {@code BLOCK_NONE} and asks for high
 * thinking effort.
 */
@Component
public class GeminiTranslationClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeminiTranslationClient.class);

  private static final List<String> HARM_CATEGORIES =
      List.of(
          "HARM_CATEGORY_HARASSMENT",
          "HARM_CATEGORY_HATE_SPEECH",
          "HARM_CATEGORY_SEXUALLY_EXPLICIT",
          "HARM_CATEGORY_DANGEROUS_CONTENT");

  private final HttpClient httpClient;
  private final TranslationProperties properties;
  private final ObjectMapper objectMapper;

  public GeminiTranslationClient(TranslationProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();
    LOGGER.info(
        "Initialized Gemini client: baseUrl={}, model={}",
        properties.baseUrl(),
        properties.model());
  }

  /** Look up a stored file by resource name ({@code files/<id>}). */
  public Optional<GeminiFile> getFile(String name) {
    HttpRequest request = request(properties.baseUrl() + "/v1beta/" + name).GET().build();
    HttpResponse<String> response = send(request);
    if (response.statusCode() == 404 || response.statusCode() == 403) {
      LOGGER.debug("File not found in Gemini storage: {}", name);
      return Optional.empty();
    }
    return Optional.of(read(checked(response, "get file"), GeminiFile.class));
  }

  /** Upload a file under a fixed resource name with the resumable upload protocol. */
  public GeminiFile upload(String name, Path file, String mimeType) throws IOException {
    long size = Files.size(file);
    LOGGER.info("Uploading file to Gemini: {} as {} ({} bytes)", file, name, size);

    ObjectNode metadata = objectMapper.createObjectNode();
    metadata.putObject("file").put("name", name).put("displayName", file.getFileName().toString());

    HttpRequest start =
        request(properties.baseUrl() + "/upload/v1beta/files")
            .header("X-Goog-Upload-Protocol", "resumable")
            .header("X-Goog-Upload-Command", "start")
            .header("X-Goog-Upload-Header-Content-Length", String.valueOf(size))
            .header("X-Goog-Upload-Header-Content-Type", mimeType)
            .header("Content-Type", "application/json")
            .POST(BodyPublishers.ofString(metadata.toString()))
            .build();
    HttpResponse<String> started = send(start);
    checked(started, "start upload");
    String uploadUrl =
        started
            .headers()
            .firstValue("X-Goog-Upload-URL")
            .orElseThrow(() -> new TranslationException("Upload start returned no upload URL"));

    HttpRequest upload =
        HttpRequest.newBuilder(URI.create(uploadUrl))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("X-Goog-Upload-Offset", "0")
            .header("X-Goog-Upload-Command", "upload, finalize")
            .POST(BodyPublishers.ofFile(file))
            .build();
    JsonNode body = readTree(checked(send(upload), "upload"));
    return objectMapper.convertValue(body.path("file"), GeminiFile.class);
  }

  /** Poll a file until the service has finished processing it. */
  public GeminiFile awaitActive(GeminiFile file) {
    long deadline =
        System.nanoTime() + Duration.ofMinutes(properties.fileMaxWaitMinutes()).toNanos();
    GeminiFile current = file;
    while (!current.isActive()) {
      if (current.isFailed()) {
        throw new TranslationException("Gemini failed to process file " + current.name());
      }
      if (System.nanoTime() > deadline) {
        throw new TranslationException(
            String.format(
                "File %s still %s after %d minutes",
                current.name(), current.state(), properties.fileMaxWaitMinutes()));
      }
      sleep(Duration.ofSeconds(properties.filePollIntervalSeconds()));
      String name = file.name();
      current =
          getFile(name)
              .orElseThrow(() -> new TranslationException("Uploaded file vanished: " + name));
    }
    return current;
  }

  /** Send the conversation so far and return the model's next turn. */
  public GeminiReply generate(String systemInstruction, List<ChatTurn> history) {
    ObjectNode body = objectMapper.createObjectNode();
    body.putObject("systemInstruction")
        .putArray("parts")
        .addObject()
        .put("text", systemInstruction);

    ArrayNode contents = body.putArray("contents");
    for (ChatTurn turn : history) {
      ObjectNode content = contents.addObject();
      content.put("role", turn.role());
      ArrayNode parts = content.putArray("parts");
      if (turn.attachment() != null) {
        parts
            .addObject()
            .putObject("fileData")
            .put("mimeType", turn.attachment().mimeType())
            .put("fileUri", turn.attachment().uri());
      }
      parts.addObject().put("text", turn.text());
    }

    ArrayNode safety = body.putArray("safetySettings");
    for (String category : HARM_CATEGORIES) {
      safety.addObject().put("category", category).put("threshold", "BLOCK_NONE");
    }
    body.putObject("generationConfig").putObject("thinkingConfig").put("thinkingLevel", "HIGH");

    HttpRequest request =
        request(
                properties.baseUrl()
                    + "/v1beta/models/"
                    + properties.model()
                    + ":generateContent")
            .header("Content-Type", "application/json")
            .POST(BodyPublishers.ofString(body.toString()))
            .build();

    return parseReply(readTree(checked(send(request), "generateContent")));
  }

  GeminiReply parseReply(JsonNode response) {
    JsonNode candidate = response.path("candidates").path(0);
    if (candidate.isMissingNode()) {
      throw new TranslationException("No candidates in Gemini response: " + response);
    }

    StringBuilder text = new StringBuilder();
    for (JsonNode part : candidate.path("content").path("parts")) {
      if (!part.path("thought").asBoolean(false) && part.has("text")) {
        text.append(part.get("text").asText());
      }
    }

    UsageMetadata usage =
        response.has("usageMetadata")
            ? objectMapper.convertValue(response.get("usageMetadata"), UsageMetadata.class)
            : null;
    return new GeminiReply(text.toString(), candidate.path("finishReason").asText(""), usage);
  }

  private HttpRequest.Builder request(String url) {
    String apiKey = properties.apiKey();
    if (apiKey == null || apiKey.isBlank()) {
      throw new TranslationException("translation.apiKey is not configured");
    }
    return HttpRequest.newBuilder(URI.create(url))
        .timeout(Duration.ofSeconds(properties.readTimeout()))
        .header("x-goog-api-key", apiKey);
  }

  private HttpResponse<String> send(HttpRequest request) {
    try {
      return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new TranslationException("Gemini request failed: " + request.uri().getPath(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TranslationException("Interrupted during Gemini request", e);
    }
  }

  private static String checked(HttpResponse<String> response, String operation) {
    if (response.statusCode() / 100 != 2) {
      throw new TranslationException(
          String.format(
              "Gemini %s returned status %d: %s",
              operation, response.statusCode(), response.body()));
    }
    return response.body();
  }

  private JsonNode readTree(String body) {
    try {
      return objectMapper.readTree(body);
    } catch (IOException e) {
      throw new TranslationException("Unreadable Gemini response", e);
    }
  }

  private <T> T read(String body, Class<T> type) {
    try {
      return objectMapper.readValue(body, type);
    } catch (IOException e) {
      throw new TranslationException("Unreadable Gemini response", e);
    }
  }

  private static void sleep(Duration duration) {
    try {
      Thread.sleep(duration.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TranslationException("Interrupted while waiting for Gemini", e);
    }
  }
}
