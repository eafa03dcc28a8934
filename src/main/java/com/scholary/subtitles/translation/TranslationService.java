package com.scholary.subtitles.translation;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

/**
 * Translates a source-language SRT with the audio as context.
 *
 * <p>The audio is stored once in the Gemini Files API under a name derived from the project, the
 * model and the API key, so re-runs reuse it. Long replies stop on the token limit; the service
 * then asks the model to continue, up to a configured number of times, and joins the parts with
 * {@link #BREAK_MARKER}.
 */
@Service
public class TranslationService {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranslationService.class);

  static final String BREAK_MARKER = "\n<BREAK>\n";
  static final String CONTINUE_PROMPT = "繼續";
  static final String AUDIO_MIME_TYPE = "audio/ogg";

  private final GeminiTranslationClient client;
  private final TranslationCostCalculator costCalculator;
  private final TranslationProperties properties;
  private final String systemInstruction;

  public TranslationService(
      GeminiTranslationClient client,
      TranslationCostCalculator costCalculator,
      TranslationProperties properties) {
    this.client = client;
    this.costCalculator = costCalculator;
    this.properties = properties;
    this.systemInstruction = loadInstruction(properties.instructionResource());
  }

  public TranslationResult translate(
      String projectId, String hint, Path audio, Path sourceSrt, Path target) throws IOException {
    LOGGER.info("Starting translation: project={}, srt={}", projectId, sourceSrt);
    long startTime = System.currentTimeMillis();

    GeminiFile audioFile = ensureFile(projectId, audio);
    String srt = Files.readString(sourceSrt, StandardCharsets.UTF_8);

    List<ChatTurn> history = new ArrayList<>();
    history.add(ChatTurn.user(audioFile, userMessage(hint, srt)));

    GeminiReply reply = client.generate(systemInstruction, history);
    StringBuilder content = new StringBuilder(reply.text());
    double totalCost = costCalculator.cost(properties.model(), reply.usage());
    int continuations = 0;

    while (!reply.isComplete()) {
      if (!reply.isTruncated()) {
        throw new TranslationException("Unexpected finish reason: " + reply.finishReason());
      }
      continuations++;
      if (continuations > properties.maxContinuations()) {
        throw new TranslationException(
            String.format("Exceeded maximum continuations (%d)", properties.maxContinuations()));
      }
      LOGGER.info(
          "Reply cut off, continuing ({}/{})", continuations, properties.maxContinuations());

      history.add(ChatTurn.model(reply.text()));
      history.add(ChatTurn.user(CONTINUE_PROMPT));
      reply = client.generate(systemInstruction, history);
      totalCost += costCalculator.cost(properties.model(), reply.usage());
      content.append(BREAK_MARKER).append(reply.text());
    }

    Files.createDirectories(target.toAbsolutePath().getParent());
    Files.writeString(target, content.toString(), StandardCharsets.UTF_8);

    LOGGER.info(
        "Translation saved: file={}, continuations={}, cost=${}, elapsed={}s",
        target,
        continuations,
        String.format("%.6f", totalCost),
        (System.currentTimeMillis() - startTime) / 1000);
    return new TranslationResult(continuations, totalCost);
  }

  GeminiFile ensureFile(String projectId, Path audio) throws IOException {
    String name = "files/" + storageName(projectId);
    GeminiFile file = client.getFile(name).orElse(null);
    if (file != null) {
      LOGGER.info("Audio already in Gemini storage: {}", name);
    } else {
      file = client.upload(name, audio, AUDIO_MIME_TYPE);
    }
    return client.awaitActive(file);
  }

  String storageName(String projectId) {
    String apiKey = properties.apiKey() == null ? "" : properties.apiKey();
    return DigestUtils.md5DigestAsHex(
        (projectId + properties.model() + apiKey).getBytes(StandardCharsets.UTF_8));
  }

  static String userMessage(String hint, String srt) {
    StringBuilder message = new StringBuilder("請根據所附資料，將以下 SRT 文本翻譯為繁體中文。");
    if (hint != null && !hint.isBlank()) {
      message.append("\n節目介紹: ").append(hint);
    }
    message.append("\nSRT 文本:\n---\n").append(srt);
    return message.toString();
  }

  private static String loadInstruction(String location) {
    try (InputStream in = new ClassPathResource(location).getInputStream()) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot load translation instruction: " + location, e);
    }
  }
}
