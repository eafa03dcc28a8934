package com.scholary.subtitles.asr;

import com.scholary.subtitles.objectstore.ObjectStoreClient;
import com.scholary.subtitles.objectstore.ObjectStoreProperties;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Two-phase speech recognition for a project's audio.
 *
 * <p>{@link #submit} stages the audio in object storage (once) and starts a remote task. {@link
 * #fetchResult} waits for that task, stores the recognizer JSON and removes the staged audio.
 */
@Service
public class AsrService {

  private static final Logger LOGGER = LoggerFactory.getLogger(AsrService.class);
  private static final String AUDIO_CONTENT_TYPE = "audio/ogg";

  private final DashScopeAsrClient client;
  private final ObjectStoreClient objectStore;
  private final String bucket;
  private final AsrProperties properties;

  public AsrService(
      DashScopeAsrClient client,
      ObjectStoreClient objectStore,
      ObjectStoreProperties objectStoreProperties,
      AsrProperties properties) {
    this.client = client;
    this.objectStore = objectStore;
    this.bucket = objectStoreProperties.bucket();
    this.properties = properties;
  }

  /**
   * Upload the audio if it is not staged yet and submit a transcription task.
   *
   * @return the task id
   */
  public String submit(String projectId, Path audio) throws IOException {
    String key = objectKey(projectId);
    if (objectStore.exists(bucket, key)) {
      LOGGER.info("Audio already staged: bucket={}, key={}", bucket, key);
    } else {
      LOGGER.info("Staging audio for recognition: {} -> {}", audio, key);
      try (InputStream data = Files.newInputStream(audio)) {
        objectStore.putObject(bucket, key, data, Files.size(audio), AUDIO_CONTENT_TYPE);
      }
    }

    URL fileUrl =
        objectStore.presignGet(bucket, key, Duration.ofHours(properties.fileUrlTtlHours()));
    return client.submitTask(fileUrl.toString());
  }

  /** Wait for a submitted task, write its JSON result to {@code target} and unstage the audio. */
  public void fetchResult(String projectId, String taskId, Path target) throws IOException {
    LOGGER.info("Waiting for transcription: project={}, taskId={}", projectId, taskId);
    String transcriptionUrl = client.awaitTranscriptionUrl(taskId);
    String json = client.fetchTranscription(transcriptionUrl);

    Files.createDirectories(target.toAbsolutePath().getParent());
    Files.writeString(target, json, StandardCharsets.UTF_8);
    LOGGER.info("Transcription saved: {}", target);

    objectStore.deleteObject(bucket, objectKey(projectId));
  }

  String objectKey(String projectId) {
    return properties.objectKeyPrefix() + projectId + ".opus";
  }
}
