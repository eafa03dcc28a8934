package com.scholary.subtitles.asr;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.subtitles.objectstore.ObjectStoreClient;
import com.scholary.subtitles.objectstore.ObjectStoreProperties;
import java.io.IOException;
import java.net.URI;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AsrServiceTest {

  private static final String BUCKET = "audio";
  private static final String KEY = "asr/BV1xx411c7mD.opus";

  @TempDir Path tempDir;

  @Mock private DashScopeAsrClient client;
  @Mock private ObjectStoreClient objectStore;

  private AsrService service;

  @BeforeEach
  void setUp() {
    AsrProperties properties =
        new AsrProperties(
            "https://dashscope.example.com",
            "secret",
            "fun-asr",
            List.of("ja"),
            5,
            5,
            3,
            0,
            1,
            1,
            24,
            "asr/");
    ObjectStoreProperties storeProperties =
        new ObjectStoreProperties(
            "http://localhost:9000", "admin", "admin123", BUCKET, "us-east-1", true);
    service = new AsrService(client, objectStore, storeProperties, properties);
  }

  @Test
  void submit_shouldUploadMissingAudioAndSubmitPresignedUrl() throws IOException {
    Path audio = Files.writeString(tempDir.resolve("audio.opus"), "opus-bytes");
    URL url = URI.create("https://s3.example.com/audio/asr/BV1xx411c7mD.opus?sig=1").toURL();
    when(objectStore.exists(BUCKET, KEY)).thenReturn(false);
    when(objectStore.presignGet(BUCKET, KEY, Duration.ofHours(24))).thenReturn(url);
    when(client.submitTask(url.toString())).thenReturn("task-1");

    String taskId = service.submit("BV1xx411c7mD", audio);

    assertThat(taskId).isEqualTo("task-1");
    verify(objectStore).putObject(eq(BUCKET), eq(KEY), any(), eq(10L), eq("audio/ogg"));
  }

  @Test
  void submit_shouldReuseStagedAudio() throws IOException {
    URL url = URI.create("https://s3.example.com/audio/asr/BV1xx411c7mD.opus").toURL();
    when(objectStore.exists(BUCKET, KEY)).thenReturn(true);
    when(objectStore.presignGet(eq(BUCKET), eq(KEY), any())).thenReturn(url);
    when(client.submitTask(url.toString())).thenReturn("task-2");

    String taskId = service.submit("BV1xx411c7mD", tempDir.resolve("missing.opus"));

    assertThat(taskId).isEqualTo("task-2");
    verify(objectStore, never()).putObject(any(), any(), any(), anyLong(), any());
  }

  @Test
  void fetchResult_shouldWriteJsonAndUnstageAudio() throws IOException {
    when(client.awaitTranscriptionUrl("task-1")).thenReturn("https://r.example.com/1.json");
    when(client.fetchTranscription("https://r.example.com/1.json")).thenReturn("{\"a\": 1}");
    Path target = tempDir.resolve("project/asr.json");

    service.fetchResult("BV1xx411c7mD", "task-1", target);

    assertThat(target).hasContent("{\"a\": 1}");
    verify(objectStore).deleteObject(BUCKET, KEY);
  }

  @Test
  void objectKey_shouldUsePrefix() {
    assertThat(service.objectKey("ep123456")).isEqualTo("asr/ep123456.opus");
  }
}
