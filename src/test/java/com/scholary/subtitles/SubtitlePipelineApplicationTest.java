package com.scholary.subtitles;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.subtitles.pipeline.PipelineService;
import com.scholary.subtitles.project.FileProjectStore;
import com.scholary.subtitles.project.ProjectStore;
import com.scholary.subtitles.segmentation.DisplayCue;
import com.scholary.subtitles.subtitle.SubtitleService;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

/** Boots the full context with the default configuration and runs the offline SRT path. */
@SpringBootTest
class SubtitlePipelineApplicationTest {

  private static final String ASR_RESULT =
      """
      {
        "file_url": "https://example.com/audio.opus",
        "properties": {"audio_format": "opus", "channels": [0]},
        "transcripts": [
          {
            "channel_id": 0,
            "sentences": [
              {
                "begin_time": 100, "end_time": 1200, "text": "こんにちは。", "sentence_id": 1,
                "words": [
                  {"begin_time": 100, "end_time": 1200, "text": "こんにちは", "punctuation": "。"}
                ]
              },
              {
                "begin_time": 1300, "end_time": 1500, "text": "N.", "sentence_id": 2,
                "words": [{"begin_time": 1300, "end_time": 1500, "text": "N", "punctuation": "."}]
              },
              {
                "begin_time": 1600, "end_time": 1800, "text": "G.", "sentence_id": 3,
                "words": [{"begin_time": 1600, "end_time": 1800, "text": "G", "punctuation": "."}]
              }
            ]
          }
        ]
      }
      """;

  @Autowired private PipelineService pipelineService;
  @Autowired private ProjectStore projectStore;
  @Autowired private SubtitleService subtitleService;

  @TempDir Path tempDir;

  @Test
  void contextLoads_shouldWireFileProjectStore() {
    assertThat(pipelineService).isNotNull();
    assertThat(projectStore).isInstanceOf(FileProjectStore.class);
  }

  @Test
  void generateSrt_shouldMergeAbbreviationsWithDefaultSettings() throws Exception {
    Path asrJson = tempDir.resolve("asr.json");
    Path srt = tempDir.resolve("out.srt");
    Files.writeString(asrJson, ASR_RESULT, StandardCharsets.UTF_8);

    List<DisplayCue> cues = subtitleService.generateSrt(asrJson, srt);

    assertThat(cues).extracting(DisplayCue::text).containsExactly("こんにちは。", "N.G.");
    String content = Files.readString(srt, StandardCharsets.UTF_8);
    assertThat(content).startsWith("1\n").contains("\n2\n").contains("N.G.\n\n");
  }
}
