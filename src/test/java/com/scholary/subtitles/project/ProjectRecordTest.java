package com.scholary.subtitles.project;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ProjectRecordTest {

  private ProjectRecord record;

  @BeforeEach
  void setUp() {
    VideoSource source = new VideoSource(VideoPlatform.BILIBILI, "BV1xx411c7mD");
    record = ProjectRecord.create(source, "variety show");
  }

  @Test
  void create_shouldStartWithNoStageCompleted() {
    assertThat(record.getSchemaVersion()).isEqualTo(ProjectRecord.SCHEMA_VERSION);
    assertThat(record.getId()).isEqualTo("BV1xx411c7mD");
    assertThat(record.getSourceUrl()).isEqualTo("https://www.bilibili.com/video/BV1xx411c7mD");
    assertThat(record.getName()).isEqualTo(ProjectRecord.DEFAULT_NAME);
    assertThat(record.getTranslationHint()).isEqualTo("variety show");
    assertThat(record.getAsrTaskId()).isNull();
    assertThat(record.stageFlags()).doesNotContainValue(true);
    assertThat(record.isFullyCompleted()).isFalse();
  }

  @Test
  void copy_shouldBeIndependentOfOriginal() {
    record.rename("Show");
    record.assignAsrTaskId("task-1");
    record.markCompleted(Stage.METADATA_FETCHED);

    ProjectRecord copy = record.copy();
    copy.markCompleted(Stage.DOWNLOADED);

    assertThat(copy.getName()).isEqualTo("Show");
    assertThat(copy.getAsrTaskId()).isEqualTo("task-1");
    assertThat(copy.getTranslationHint()).isEqualTo("variety show");
    assertThat(copy.isCompleted(Stage.METADATA_FETCHED)).isTrue();
    assertThat(record.isCompleted(Stage.DOWNLOADED)).isFalse();
  }

  @Test
  void rename_shouldSanitizeTitle() {
    record.rename("Hello, World! - Part 1");

    assertThat(record.getName()).isEqualTo("Hello_World_Part_1");
  }

  @Test
  void rename_shouldKeepNonLatinLetters() {
    record.rename("【公式】水曜日のダウンタウン 第1話");

    assertThat(record.getName()).isEqualTo("公式水曜日のダウンタウン_第1話");
  }

  @Test
  void rename_shouldKeepUnderscores() {
    record.rename("  snake_case  title ");

    assertThat(record.getName()).isEqualTo("snake_case_title");
  }

  @Test
  void rename_shouldLeaveNameWhenTitleSanitizesToNothing() {
    record.rename("!!!");

    assertThat(record.getName()).isEqualTo(ProjectRecord.DEFAULT_NAME);
  }

  @Test
  void rename_shouldIgnoreNullTitle() {
    record.rename(null);

    assertThat(record.getName()).isEqualTo(ProjectRecord.DEFAULT_NAME);
  }

  @Test
  void assignAsrTaskId_shouldRejectBlankId() {
    assertThatThrownBy(() -> record.assignAsrTaskId(" "))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void markCompleted_shouldSetOnlyThatStage() {
    record.markCompleted(Stage.AUDIO_PROCESSED);

    assertThat(record.isAudioProcessed()).isTrue();
    assertThat(record.stageFlags())
        .containsEntry(Stage.AUDIO_PROCESSED, true)
        .containsEntry(Stage.VIDEO_PROCESSED, false)
        .containsEntry(Stage.ASR_TASK_SUBMITTED, false);
  }

  @Test
  void markCompleted_shouldBeIdempotent() {
    record.markCompleted(Stage.DOWNLOADED);
    record.markCompleted(Stage.DOWNLOADED);

    assertThat(record.isCompleted(Stage.DOWNLOADED)).isTrue();
  }

  @Test
  void isFullyCompleted_shouldRequireEveryStage() {
    for (Stage stage : Stage.values()) {
      assertThat(record.isFullyCompleted()).isFalse();
      record.markCompleted(stage);
    }

    assertThat(record.isFullyCompleted()).isTrue();
  }
}
