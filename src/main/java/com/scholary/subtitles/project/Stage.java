package com.scholary.subtitles.project;

import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * The fixed, ordered set of pipeline stages.
 *
 * <p>Each stage names the boolean property it is persisted under in {@code project.json}, and how
 * to read and set that flag on a {@link ProjectRecord}. Declaration order is execution order.
 * Changing this enum means changing the persisted format: {@link StageSchemaVerifier} refuses to
 * start when the two disagree.
 */
public enum Stage {
  METADATA_FETCHED(
      "is_metadata_fetched", ProjectRecord::isMetadataFetched, ProjectRecord::markMetadataFetched),
  DOWNLOADED("is_downloaded", ProjectRecord::isDownloaded, ProjectRecord::markDownloaded),
  VIDEO_PROCESSED(
      "is_video_processed", ProjectRecord::isVideoProcessed, ProjectRecord::markVideoProcessed),
  AUDIO_PROCESSED(
      "is_audio_processed", ProjectRecord::isAudioProcessed, ProjectRecord::markAudioProcessed),
  ASR_TASK_SUBMITTED(
      "is_asr_task_submitted",
      ProjectRecord::isAsrTaskSubmitted,
      ProjectRecord::markAsrTaskSubmitted),
  ASR_COMPLETED(
      "is_asr_completed", ProjectRecord::isAsrCompleted, ProjectRecord::markAsrCompleted),
  SRT_COMPLETED(
      "is_srt_completed", ProjectRecord::isSrtCompleted, ProjectRecord::markSrtCompleted),
  TRANSLATED("is_translated", ProjectRecord::isTranslated, ProjectRecord::markTranslated);

  private final String flagName;
  private final Predicate<ProjectRecord> accessor;
  private final Consumer<ProjectRecord> marker;

  Stage(String flagName, Predicate<ProjectRecord> accessor, Consumer<ProjectRecord> marker) {
    this.flagName = flagName;
    this.accessor = accessor;
    this.marker = marker;
  }

  /** The JSON property this stage's completion flag is persisted under. */
  public String flagName() {
    return flagName;
  }

  boolean isCompleted(ProjectRecord record) {
    return accessor.test(record);
  }

  void markCompleted(ProjectRecord record) {
    marker.accept(record);
  }
}
