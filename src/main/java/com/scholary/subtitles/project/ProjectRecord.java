package com.scholary.subtitles.project;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * The persisted state of one project: identity, user inputs and one completion flag per {@link
 * Stage}.
 *
 * <p>Flags are monotonic: nothing in this class can clear a flag once set. The record is always
 * written as a whole.
 */
@JsonAutoDetect(
    fieldVisibility = Visibility.ANY,
    getterVisibility = Visibility.NONE,
    isGetterVisibility = Visibility.NONE)
@JsonPropertyOrder({
  "schema_version",
  "id",
  "platform",
  "source_url",
  "name",
  "translation_hint",
  "asr_task_id",
  "is_metadata_fetched",
  "is_downloaded",
  "is_video_processed",
  "is_audio_processed",
  "is_asr_task_submitted",
  "is_asr_completed",
  "is_srt_completed",
  "is_translated"
})
public class ProjectRecord {

  public static final int SCHEMA_VERSION = 1;
  public static final String DEFAULT_NAME = "video";

  private static final Pattern UNSAFE_CHARS =
      Pattern.compile("[^\\w\\s-]", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern SEPARATORS =
      Pattern.compile("[-\\s]+", Pattern.UNICODE_CHARACTER_CLASS);

  @JsonProperty("schema_version")
  private final int schemaVersion;

  @JsonProperty("id")
  private final String id;

  @JsonProperty("platform")
  private final VideoPlatform platform;

  @JsonProperty("source_url")
  private final String sourceUrl;

  @JsonProperty("name")
  private String name;

  @JsonProperty("translation_hint")
  private final String translationHint;

  @JsonProperty("asr_task_id")
  private String asrTaskId;

  @JsonProperty("is_metadata_fetched")
  private boolean metadataFetched;

  @JsonProperty("is_downloaded")
  private boolean downloaded;

  @JsonProperty("is_video_processed")
  private boolean videoProcessed;

  @JsonProperty("is_audio_processed")
  private boolean audioProcessed;

  @JsonProperty("is_asr_task_submitted")
  private boolean asrTaskSubmitted;

  @JsonProperty("is_asr_completed")
  private boolean asrCompleted;

  @JsonProperty("is_srt_completed")
  private boolean srtCompleted;

  @JsonProperty("is_translated")
  private boolean translated;

  @JsonCreator
  ProjectRecord(
      @JsonProperty(value = "schema_version", required = true) int schemaVersion,
      @JsonProperty(value = "id", required = true) String id,
      @JsonProperty(value = "platform", required = true) VideoPlatform platform,
      @JsonProperty(value = "source_url", required = true) String sourceUrl,
      @JsonProperty(value = "name", required = true) String name,
      @JsonProperty("translation_hint") String translationHint,
      @JsonProperty("asr_task_id") String asrTaskId,
      @JsonProperty(value = "is_metadata_fetched", required = true) boolean metadataFetched,
      @JsonProperty(value = "is_downloaded", required = true) boolean downloaded,
      @JsonProperty(value = "is_video_processed", required = true) boolean videoProcessed,
      @JsonProperty(value = "is_audio_processed", required = true) boolean audioProcessed,
      @JsonProperty(value = "is_asr_task_submitted", required = true) boolean asrTaskSubmitted,
      @JsonProperty(value = "is_asr_completed", required = true) boolean asrCompleted,
      @JsonProperty(value = "is_srt_completed", required = true) boolean srtCompleted,
      @JsonProperty(value = "is_translated", required = true) boolean translated) {
    this.schemaVersion = schemaVersion;
    this.id = id;
    this.platform = platform;
    this.sourceUrl = sourceUrl;
    this.name = name;
    this.translationHint = translationHint;
    this.asrTaskId = asrTaskId;
    this.metadataFetched = metadataFetched;
    this.downloaded = downloaded;
    this.videoProcessed = videoProcessed;
    this.audioProcessed = audioProcessed;
    this.asrTaskSubmitted = asrTaskSubmitted;
    this.asrCompleted = asrCompleted;
    this.srtCompleted = srtCompleted;
    this.translated = translated;
  }

  /** A fresh record for a source: no stage completed, default name. */
  public static ProjectRecord create(VideoSource source, String translationHint) {
    return new ProjectRecord(
        SCHEMA_VERSION,
        source.videoId(),
        source.platform(),
        source.sourceUrl(),
        DEFAULT_NAME,
        translationHint,
        null,
        false,
        false,
        false,
        false,
        false,
        false,
        false,
        false);
  }

  /** An independent copy with the same identity, name, task id and flags. */
  public ProjectRecord copy() {
    return new ProjectRecord(
        schemaVersion,
        id,
        platform,
        sourceUrl,
        name,
        translationHint,
        asrTaskId,
        metadataFetched,
        downloaded,
        videoProcessed,
        audioProcessed,
        asrTaskSubmitted,
        asrCompleted,
        srtCompleted,
        translated);
  }

  public int getSchemaVersion() {
    return schemaVersion;
  }

  public String getId() {
    return id;
  }

  public VideoPlatform getPlatform() {
    return platform;
  }

  public String getSourceUrl() {
    return sourceUrl;
  }

  public String getName() {
    return name;
  }

  public String getTranslationHint() {
    return translationHint;
  }

  public String getAsrTaskId() {
    return asrTaskId;
  }

  /**
   * Rename the project after the video title, keeping only word characters, whitespace and
   * hyphens, and collapsing runs of whitespace and hyphens into {@code _}. A title that sanitizes
   * to nothing leaves the name unchanged.
   */
  public void rename(String title) {
    if (title == null) {
      return;
    }
    String cleaned = UNSAFE_CHARS.matcher(title).replaceAll("").strip();
    cleaned = SEPARATORS.matcher(cleaned).replaceAll("_");
    if (!cleaned.isEmpty()) {
      this.name = cleaned;
    }
  }

  public void assignAsrTaskId(String taskId) {
    if (taskId == null || taskId.isBlank()) {
      throw new IllegalArgumentException("ASR task id must not be blank");
    }
    this.asrTaskId = taskId;
  }

  public boolean isCompleted(Stage stage) {
    return stage.isCompleted(this);
  }

  public void markCompleted(Stage stage) {
    stage.markCompleted(this);
  }

  /** Completion flags keyed by stage, in stage order. */
  public Map<Stage, Boolean> stageFlags() {
    Map<Stage, Boolean> flags = new LinkedHashMap<>();
    for (Stage stage : Stage.values()) {
      flags.put(stage, stage.isCompleted(this));
    }
    return flags;
  }

  public boolean isFullyCompleted() {
    for (Stage stage : Stage.values()) {
      if (!stage.isCompleted(this)) {
        return false;
      }
    }
    return true;
  }

  public boolean isMetadataFetched() {
    return metadataFetched;
  }

  public boolean isDownloaded() {
    return downloaded;
  }

  public boolean isVideoProcessed() {
    return videoProcessed;
  }

  public boolean isAudioProcessed() {
    return audioProcessed;
  }

  public boolean isAsrTaskSubmitted() {
    return asrTaskSubmitted;
  }

  public boolean isAsrCompleted() {
    return asrCompleted;
  }

  public boolean isSrtCompleted() {
    return srtCompleted;
  }

  public boolean isTranslated() {
    return translated;
  }

  void markMetadataFetched() {
    this.metadataFetched = true;
  }

  void markDownloaded() {
    this.downloaded = true;
  }

  void markVideoProcessed() {
    this.videoProcessed = true;
  }

  void markAudioProcessed() {
    this.audioProcessed = true;
  }

  void markAsrTaskSubmitted() {
    this.asrTaskSubmitted = true;
  }

  void markAsrCompleted() {
    this.asrCompleted = true;
  }

  void markSrtCompleted() {
    this.srtCompleted = true;
  }

  void markTranslated() {
    this.translated = true;
  }
}
