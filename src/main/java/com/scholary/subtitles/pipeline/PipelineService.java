package com.scholary.subtitles.pipeline;

import com.scholary.subtitles.asr.AsrService;
import com.scholary.subtitles.logging.StructuredLogger;
import com.scholary.subtitles.media.MediaProcessor;
import com.scholary.subtitles.media.VideoMetadata;
import com.scholary.subtitles.media.VideoSourceClient;
import com.scholary.subtitles.project.ProjectNotFoundException;
import com.scholary.subtitles.project.ProjectPaths;
import com.scholary.subtitles.project.ProjectRecord;
import com.scholary.subtitles.project.ProjectStore;
import com.scholary.subtitles.project.ProjectStoreException;
import com.scholary.subtitles.project.SourceParser;
import com.scholary.subtitles.project.Stage;
import com.scholary.subtitles.project.VideoSource;
import com.scholary.subtitles.subtitle.SubtitleService;
import com.scholary.subtitles.subtitle.SubtitleWriter;
import com.scholary.subtitles.translation.TranslationResult;
import com.scholary.subtitles.translation.TranslationService;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Opens projects and drives them through the full stage list.
 *
 * <p>At most one run per project id may be active in this process; a second concurrent request
 * for the same id is rejected with {@link ProjectBusyException}. Runs of different projects are
 * independent. Opening a project is serialized, so two requests for a new source create its
 * record once.
 */
@Service
public class PipelineService {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineService.class);

  private final ProjectStore store;
  private final SourceParser sourceParser;
  private final StageRunner runner;
  private final VideoSourceClient videoSource;
  private final MediaProcessor mediaProcessor;
  private final AsrService asrService;
  private final SubtitleService subtitleService;
  private final SubtitleWriter subtitleWriter;
  private final TranslationService translationService;
  private final PipelineProperties properties;

  private final Set<String> activeProjects = ConcurrentHashMap.newKeySet();
  private final Object createLock = new Object();

  public PipelineService(
      ProjectStore store,
      SourceParser sourceParser,
      StageRunner runner,
      VideoSourceClient videoSource,
      MediaProcessor mediaProcessor,
      AsrService asrService,
      SubtitleService subtitleService,
      SubtitleWriter subtitleWriter,
      TranslationService translationService,
      PipelineProperties properties) {
    this.store = store;
    this.sourceParser = sourceParser;
    this.runner = runner;
    this.videoSource = videoSource;
    this.mediaProcessor = mediaProcessor;
    this.asrService = asrService;
    this.subtitleService = subtitleService;
    this.subtitleWriter = subtitleWriter;
    this.translationService = translationService;
    this.properties = properties;
  }

  /**
   * Resolve a source to its project, creating and saving a new record when none exists.
   *
   * <p>A translation hint only applies to new projects; it is ignored for existing ones.
   */
  public ProjectRecord open(String source, String translationHint) {
    VideoSource videoSourceId = sourceParser.parse(source);

    // a fresh record must never overwrite one saved in between
    synchronized (createLock) {
      Optional<ProjectRecord> existing = store.load(videoSourceId.videoId());

      if (existing.isPresent()) {
        if (translationHint != null) {
          LOGGER.warn(
              "Translation hint ignored for existing project {}", videoSourceId.videoId());
        }
        return existing.get();
      }

      ProjectRecord record = ProjectRecord.create(videoSourceId, translationHint);
      store.save(record);
      LOGGER.info("Created project {} from {}", record.getId(), record.getSourceUrl());
      return record;
    }
  }

  public Optional<ProjectRecord> find(String projectId) {
    return store.load(projectId);
  }

  /**
   * Run every incomplete stage of a project, then archive it if archiving is configured.
   *
   * @throws ProjectNotFoundException if the project has no record
   * @throws ProjectBusyException if a run for the project is already in progress
   * @throws StageExecutionException if a stage fails
   */
  public ProjectRecord process(String projectId, StageListener listener) {
    if (!activeProjects.add(projectId)) {
      throw new ProjectBusyException(projectId);
    }
    try {
      ProjectRecord record =
          store.load(projectId).orElseThrow(() -> new ProjectNotFoundException(projectId));
      ProjectContext context = new ProjectContext(record, store.pathsFor(projectId), store);

      runner.run(context, stages(), listener);
      LOGGER.info("Project processing complete: {}", projectId);

      if (properties.archiveDir() != null) {
        archive(context);
      } else {
        LOGGER.debug("Archive directory not set, project {} stays in place", projectId);
      }
      return record;
    } finally {
      activeProjects.remove(projectId);
    }
  }

  public boolean isActive(String projectId) {
    return activeProjects.contains(projectId);
  }

  List<PipelineStage> stages() {
    return List.of(
        PipelineStage.of(Stage.METADATA_FETCHED, this::fetchMetadata),
        PipelineStage.of(
            Stage.DOWNLOADED,
            ctx -> videoSource.download(ctx.record().getSourceUrl(), ctx.paths().directory())),
        PipelineStage.of(
            Stage.VIDEO_PROCESSED,
            ctx ->
                mediaProcessor.combineVideos(ctx.paths().downloadedParts(), ctx.paths().video())),
        PipelineStage.of(
            Stage.AUDIO_PROCESSED,
            ctx -> mediaProcessor.extractAudio(ctx.paths().video(), ctx.paths().audio())),
        PipelineStage.submission(
            Stage.ASR_TASK_SUBMITTED,
            ctx -> asrService.submit(ctx.projectId(), ctx.paths().audio())),
        PipelineStage.of(Stage.ASR_COMPLETED, this::fetchRecognition),
        PipelineStage.of(
            Stage.SRT_COMPLETED,
            ctx -> subtitleService.generateSrt(ctx.paths().asrJson(), ctx.paths().sourceSrt())),
        PipelineStage.of(Stage.TRANSLATED, this::translate));
  }

  private void fetchMetadata(ProjectContext context) throws IOException {
    VideoMetadata metadata = videoSource.fetchMetadata(context.record().getSourceUrl());
    context.record().rename(metadata.title());
  }

  private void fetchRecognition(ProjectContext context) throws IOException {
    String taskId = context.record().getAsrTaskId();
    if (taskId == null) {
      throw new IllegalStateException(
          "No recognition task id recorded for project " + context.projectId());
    }
    asrService.fetchResult(context.projectId(), taskId, context.paths().asrJson());
  }

  private void translate(ProjectContext context) throws IOException {
    ProjectPaths paths = context.paths();
    TranslationResult result =
        translationService.translate(
            context.projectId(),
            context.record().getTranslationHint(),
            paths.audio(),
            paths.sourceSrt(),
            paths.translatedSrt());
    subtitleWriter.convertToVtt(paths.translatedSrt(), paths.translatedVtt());
    LOGGER.info(
        "Translated project {}: continuations={}, cost=${}",
        context.projectId(),
        result.continuations(),
        String.format("%.4f", result.totalCostUsd()));
  }

  private void archive(ProjectContext context) {
    try {
      Path target =
          new ProjectArchiver(properties.archiveDir()).archive(context.record(), context.paths());
      LOGGER.info("Project {} archived to {}", context.projectId(), target);
    } catch (IOException e) {
      throw new ProjectStoreException("Failed to archive project " + context.projectId(), e);
    }
  }

  /** Run a project with the project id in the logging context. */
  public ProjectRecord processWithContext(String projectId, String runId, StageListener listener) {
    StructuredLogger.setProjectContext(projectId, runId);
    try {
      return process(projectId, listener);
    } finally {
      StructuredLogger.clearProjectContext();
    }
  }
}
