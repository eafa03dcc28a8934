package com.scholary.subtitles.pipeline;

import com.scholary.subtitles.logging.StructuredLogger;
import com.scholary.subtitles.project.ProjectStoreException;
import com.scholary.subtitles.project.Stage;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs stages in order against a project record, checkpointing after each one.
 *
 * <p>For each stage:
 *
 * <ol>
 *   <li>already completed: skipped, the action is not invoked
 *   <li>otherwise the action runs; if it throws, the run stops with a {@link
 *       StageExecutionException} and the flag stays unset
 *   <li>on success the flag is set and the whole record is saved before the next stage starts
 * </ol>
 *
 * <p>A failed save ({@link ProjectStoreException}) also stops the run and leaves the stage
 * incomplete in memory as well as on disk. Re-running after any failure resumes at the first
 * incomplete stage.
 */
@Component
public class StageRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(StageRunner.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  public void run(ProjectContext context, List<PipelineStage> stages) {
    run(context, stages, StageListener.NONE);
  }

  public void run(ProjectContext context, List<PipelineStage> stages, StageListener listener) {
    validateOrder(stages);

    String projectId = context.projectId();
    int total = stages.size();
    int index = 0;

    for (PipelineStage pipelineStage : stages) {
      index++;
      Stage stage = pipelineStage.stage();

      if (context.record().isCompleted(stage)) {
        STRUCTURED_LOGGER.logStageSkipped(projectId, stage.name());
        listener.onStageSkipped(stage, index, total);
        continue;
      }

      STRUCTURED_LOGGER.logStageStarted(projectId, stage.name(), index, total);
      listener.onStageStarted(stage, index, total);
      long startTime = System.currentTimeMillis();

      try {
        pipelineStage.action().execute(context);
      } catch (IOException | RuntimeException e) {
        STRUCTURED_LOGGER.logStageFailed(
            projectId, stage.name(), e.getClass().getSimpleName(), e.getMessage());
        throw new StageExecutionException(stage, e);
      }

      context.persistCompleted(stage);

      STRUCTURED_LOGGER.logStageCompleted(
          projectId, stage.name(), System.currentTimeMillis() - startTime);
      listener.onStageCompleted(stage, index, total);
    }

    LOGGER.info("All stages finished for project {}", projectId);
  }

  /** Stages must follow declaration order of {@link Stage}, without repeats. */
  static void validateOrder(List<PipelineStage> stages) {
    int previous = -1;
    for (PipelineStage pipelineStage : stages) {
      int ordinal = pipelineStage.stage().ordinal();
      if (ordinal <= previous) {
        throw new IllegalArgumentException(
            String.format(
                "Stage %s is out of order or repeated in %s",
                pipelineStage.stage(),
                stages.stream().map(PipelineStage::stage).toList()));
      }
      previous = ordinal;
    }
  }
}
