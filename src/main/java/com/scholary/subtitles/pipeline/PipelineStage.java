package com.scholary.subtitles.pipeline;

import com.scholary.subtitles.project.ProjectRecord;
import com.scholary.subtitles.project.Stage;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** A {@link Stage} paired with the action that completes it. */
public record PipelineStage(Stage stage, StageAction action) {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineStage.class);

  public PipelineStage {
    Objects.requireNonNull(stage, "stage");
    Objects.requireNonNull(action, "action");
  }

  public static PipelineStage of(Stage stage, StageAction action) {
    return new PipelineStage(stage, action);
  }

  /**
   * A stage that submits a remote task at most once.
   *
   * <p>If the record already carries a task id (an earlier run submitted but crashed before the
   * stage flag was saved) the submitter is not called again. Otherwise the returned id is stored
   * and persisted before the stage can be marked complete.
   */
  public static PipelineStage submission(Stage stage, TaskSubmitter submitter) {
    Objects.requireNonNull(submitter, "submitter");
    return new PipelineStage(
        stage,
        context -> {
          ProjectRecord record = context.record();
          if (record.getAsrTaskId() != null) {
            LOGGER.info(
                "Reusing submitted task: project={}, taskId={}",
                record.getId(),
                record.getAsrTaskId());
            return;
          }
          String taskId = submitter.submit(context);
          record.assignAsrTaskId(taskId);
          context.persist();
          LOGGER.info("Task submitted: project={}, taskId={}", record.getId(), taskId);
        });
  }
}
