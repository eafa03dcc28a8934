package com.scholary.subtitles.job;

import com.scholary.subtitles.pipeline.StageListener;
import com.scholary.subtitles.project.Stage;

/** Mirrors stage callbacks into a {@link PipelineRun}. */
class RunProgressListener implements StageListener {

  private final PipelineRun run;

  RunProgressListener(PipelineRun run) {
    this.run = run;
  }

  @Override
  public void onStageStarted(Stage stage, int index, int total) {
    run.setCurrentStage(stage.name());
    run.setProgress((index - 1) * 100 / total);
  }

  @Override
  public void onStageSkipped(Stage stage, int index, int total) {
    run.setProgress(index * 100 / total);
  }

  @Override
  public void onStageCompleted(Stage stage, int index, int total) {
    run.setProgress(index * 100 / total);
  }
}
