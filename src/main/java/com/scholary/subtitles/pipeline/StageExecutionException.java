package com.scholary.subtitles.pipeline;

import com.scholary.subtitles.project.Stage;

/** Thrown by the runner when a stage action fails. The cause is the action's own exception. */
public class StageExecutionException extends RuntimeException {

  private final Stage stage;

  public StageExecutionException(Stage stage, Throwable cause) {
    super(String.format("Stage %s failed: %s", stage, cause.getMessage()), cause);
    this.stage = stage;
  }

  public Stage getStage() {
    return stage;
  }
}
