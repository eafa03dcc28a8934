package com.scholary.subtitles.pipeline;

import com.scholary.subtitles.project.Stage;

/** Callbacks for run progress. All methods default to no-ops. */
public interface StageListener {

  StageListener NONE = new StageListener() {};

  default void onStageStarted(Stage stage, int index, int total) {}

  default void onStageSkipped(Stage stage, int index, int total) {}

  default void onStageCompleted(Stage stage, int index, int total) {}
}
