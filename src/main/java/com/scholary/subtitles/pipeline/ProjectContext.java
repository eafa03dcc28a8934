package com.scholary.subtitles.pipeline;

import com.scholary.subtitles.project.ProjectPaths;
import com.scholary.subtitles.project.ProjectRecord;
import com.scholary.subtitles.project.ProjectStore;
import com.scholary.subtitles.project.Stage;

/**
 * What a stage action gets to work with: the live record, the project's file layout and the store
 * the record is checkpointed to.
 */
public record ProjectContext(ProjectRecord record, ProjectPaths paths, ProjectStore store) {

  public String projectId() {
    return record.getId();
  }

  /** Write the whole record through to the store. */
  public void persist() {
    store.save(record);
  }

  /**
   * Save the record with {@code stage} completed, then mark the live record. If the save fails
   * the live record keeps the flag unset.
   */
  public void persistCompleted(Stage stage) {
    ProjectRecord checkpoint = record.copy();
    checkpoint.markCompleted(stage);
    store.save(checkpoint);
    record.markCompleted(stage);
  }
}
