package com.scholary.subtitles.api;

import java.time.Instant;

/**
 * Response for run status query.
 *
 * <p>Shows the current state of a pipeline run, the stage it is on, and the failed stage and error
 * when it failed.
 */
public record RunStatusResponse(
    String runId,
    String projectId,
    Status status,
    Integer progress,
    String currentStage,
    String failedStage,
    String error,
    Instant createdAt) {

  public enum Status {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED
  }
}
