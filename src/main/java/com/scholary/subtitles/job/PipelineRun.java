package com.scholary.subtitles.job;

import com.scholary.subtitles.api.RunStatusResponse;
import com.scholary.subtitles.api.RunStatusResponse.Status;
import java.time.Instant;

/**
 * Represents one asynchronous pipeline run of a project.
 *
 * <p>Updated from the worker thread and read from request threads, hence the volatile fields.
 */
public class PipelineRun {

  private final String runId;
  private final String projectId;
  private final Instant createdAt;

  private volatile Status status;
  private volatile int progress; // 0-100
  private volatile String currentStage;
  private volatile String failedStage;
  private volatile String error;

  public PipelineRun(String runId, String projectId) {
    this.runId = runId;
    this.projectId = projectId;
    this.createdAt = Instant.now();
    this.status = Status.PENDING;
    this.progress = 0;
  }

  public String getRunId() {
    return runId;
  }

  public String getProjectId() {
    return projectId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public int getProgress() {
    return progress;
  }

  public void setProgress(int progress) {
    this.progress = progress;
  }

  public String getCurrentStage() {
    return currentStage;
  }

  public void setCurrentStage(String currentStage) {
    this.currentStage = currentStage;
  }

  public String getFailedStage() {
    return failedStage;
  }

  public String getError() {
    return error;
  }

  public void fail(String failedStage, String error) {
    this.failedStage = failedStage;
    this.error = error;
    this.status = Status.FAILED;
  }

  public RunStatusResponse toResponse() {
    return new RunStatusResponse(
        runId, projectId, status, progress, currentStage, failedStage, error, createdAt);
  }
}
