package com.scholary.subtitles.pipeline;

/** Thrown when a run is requested for a project that already has a run in progress. */
public class ProjectBusyException extends RuntimeException {

  public ProjectBusyException(String projectId) {
    super("Project is already being processed: " + projectId);
  }
}
