package com.scholary.subtitles.project;

public class ProjectNotFoundException extends RuntimeException {

  public ProjectNotFoundException(String projectId) {
    super("Project not found: " + projectId);
  }
}
