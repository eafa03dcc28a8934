package com.scholary.subtitles.project;

/** Thrown when a project record cannot be read from or written to storage. */
public class ProjectStoreException extends RuntimeException {

  public ProjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
