package com.scholary.subtitles.project;

/**
 * Thrown when a stored project record is malformed, was written with another schema version, or
 * does not belong to the project it was loaded for.
 */
public class ProjectRecordValidationException extends RuntimeException {

  public ProjectRecordValidationException(String message) {
    super(message);
  }

  public ProjectRecordValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
