package com.scholary.subtitles.project;

/** Thrown when a user-supplied source string is not a recognizable video URL or id. */
public class InvalidSourceException extends RuntimeException {

  public InvalidSourceException(String source) {
    super("Invalid video source: " + source);
  }
}
