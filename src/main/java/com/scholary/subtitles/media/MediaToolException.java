package com.scholary.subtitles.media;

/**
 * Exception thrown when an external media tool (yt-dlp, ffmpeg) fails, times out, or produces
 * output we cannot use.
 */
public class MediaToolException extends RuntimeException {

  public MediaToolException(String message) {
    super(message);
  }

  public MediaToolException(String message, Throwable cause) {
    super(message, cause);
  }
}
