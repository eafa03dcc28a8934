package com.scholary.subtitles.asr;

/**
 * Exception thrown when speech recognition fails.
 *
 * <p>This could be a rejected submission, a failed or timed-out task, or an unreadable result.
 */
public class AsrException extends RuntimeException {

  public AsrException(String message) {
    super(message);
  }

  public AsrException(String message, Throwable cause) {
    super(message, cause);
  }
}
