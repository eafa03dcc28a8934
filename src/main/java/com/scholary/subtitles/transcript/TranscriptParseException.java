package com.scholary.subtitles.transcript;

/**
 * Thrown when a recognizer result cannot be read or does not match the expected schema.
 *
 * <p>Not retryable: the stored result has to be fixed or re-fetched by an operator.
 */
public class TranscriptParseException extends RuntimeException {

  public TranscriptParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
