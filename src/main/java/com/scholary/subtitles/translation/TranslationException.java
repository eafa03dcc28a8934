package com.scholary.subtitles.translation;

/** Exception thrown when the translator fails or returns an unusable reply. */
public class TranslationException extends RuntimeException {

  public TranslationException(String message) {
    super(message);
  }

  public TranslationException(String message, Throwable cause) {
    super(message, cause);
  }
}
