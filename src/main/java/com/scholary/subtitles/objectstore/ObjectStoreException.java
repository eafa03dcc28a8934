package com.scholary.subtitles.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>Unchecked: a missing bucket or bad credentials cannot be fixed by the caller.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
