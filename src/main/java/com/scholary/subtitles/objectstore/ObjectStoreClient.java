package com.scholary.subtitles.objectstore;

import java.io.InputStream;
import java.net.URL;
import java.time.Duration;

/**
 * Abstraction for object storage operations.
 *
 * <p>The pipeline only needs object storage to hand audio to a remote recognizer: check whether an
 * object is already there, upload it, give the recognizer a time-limited URL and clean up
 * afterwards.
 */
public interface ObjectStoreClient {

  /**
   * Check whether an object exists.
   *
   * @throws ObjectStoreException if the check itself fails (permissions, network)
   */
  boolean exists(String bucket, String key);

  /**
   * Store an object from a stream.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param data the input stream containing object data
   * @param contentLength the size of the object in bytes
   * @param contentType the MIME type of the object
   * @throws ObjectStoreException if the upload fails
   */
  void putObject(
      String bucket, String key, InputStream data, long contentLength, String contentType);

  /**
   * Generate a presigned URL for temporary read access to an object.
   *
   * @throws ObjectStoreException if URL generation fails
   */
  URL presignGet(String bucket, String key, Duration ttl);

  /**
   * Delete an object. Deleting a missing object is not an error.
   *
   * @throws ObjectStoreException if the delete fails
   */
  void deleteObject(String bucket, String key);
}
