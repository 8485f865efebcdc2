package com.scholary.discussion.archive;

import java.io.InputStream;
import java.net.URL;
import java.time.Duration;

/**
 * Object storage used to archive session artifacts.
 *
 * <p>Kept behind an interface so the archive can run against S3 or MinIO and be mocked in tests.
 */
public interface ObjectStoreClient {

  /**
   * Store an object from a stream.
   *
   * @param contentLength exact size of {@code data} in bytes
   * @throws ObjectStoreException if the upload fails
   */
  void putObject(
      String bucket, String key, InputStream data, long contentLength, String contentType);

  /**
   * Retrieve an object as a stream. The caller closes the stream.
   *
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  InputStream getObjectStream(String bucket, String key);

  /**
   * Presigned URL for temporary read access to an object.
   *
   * @throws ObjectStoreException if URL generation fails
   */
  URL presignGet(String bucket, String key, Duration ttl);
}
