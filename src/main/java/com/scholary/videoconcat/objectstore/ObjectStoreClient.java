package com.scholary.videoconcat.objectstore;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.net.URL;
import java.time.Duration;

/**
 * Abstraction for the object storage that holds catalogs, plans and annotations.
 *
 * <p>Catalog and description documents are read from here; planned corpora and annotations are
 * written back next to them. Implementations exist for S3-compatible stores; tests mock this
 * interface.
 */
public interface ObjectStoreClient {

  /**
   * Retrieve an object as a stream. The caller closes the stream.
   *
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  InputStream getObjectStream(String bucket, String key);

  /**
   * Store an object from a stream.
   *
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

  /** Store an in-memory document. */
  default void putBytes(String bucket, String key, byte[] content, String contentType) {
    putObject(bucket, key, new ByteArrayInputStream(content), content.length, contentType);
  }
}
