package com.scholary.videoconcat.cache;

import com.scholary.videoconcat.catalog.VideoCatalog;
import java.util.Optional;

/**
 * Cache of loaded video catalogs.
 *
 * <p>Previews are often repeated against the same catalog with different settings. Caching the
 * parsed catalog avoids downloading and parsing the metadata document each time.
 *
 * <p>Cache keys are based on: bucket + key of the metadata document.
 */
public interface CatalogCache {

  void put(String cacheKey, VideoCatalog catalog);

  Optional<VideoCatalog> get(String cacheKey);

  /** Size and hit-rate summary for logging. */
  String getStats();

  /**
   * Generate a cache key for a metadata document.
   *
   * @param bucket the S3 bucket
   * @param key the S3 key
   * @return a unique cache key
   */
  static String generateKey(String bucket, String key) {
    return String.format("%s:%s", bucket, key);
  }
}
