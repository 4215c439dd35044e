package com.scholary.videoconcat.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.videoconcat.catalog.CatalogProperties;
import com.scholary.videoconcat.catalog.VideoCatalog;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-memory implementation of CatalogCache using Caffeine.
 *
 * <p>Size is bounded by {@code catalog.cache.max-size} and entries expire
 * {@code catalog.cache.ttl-minutes} after being written.
 */
@Component
public class InMemoryCatalogCache implements CatalogCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryCatalogCache.class);

  private final Cache<String, VideoCatalog> cache;

  public InMemoryCatalogCache(CatalogProperties properties) {
    this(properties.cache().maxSize(), properties.cache().ttlMinutes());
  }

  InMemoryCatalogCache(int maxSize, int ttlMinutes) {
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(ttlMinutes))
            .recordStats()
            .build();

    LOGGER.info("Initialized catalog cache: maxSize={}, ttlMinutes={}", maxSize, ttlMinutes);
  }

  @Override
  public void put(String cacheKey, VideoCatalog catalog) {
    cache.put(cacheKey, catalog);
    LOGGER.debug("Cached catalog: key={}, videos={}", cacheKey, catalog.size());
  }

  @Override
  public Optional<VideoCatalog> get(String cacheKey) {
    VideoCatalog catalog = cache.getIfPresent(cacheKey);
    if (catalog != null) {
      LOGGER.debug("Cache hit: key={}", cacheKey);
      return Optional.of(catalog);
    } else {
      LOGGER.debug("Cache miss: key={}", cacheKey);
      return Optional.empty();
    }
  }

  @Override
  public String getStats() {
    var stats = cache.stats();
    return String.format(
        "CatalogCache[size=%d, hitRate=%.2f%%, evictions=%d]",
        cache.estimatedSize(), stats.hitRate() * 100, stats.evictionCount());
  }
}
