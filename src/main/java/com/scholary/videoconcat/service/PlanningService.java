package com.scholary.videoconcat.service;

import com.scholary.videoconcat.api.PlanRequest;
import com.scholary.videoconcat.api.PlanResponse;
import com.scholary.videoconcat.api.StorageInfo;
import com.scholary.videoconcat.cache.CatalogCache;
import com.scholary.videoconcat.catalog.VideoCatalog;
import com.scholary.videoconcat.catalog.VideoCatalogLoader;
import com.scholary.videoconcat.config.PlannerProperties;
import com.scholary.videoconcat.objectstore.ObjectStoreClient;
import com.scholary.videoconcat.planning.ConcatenationPlan;
import com.scholary.videoconcat.planning.ConcatenationPlanner;
import com.scholary.videoconcat.planning.PlanProgressListener;
import com.scholary.videoconcat.planning.PlanStatistics;
import com.scholary.videoconcat.planning.PlanningConfig;
import java.io.IOException;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Runs planning requests end to end.
 *
 * <p>Resolves the run config from the request and the configured defaults, loads the catalog
 * (through the catalog cache), plans the corpus, computes statistics and optionally saves
 * {@code concat_metadata.json} next to the catalog.
 */
@Service
public class PlanningService {

  private static final Logger LOGGER = LoggerFactory.getLogger(PlanningService.class);

  private final ObjectStoreClient objectStoreClient;
  private final VideoCatalogLoader catalogLoader;
  private final CatalogCache catalogCache;
  private final ConcatenationPlanner planner;
  private final PlanWriter planWriter;
  private final PlannerProperties defaults;

  public PlanningService(
      ObjectStoreClient objectStoreClient,
      VideoCatalogLoader catalogLoader,
      CatalogCache catalogCache,
      ConcatenationPlanner planner,
      PlanWriter planWriter,
      PlannerProperties defaults) {
    this.objectStoreClient = objectStoreClient;
    this.catalogLoader = catalogLoader;
    this.catalogCache = catalogCache;
    this.planner = planner;
    this.planWriter = planWriter;
    this.defaults = defaults;
  }

  /** Plan without saving, whatever the request's {@code save} flag says. */
  public PlanResponse preview(PlanRequest request) throws IOException {
    return execute(request, false, PlanProgressListener.NONE);
  }

  /** Plan and save when the request asks for it. */
  public PlanResponse plan(PlanRequest request, PlanProgressListener listener) throws IOException {
    return execute(request, request.save(), listener);
  }

  private PlanResponse execute(PlanRequest request, boolean save, PlanProgressListener listener)
      throws IOException {
    String correlationId = UUID.randomUUID().toString();
    MDC.put("correlationId", correlationId);

    try {
      // Validate settings before touching storage
      PlanningConfig config = resolveConfig(request);

      LOGGER.info(
          "Starting planning: bucket={}, catalogKey={}, totalConcats={}, reuseMode={}, save={}",
          request.bucket(),
          request.catalogKey(),
          config.totalConcats(),
          config.reuseMode().value(),
          save);

      VideoCatalog catalog = loadCatalog(request.bucket(), request.catalogKey());
      ConcatenationPlan plan = planner.plan(catalog, config, listener);
      PlanStatistics statistics = PlanStatistics.of(plan);
      List<ConcatMetadataEntry> entries = planWriter.toEntries(plan.records());

      StorageInfo storageInfo = null;
      if (save) {
        String outputKey =
            request.outputKey() != null && !request.outputKey().isBlank()
                ? request.outputKey()
                : PlanWriter.defaultPlanKey(request.catalogKey());
        storageInfo = planWriter.savePlan(request.bucket(), outputKey, entries);
      }

      return new PlanResponse(config, entries, statistics, plan.usage(), storageInfo);

    } finally {
      MDC.remove("correlationId");
    }
  }

  /**
   * Merge request overrides onto the configured defaults.
   *
   * @throws IllegalArgumentException if the merged settings are inconsistent
   */
  public PlanningConfig resolveConfig(PlanRequest request) {
    return new PlanningConfig(
        valueOr(request.totalConcats(), defaults.totalConcats()),
        valueOr(request.minVideosPerConcat(), defaults.minVideosPerConcat()),
        valueOr(request.maxVideosPerConcat(), defaults.maxVideosPerConcat()),
        valueOr(request.targetDurationMin(), defaults.targetDurationMin()),
        valueOr(request.targetDurationMax(), defaults.targetDurationMax()),
        valueOr(request.allowReuse(), defaults.allowReuse()),
        valueOr(request.reuseMode(), defaults.reuseMode()),
        valueOr(request.maxUsageRatio(), defaults.maxUsageRatio()),
        valueOr(request.seed(), defaults.seed()),
        defaults.maxAttemptsPerRecord(),
        defaults.relaxThresholdRatio(),
        defaults.progressLogInterval());
  }

  /** Load a catalog, using the cached copy when there is one. */
  VideoCatalog loadCatalog(String bucket, String key) {
    String cacheKey = CatalogCache.generateKey(bucket, key);
    var cached = catalogCache.get(cacheKey);
    if (cached.isPresent()) {
      LOGGER.info("Using cached catalog: bucket={}, key={}", bucket, key);
      return cached.get();
    }

    VideoCatalog catalog = catalogLoader.load(objectStoreClient.getObjectStream(bucket, key), key);
    catalogCache.put(cacheKey, catalog);
    LOGGER.debug("Catalog cache: {}", catalogCache.getStats());
    return catalog;
  }

  private static <T> T valueOr(T value, T fallback) {
    return value != null ? value : fallback;
  }
}
