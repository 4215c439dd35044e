package com.scholary.videoconcat.api;

import com.scholary.videoconcat.planning.ReuseMode;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Request for planning a concatenation corpus.
 *
 * <p>Names the catalog document in object storage. Every planner setting is optional; missing
 * values fall back to the "planner.*" defaults. {@code outputKey} defaults to the catalog key with
 * its extension replaced by {@code _concat_metadata.json}. Group sizes are capped at 1000 videos.
 */
public record PlanRequest(
    @NotBlank String bucket,
    @NotBlank String catalogKey,
    String outputKey,
    Boolean save,
    @PositiveOrZero Integer totalConcats,
    @Min(1) @Max(1000) Integer minVideosPerConcat,
    @Min(1) @Max(1000) Integer maxVideosPerConcat,
    @PositiveOrZero Double targetDurationMin,
    @PositiveOrZero Double targetDurationMax,
    Boolean allowReuse,
    ReuseMode reuseMode,
    Double maxUsageRatio,
    Long seed) {

  // Provide defaults
  public PlanRequest {
    if (save == null) {
      save = true;
    }
  }

  /** A request that uses the configured defaults for every planner setting. */
  public static PlanRequest withDefaults(String bucket, String catalogKey) {
    return new PlanRequest(
        bucket, catalogKey, null, null, null, null, null, null, null, null, null, null, null);
  }
}
