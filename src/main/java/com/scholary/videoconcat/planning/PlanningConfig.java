package com.scholary.videoconcat.planning;

/**
 * Settings for one planning run.
 *
 * <p>All validation happens here so the planner itself can assume a consistent configuration.
 *
 * @param totalConcats number of records to attempt (the target corpus size)
 * @param minVideosPerConcat smallest allowed group size
 * @param maxVideosPerConcat largest allowed group size
 * @param targetDurationMin lower bound of the duration window, seconds
 * @param targetDurationMax upper bound of the duration window, seconds
 * @param allowReuse whether a video may appear in more than one record
 * @param reuseMode how the next video is picked among eligible ones
 * @param maxUsageRatio per-video usage ceiling as a multiple of {@code totalConcats}; {@code <= 0}
 *     disables the ceiling
 * @param seed seed of the run's random stream
 * @param maxAttemptsPerRecord bound on selection rounds for one record
 * @param relaxThresholdRatio the lower duration bound is dropped while the running duration is
 *     below {@code targetDurationMin * relaxThresholdRatio}
 * @param progressLogInterval log a progress line every this many attempted records
 */
public record PlanningConfig(
    int totalConcats,
    int minVideosPerConcat,
    int maxVideosPerConcat,
    double targetDurationMin,
    double targetDurationMax,
    boolean allowReuse,
    ReuseMode reuseMode,
    double maxUsageRatio,
    long seed,
    int maxAttemptsPerRecord,
    double relaxThresholdRatio,
    int progressLogInterval) {

  public static final int DEFAULT_MAX_ATTEMPTS_PER_RECORD = 100;
  public static final double DEFAULT_RELAX_THRESHOLD_RATIO = 0.5;
  public static final int DEFAULT_PROGRESS_LOG_INTERVAL = 100;

  public PlanningConfig {
    if (totalConcats < 0) {
      throw new IllegalArgumentException("Total concatenations cannot be negative");
    }
    if (minVideosPerConcat < 1) {
      throw new IllegalArgumentException("Minimum videos per concatenation must be at least 1");
    }
    if (maxVideosPerConcat < minVideosPerConcat) {
      throw new IllegalArgumentException(
          String.format(
              "Maximum videos per concatenation (%d) must be >= minimum (%d)",
              maxVideosPerConcat, minVideosPerConcat));
    }
    if (targetDurationMin < 0) {
      throw new IllegalArgumentException("Target duration minimum cannot be negative");
    }
    if (targetDurationMax < targetDurationMin) {
      throw new IllegalArgumentException(
          String.format(
              "Target duration maximum (%ss) must be >= minimum (%ss)",
              targetDurationMax, targetDurationMin));
    }
    if (reuseMode == null) {
      throw new IllegalArgumentException("Reuse mode is required");
    }
    if (maxAttemptsPerRecord <= 0) {
      throw new IllegalArgumentException("Max attempts per record must be positive");
    }
    if (relaxThresholdRatio < 0) {
      throw new IllegalArgumentException("Relax threshold ratio cannot be negative");
    }
    if (progressLogInterval <= 0) {
      throw new IllegalArgumentException("Progress log interval must be positive");
    }
  }

  /** Config with the default attempt budget, relax threshold and progress interval. */
  public static PlanningConfig of(
      int totalConcats,
      int minVideosPerConcat,
      int maxVideosPerConcat,
      double targetDurationMin,
      double targetDurationMax,
      boolean allowReuse,
      ReuseMode reuseMode,
      double maxUsageRatio,
      long seed) {
    return new PlanningConfig(
        totalConcats,
        minVideosPerConcat,
        maxVideosPerConcat,
        targetDurationMin,
        targetDurationMax,
        allowReuse,
        reuseMode,
        maxUsageRatio,
        seed,
        DEFAULT_MAX_ATTEMPTS_PER_RECORD,
        DEFAULT_RELAX_THRESHOLD_RATIO,
        DEFAULT_PROGRESS_LOG_INTERVAL);
  }
}
