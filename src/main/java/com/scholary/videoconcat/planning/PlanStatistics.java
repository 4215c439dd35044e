package com.scholary.videoconcat.planning;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Summary figures for a planned corpus.
 *
 * <p>Durations are in seconds. An empty corpus yields zeros everywhere rather than NaN.
 */
public record PlanStatistics(
    int requested,
    int produced,
    int discarded,
    Map<AbandonReason, Integer> discardReasons,
    DurationSummary recordDurations,
    DurationSummary clipDurations,
    Map<Integer, Integer> videosPerRecord,
    Map<String, Integer> durationBuckets,
    UsageSummary usage) {

  private static final double BUCKET_WIDTH_SECONDS = 30.0;
  private static final int BUCKET_COUNT = 8;

  public record DurationSummary(
      double total, double mean, double min, double max, double median, double stdDev) {

    static final DurationSummary EMPTY = new DurationSummary(0, 0, 0, 0, 0, 0);

    static DurationSummary of(double[] values) {
      if (values.length == 0) {
        return EMPTY;
      }
      double[] sorted = values.clone();
      Arrays.sort(sorted);

      double total = 0.0;
      for (double value : sorted) {
        total += value;
      }
      double mean = total / sorted.length;

      double squares = 0.0;
      for (double value : sorted) {
        squares += (value - mean) * (value - mean);
      }
      // Population standard deviation
      double stdDev = Math.sqrt(squares / sorted.length);

      int mid = sorted.length / 2;
      double median =
          sorted.length % 2 == 0 ? (sorted[mid - 1] + sorted[mid]) / 2.0 : sorted[mid];

      return new DurationSummary(
          total, mean, sorted[0], sorted[sorted.length - 1], median, stdDev);
    }
  }

  /**
   * @param distinctVideosUsed videos with a non-zero count
   * @param maxUsage highest count of any single video
   * @param meanUsage average count over used videos
   */
  public record UsageSummary(int distinctVideosUsed, int maxUsage, double meanUsage) {}

  /** Compute statistics for a plan. */
  public static PlanStatistics of(ConcatenationPlan plan) {
    List<ConcatenationRecord> records = plan.records();

    double[] recordDurations = new double[records.size()];
    List<Double> clipDurations = new ArrayList<>();
    Map<Integer, Integer> videosPerRecord = new TreeMap<>();
    int[] buckets = new int[BUCKET_COUNT + 1];

    for (int i = 0; i < records.size(); i++) {
      ConcatenationRecord record = records.get(i);
      recordDurations[i] = record.totalDuration();
      videosPerRecord.merge(record.size(), 1, Integer::sum);
      for (Boundary boundary : record.boundaries()) {
        clipDurations.add(boundary.duration());
      }
      int bucket = (int) (record.totalDuration() / BUCKET_WIDTH_SECONDS);
      buckets[Math.min(bucket, BUCKET_COUNT)]++;
    }

    return new PlanStatistics(
        plan.requested(),
        plan.produced(),
        plan.discarded(),
        plan.discardReasons(),
        DurationSummary.of(recordDurations),
        DurationSummary.of(clipDurations.stream().mapToDouble(Double::doubleValue).toArray()),
        videosPerRecord,
        bucketLabels(buckets),
        usageSummary(plan.usage()));
  }

  private static Map<String, Integer> bucketLabels(int[] buckets) {
    Map<String, Integer> labelled = new LinkedHashMap<>();
    for (int i = 0; i < BUCKET_COUNT; i++) {
      int from = (int) (i * BUCKET_WIDTH_SECONDS);
      int to = (int) ((i + 1) * BUCKET_WIDTH_SECONDS);
      labelled.put(from + "-" + to + "s", buckets[i]);
    }
    labelled.put((int) (BUCKET_COUNT * BUCKET_WIDTH_SECONDS) + "s+", buckets[BUCKET_COUNT]);
    return labelled;
  }

  private static UsageSummary usageSummary(Map<String, Integer> usage) {
    int distinct = 0;
    int max = 0;
    long sum = 0;
    for (int count : usage.values()) {
      if (count > 0) {
        distinct++;
        sum += count;
        max = Math.max(max, count);
      }
    }
    double mean = distinct == 0 ? 0.0 : (double) sum / distinct;
    return new UsageSummary(distinct, max, mean);
  }
}
