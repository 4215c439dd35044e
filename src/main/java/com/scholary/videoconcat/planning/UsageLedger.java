package com.scholary.videoconcat.planning;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-run counter of how many times each video has been committed to a record.
 *
 * <p>Counts only ever go up. A video is counted the moment it is appended to the record being
 * assembled, so a record that is later discarded still leaves its counts behind. Later records are
 * therefore steered away from videos that were already tentatively spent.
 *
 * <p>Not thread-safe. A ledger belongs to exactly one planning run.
 */
public class UsageLedger {

  private final Map<String, Integer> counts = new HashMap<>();
  private int totalCommits;

  /** Record one more use of a video. */
  public void increment(String videoId) {
    counts.merge(videoId, 1, Integer::sum);
    totalCommits++;
  }

  /** Times a video has been used so far (0 if never). */
  public int count(String videoId) {
    return counts.getOrDefault(videoId, 0);
  }

  /**
   * Usage ceiling for a run.
   *
   * <p>Real valued and not rounded; counts are compared against the exact product.
   * A result of 0 or less means "no ceiling".
   */
  public double maxAllowed(int totalTargetRecords, double maxUsageRatio) {
    return totalTargetRecords * maxUsageRatio;
  }

  /** True if the video has reached a positive ceiling. */
  public boolean isExhausted(String videoId, double ceiling) {
    return ceiling > 0 && count(videoId) >= ceiling;
  }

  /** Number of distinct videos used at least once. */
  public int distinctVideosUsed() {
    return counts.size();
  }

  /** Sum of all increments. */
  public int totalCommits() {
    return totalCommits;
  }

  /** Immutable copy of the counts, sorted by video id. */
  public Map<String, Integer> snapshot() {
    return Collections.unmodifiableMap(new TreeMap<>(counts));
  }
}
