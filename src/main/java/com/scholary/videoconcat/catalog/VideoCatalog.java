package com.scholary.videoconcat.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of source videos available to a planning run.
 *
 * <p>Videos keep the order they were loaded in ("catalog order"). Planning decisions that need a
 * deterministic tie-break fall back to this order, so it is part of the catalog's contract.
 *
 * <p>Besides the id lookup, the catalog keeps a duration-sorted index. Range queries use binary
 * search over that index and hand results back in catalog order.
 */
public final class VideoCatalog {

  private final List<SourceVideo> videos;
  private final Map<String, SourceVideo> videosById;
  private final Map<String, Integer> positions;
  private final List<SourceVideo> byDuration;
  private final double[] sortedDurations;

  public VideoCatalog(List<SourceVideo> videos) {
    if (videos == null || videos.isEmpty()) {
      throw new EmptyCatalogException("Catalog contains no videos");
    }

    Map<String, SourceVideo> byId = new HashMap<>();
    Map<String, Integer> order = new HashMap<>();
    for (int i = 0; i < videos.size(); i++) {
      SourceVideo video = videos.get(i);
      if (byId.putIfAbsent(video.id(), video) != null) {
        throw new InvalidCatalogException("Duplicate video id in catalog: " + video.id());
      }
      order.put(video.id(), i);
    }

    this.videos = List.copyOf(videos);
    this.videosById = Collections.unmodifiableMap(byId);
    this.positions = Collections.unmodifiableMap(order);

    List<SourceVideo> sorted = new ArrayList<>(videos);
    sorted.sort(Comparator.comparingDouble(SourceVideo::duration));
    this.byDuration = List.copyOf(sorted);
    this.sortedDurations = sorted.stream().mapToDouble(SourceVideo::duration).toArray();
  }

  /** All videos in catalog order. */
  public List<SourceVideo> videos() {
    return videos;
  }

  public int size() {
    return videos.size();
  }

  public Optional<SourceVideo> findById(String videoId) {
    return Optional.ofNullable(videosById.get(videoId));
  }

  public double totalDuration() {
    double total = 0.0;
    for (SourceVideo video : videos) {
      total += video.duration();
    }
    return total;
  }

  public double shortestDuration() {
    return sortedDurations[0];
  }

  public double longestDuration() {
    return sortedDurations[sortedDurations.length - 1];
  }

  /**
   * Videos whose duration lies in {@code [minSeconds, maxSeconds]}.
   *
   * @return matching videos in catalog order (empty if the range is empty)
   */
  public List<SourceVideo> videosWithDurationBetween(double minSeconds, double maxSeconds) {
    if (maxSeconds < minSeconds) {
      return List.of();
    }
    int from = firstIndexAtLeast(minSeconds);
    int to = firstIndexAbove(maxSeconds);
    if (from >= to) {
      return List.of();
    }

    List<SourceVideo> matches = new ArrayList<>(byDuration.subList(from, to));
    matches.sort(Comparator.comparingInt(video -> positions.get(video.id())));
    return matches;
  }

  /**
   * Videos no longer than {@code maxSeconds}.
   *
   * @return matching videos in catalog order
   */
  public List<SourceVideo> videosWithDurationAtMost(double maxSeconds) {
    return videosWithDurationBetween(Double.NEGATIVE_INFINITY, maxSeconds);
  }

  // First index whose duration is >= value
  private int firstIndexAtLeast(double value) {
    int low = 0;
    int high = sortedDurations.length;
    while (low < high) {
      int mid = (low + high) >>> 1;
      if (sortedDurations[mid] < value) {
        low = mid + 1;
      } else {
        high = mid;
      }
    }
    return low;
  }

  // First index whose duration is > value
  private int firstIndexAbove(double value) {
    int low = 0;
    int high = sortedDurations.length;
    while (low < high) {
      int mid = (low + high) >>> 1;
      if (sortedDurations[mid] <= value) {
        low = mid + 1;
      } else {
        high = mid;
      }
    }
    return low;
  }
}
