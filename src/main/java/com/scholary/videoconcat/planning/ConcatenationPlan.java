package com.scholary.videoconcat.planning;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Output of a planning run.
 *
 * @param config the settings the run used
 * @param records emitted records in generation order
 * @param discardReasons how many attempts were discarded, per reason
 * @param usage final usage count per video id (includes counts left by discarded attempts)
 */
public record ConcatenationPlan(
    PlanningConfig config,
    List<ConcatenationRecord> records,
    Map<AbandonReason, Integer> discardReasons,
    Map<String, Integer> usage) {

  public ConcatenationPlan {
    records = List.copyOf(records);
    discardReasons =
        discardReasons.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(discardReasons));
    usage = Collections.unmodifiableMap(usage);
  }

  public int requested() {
    return config.totalConcats();
  }

  public int produced() {
    return records.size();
  }

  public int discarded() {
    return discardReasons.values().stream().mapToInt(Integer::intValue).sum();
  }
}
