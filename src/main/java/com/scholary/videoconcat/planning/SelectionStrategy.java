package com.scholary.videoconcat.planning;

import com.scholary.videoconcat.catalog.SourceVideo;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Strategy interface for picking the next video of a record.
 *
 * <p>Implementations only decide the preference order. The fit check against the duration maximum
 * is shared:
 *
 * <ul>
 *   <li>Balanced: least-used video first
 *   <li>Random: seeded shuffle
 * </ul>
 */
public interface SelectionStrategy {

  /**
   * Order eligible videos from most to least preferred.
   *
   * @param eligible non-empty list of eligible videos in catalog order (not modified)
   * @param ledger current usage counts
   * @param random the run's random stream
   * @return a new list holding the same videos in preference order
   */
  List<SourceVideo> rank(List<SourceVideo> eligible, UsageLedger ledger, Random random);

  /**
   * Get the strategy name for logging and debugging.
   *
   * @return strategy name
   */
  String getStrategyName();

  /**
   * Pick the preferred video that keeps the record within the duration maximum.
   *
   * <p>The top-ranked video is taken when it fits. Otherwise the first ranked video that fits is
   * taken instead.
   *
   * @return the chosen video, or empty if nothing fits
   */
  default Optional<SourceVideo> select(
      List<SourceVideo> eligible,
      UsageLedger ledger,
      Random random,
      double currentDuration,
      double targetDurationMax) {
    if (eligible.isEmpty()) {
      return Optional.empty();
    }

    List<SourceVideo> ranked = rank(eligible, ledger, random);
    SourceVideo preferred = ranked.get(0);
    if (currentDuration + preferred.duration() <= targetDurationMax) {
      return Optional.of(preferred);
    }

    return ranked.stream()
        .filter(video -> currentDuration + video.duration() <= targetDurationMax)
        .findFirst();
  }
}
