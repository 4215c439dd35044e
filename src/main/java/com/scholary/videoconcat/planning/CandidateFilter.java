package com.scholary.videoconcat.planning;

import com.scholary.videoconcat.catalog.SourceVideo;
import com.scholary.videoconcat.catalog.VideoCatalog;
import java.util.ArrayList;
import java.util.List;

/**
 * Computes which videos may be picked next for the record being assembled.
 *
 * <p>Two modes share one code path:
 *
 * <ul>
 *   <li><b>Strict</b>: the video must fit the remaining window on both sides, {@code
 *       targetMin - current <= duration <= targetMax - current}.
 *   <li><b>Relaxed</b>: only the upper side is checked. Used early in assembly, when a short clip
 *       cannot satisfy the minimum alone but later additions still can.
 * </ul>
 *
 * <p>Both modes apply the reuse policy: with reuse disabled a video must be unused; with reuse
 * enabled its count must stay below the usage ceiling (if there is one).
 */
public class CandidateFilter {

  private final VideoCatalog catalog;
  private final UsageLedger ledger;
  private final PlanningConfig config;
  private final double usageCeiling;

  public CandidateFilter(VideoCatalog catalog, UsageLedger ledger, PlanningConfig config) {
    this.catalog = catalog;
    this.ledger = ledger;
    this.config = config;
    this.usageCeiling = ledger.maxAllowed(config.totalConcats(), config.maxUsageRatio());
  }

  /**
   * Eligible videos given the duration already assembled.
   *
   * @param currentDuration seconds already in the record
   * @param relaxed drop the lower bound of the remaining window
   * @return eligible videos in catalog order; empty if none qualify
   */
  public List<SourceVideo> eligible(double currentDuration, boolean relaxed) {
    double remainingMin = config.targetDurationMin() - currentDuration;
    double remainingMax = config.targetDurationMax() - currentDuration;

    List<SourceVideo> inWindow =
        relaxed
            ? catalog.videosWithDurationAtMost(remainingMax)
            : catalog.videosWithDurationBetween(remainingMin, remainingMax);

    List<SourceVideo> eligible = new ArrayList<>(inWindow.size());
    for (SourceVideo video : inWindow) {
      if (reusePermits(video)) {
        eligible.add(video);
      }
    }
    return eligible;
  }

  /** Whether the relaxed mode may be used at this point of assembly. */
  public boolean canRelax(double currentDuration) {
    return currentDuration < config.targetDurationMin() * config.relaxThresholdRatio();
  }

  public double usageCeiling() {
    return usageCeiling;
  }

  private boolean reusePermits(SourceVideo video) {
    if (!config.allowReuse()) {
      return ledger.count(video.id()) == 0;
    }
    return !ledger.isExhausted(video.id(), usageCeiling);
  }
}
