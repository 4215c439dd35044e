package com.scholary.videoconcat.planning;

import com.scholary.videoconcat.catalog.SourceVideo;
import com.scholary.videoconcat.catalog.VideoCatalog;
import com.scholary.videoconcat.logging.StructuredLogger;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles concatenation records for one planning run.
 *
 * <p>Per record, assembly is a small state machine, {@code ACCUMULATING -> SATISFIED | ABANDONED}:
 *
 * <ol>
 *   <li>Draw a target group size uniformly from {@code [minVideos, maxVideos]}
 *   <li>Ask the filter for strictly eligible videos; fall back to the relaxed filter while the
 *       running duration is still far below the minimum
 *   <li>Let the strategy pick one that fits under the maximum, append it and count it in the ledger
 *   <li>Repeat until the group size is reached, nothing qualifies, or the round budget runs out
 *   <li>Emit the record only if it ended inside the duration window with enough clips
 * </ol>
 *
 * <p>The batch loop runs this {@code totalConcats} times. Records are resolved strictly one after
 * another because each one changes the ledger the next one sees.
 *
 * <p>A builder owns mutable run state (through its ledger and random stream) and is meant to be
 * used for a single run.
 */
public class ConcatenationBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConcatenationBuilder.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final PlanningConfig config;
  private final UsageLedger ledger;
  private final Random random;
  private final CandidateFilter filter;
  private final SelectionStrategy strategy;

  public ConcatenationBuilder(
      VideoCatalog catalog,
      PlanningConfig config,
      UsageLedger ledger,
      Random random,
      SelectionStrategy strategy) {
    this.config = config;
    this.ledger = ledger;
    this.random = random;
    this.strategy = strategy;
    this.filter = new CandidateFilter(catalog, ledger, config);
  }

  /**
   * Run the whole batch.
   *
   * @param listener notified after every attempt
   * @return emitted records, discard tallies and final usage
   */
  public ConcatenationPlan build(PlanProgressListener listener) {
    int total = config.totalConcats();
    LOGGER.info(
        "Generating video concatenations: total={}, videos={}-{}, duration={}-{}s, reuse={}, "
            + "strategy={}, usageCeiling={}, seed={}",
        total,
        config.minVideosPerConcat(),
        config.maxVideosPerConcat(),
        config.targetDurationMin(),
        config.targetDurationMax(),
        config.allowReuse(),
        strategy.getStrategyName(),
        filter.usageCeiling(),
        config.seed());

    List<ConcatenationRecord> records = new ArrayList<>();
    Map<AbandonReason, Integer> discardReasons = new EnumMap<>(AbandonReason.class);

    for (int i = 0; i < total; i++) {
      AssemblyOutcome outcome = assembleRecord(i);

      if (outcome.isSatisfied()) {
        records.add(outcome.record());
        structuredLogger.logRecordPlanned(
            i, outcome.selectedCount(), outcome.duration(), outcome.rounds());
      } else {
        discardReasons.merge(outcome.reason(), 1, Integer::sum);
        structuredLogger.logRecordDiscarded(
            i, outcome.reason().name(), outcome.selectedCount(), outcome.duration());
      }

      if ((i + 1) % config.progressLogInterval() == 0) {
        structuredLogger.logPlanProgress(i + 1, records.size(), total);
      }
      listener.onProgress(i + 1, records.size(), total);
    }

    ConcatenationPlan plan =
        new ConcatenationPlan(config, records, discardReasons, ledger.snapshot());
    structuredLogger.logPlanSummary(
        strategy.getStrategyName(),
        plan.produced(),
        plan.requested(),
        plan.discarded(),
        ledger.distinctVideosUsed(),
        ledger.totalCommits());
    return plan;
  }

  /**
   * Assemble a single record.
   *
   * <p>Ledger increments happen as soon as a video is appended, so they stay applied even if the
   * record is abandoned afterwards.
   *
   * @param index the attempt index, which becomes the record id on success
   * @return the outcome, carrying either the record or the abandon reason
   */
  public AssemblyOutcome assembleRecord(int index) {
    int span = config.maxVideosPerConcat() - config.minVideosPerConcat() + 1;
    int targetVideoCount = config.minVideosPerConcat() + random.nextInt(span);

    // No record can take more clips than it has rounds.
    List<SourceVideo> selected =
        new ArrayList<>(Math.min(targetVideoCount, config.maxAttemptsPerRecord()));
    double currentDuration = 0.0;
    int rounds = 0;
    AbandonReason stopReason = null;

    while (selected.size() < targetVideoCount) {
      if (rounds >= config.maxAttemptsPerRecord()) {
        stopReason = AbandonReason.ATTEMPTS_EXHAUSTED;
        break;
      }
      rounds++;

      List<SourceVideo> candidates = filter.eligible(currentDuration, false);
      if (candidates.isEmpty() && filter.canRelax(currentDuration)) {
        candidates = filter.eligible(currentDuration, true);
      }
      if (candidates.isEmpty()) {
        stopReason = AbandonReason.NO_CANDIDATES;
        break;
      }

      Optional<SourceVideo> choice =
          strategy.select(
              candidates, ledger, random, currentDuration, config.targetDurationMax());
      if (choice.isEmpty()) {
        stopReason = AbandonReason.NO_FITTING_CANDIDATE;
        break;
      }

      SourceVideo video = choice.get();
      selected.add(video);
      currentDuration += video.duration();
      ledger.increment(video.id());

      LOGGER.trace(
          "Concat {}: added {} ({}s), running duration {}s",
          index,
          video.id(),
          video.duration(),
          currentDuration);
    }

    // Terminal check: an early stop is fine as long as the record still lands in the window
    if (currentDuration < config.targetDurationMin()) {
      AbandonReason reason =
          stopReason != null ? stopReason : AbandonReason.BELOW_MINIMUM_DURATION;
      return AssemblyOutcome.abandoned(index, reason, selected.size(), currentDuration, rounds);
    }
    if (selected.size() < config.minVideosPerConcat()) {
      return AssemblyOutcome.abandoned(
          index, AbandonReason.TOO_FEW_VIDEOS, selected.size(), currentDuration, rounds);
    }

    return AssemblyOutcome.satisfied(ConcatenationRecord.fromSelection(index, selected), rounds);
  }

  public UsageLedger ledger() {
    return ledger;
  }
}
