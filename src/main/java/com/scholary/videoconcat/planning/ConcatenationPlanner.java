package com.scholary.videoconcat.planning;

import com.scholary.videoconcat.catalog.VideoCatalog;
import java.util.EnumMap;
import java.util.Map;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Entry point for planning runs.
 *
 * <p>Every call gets a fresh ledger and a fresh {@link Random} seeded from the config, so runs are
 * independent of each other and reproducible. The selection strategy is looked up from the config's
 * reuse mode.
 */
@Component
public class ConcatenationPlanner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConcatenationPlanner.class);

  private final Map<ReuseMode, SelectionStrategy> strategies;

  public ConcatenationPlanner(
      BalancedSelectionStrategy balancedStrategy, RandomSelectionStrategy randomStrategy) {
    this.strategies = new EnumMap<>(ReuseMode.class);
    this.strategies.put(ReuseMode.BALANCED, balancedStrategy);
    this.strategies.put(ReuseMode.RANDOM, randomStrategy);
  }

  public ConcatenationPlan plan(VideoCatalog catalog, PlanningConfig config) {
    return plan(catalog, config, PlanProgressListener.NONE);
  }

  /**
   * Plan a full corpus over a catalog.
   *
   * @param catalog the loaded source videos
   * @param config run settings
   * @param listener progress callback
   * @return the planned corpus (possibly smaller than requested)
   */
  public ConcatenationPlan plan(
      VideoCatalog catalog, PlanningConfig config, PlanProgressListener listener) {
    SelectionStrategy strategy = strategies.get(config.reuseMode());
    if (strategy == null) {
      throw new IllegalArgumentException("Unsupported reuse mode: " + config.reuseMode());
    }

    LOGGER.info(
        "Starting concatenation planning: catalogSize={}, catalogDuration={}s, shortest={}s,"
            + " longest={}s, strategy={}",
        catalog.size(),
        catalog.totalDuration(),
        catalog.shortestDuration(),
        catalog.longestDuration(),
        strategy.getStrategyName());

    ConcatenationBuilder builder =
        new ConcatenationBuilder(
            catalog, config, new UsageLedger(), new Random(config.seed()), strategy);
    return builder.build(listener);
  }
}
