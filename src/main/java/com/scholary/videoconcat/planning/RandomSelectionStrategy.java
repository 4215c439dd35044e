package com.scholary.videoconcat.planning;

import com.scholary.videoconcat.catalog.SourceVideo;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.springframework.stereotype.Component;

/**
 * Picks uniformly at random from the eligible videos.
 *
 * <p>The shuffle draws from the run's seeded stream, so a fixed seed reproduces the same picks.
 */
@Component
public class RandomSelectionStrategy implements SelectionStrategy {

  @Override
  public List<SourceVideo> rank(List<SourceVideo> eligible, UsageLedger ledger, Random random) {
    List<SourceVideo> ranked = new ArrayList<>(eligible);
    Collections.shuffle(ranked, random);
    return ranked;
  }

  @Override
  public String getStrategyName() {
    return "RANDOM";
  }
}
