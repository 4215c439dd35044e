package com.scholary.videoconcat.planning;

import com.scholary.videoconcat.catalog.SourceVideo;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import org.springframework.stereotype.Component;

/**
 * Prefers the least-used video.
 *
 * <p>The sort is stable, so equal counts keep catalog order. This mode never touches the random
 * stream.
 */
@Component
public class BalancedSelectionStrategy implements SelectionStrategy {

  @Override
  public List<SourceVideo> rank(List<SourceVideo> eligible, UsageLedger ledger, Random random) {
    List<SourceVideo> ranked = new ArrayList<>(eligible);
    ranked.sort(Comparator.comparingInt(video -> ledger.count(video.id())));
    return ranked;
  }

  @Override
  public String getStrategyName() {
    return "BALANCED";
  }
}
