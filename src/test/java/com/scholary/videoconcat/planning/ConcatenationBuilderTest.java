package com.scholary.videoconcat.planning;

import static com.scholary.videoconcat.planning.PlanningFixtures.abcCatalog;
import static com.scholary.videoconcat.planning.PlanningFixtures.config;
import static com.scholary.videoconcat.planning.PlanningFixtures.randomCatalog;
import static com.scholary.videoconcat.planning.PlanningFixtures.video;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.scholary.videoconcat.catalog.SourceVideo;
import com.scholary.videoconcat.catalog.VideoCatalog;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class ConcatenationBuilderTest {

  private static ConcatenationBuilder builder(VideoCatalog catalog, PlanningConfig config) {
    SelectionStrategy strategy =
        config.reuseMode() == ReuseMode.BALANCED
            ? new BalancedSelectionStrategy()
            : new RandomSelectionStrategy();
    return new ConcatenationBuilder(
        catalog, config, new UsageLedger(), new Random(config.seed()), strategy);
  }

  private static ConcatenationPlan build(VideoCatalog catalog, PlanningConfig config) {
    return builder(catalog, config).build(PlanProgressListener.NONE);
  }

  @ParameterizedTest
  @EnumSource(ReuseMode.class)
  void build_shouldKeepEveryRecordInsideWindowAndGroupSize(ReuseMode mode) {
    PlanningConfig config = config(200, 2, 4, 20.0, 60.0, true, mode, 2.0);

    ConcatenationPlan plan = build(randomCatalog(150, 3L), config);

    assertThat(plan.records()).isNotEmpty();
    for (ConcatenationRecord record : plan.records()) {
      assertThat(record.totalDuration()).isBetween(20.0, 60.0);
      assertThat(record.size()).isBetween(2, 4);
    }
  }

  @ParameterizedTest
  @EnumSource(ReuseMode.class)
  void build_shouldProduceContiguousBoundaries(ReuseMode mode) {
    ConcatenationPlan plan =
        build(randomCatalog(80, 5L), config(50, 1, 5, 15.0, 45.0, true, mode, 1.0));

    for (ConcatenationRecord record : plan.records()) {
      List<Boundary> boundaries = record.boundaries();
      assertThat(boundaries.get(0).startTime()).isZero();
      for (int i = 1; i < boundaries.size(); i++) {
        assertThat(boundaries.get(i).startTime()).isEqualTo(boundaries.get(i - 1).endTime());
      }
      assertThat(record.totalDuration())
          .isEqualTo(boundaries.get(boundaries.size() - 1).endTime());
      assertThat(record.memberVideoIds())
          .containsExactlyElementsOf(boundaries.stream().map(Boundary::videoId).toList());
    }
  }

  @ParameterizedTest
  @EnumSource(ReuseMode.class)
  void build_shouldNeverRepeatVideosWhenReuseDisabled(ReuseMode mode) {
    ConcatenationPlan plan =
        build(randomCatalog(120, 11L), config(100, 2, 4, 20.0, 60.0, false, mode, 2.0));

    Set<String> seen = new HashSet<>();
    for (ConcatenationRecord record : plan.records()) {
      for (String id : record.memberVideoIds()) {
        assertThat(seen.add(id)).as("video %s reused", id).isTrue();
      }
    }
  }

  @ParameterizedTest
  @EnumSource(ReuseMode.class)
  void build_shouldRespectUsageCeiling(ReuseMode mode) {
    // ceiling = 100 * 0.03 = 3
    ConcatenationPlan plan =
        build(randomCatalog(40, 17L), config(100, 2, 4, 20.0, 60.0, true, mode, 0.03));

    assertThat(plan.usage().values()).allSatisfy(count -> assertThat(count).isLessThanOrEqualTo(3));
  }

  @ParameterizedTest
  @EnumSource(ReuseMode.class)
  void build_shouldBeDeterministicForSameSeed(ReuseMode mode) {
    VideoCatalog catalog = randomCatalog(60, 23L);
    PlanningConfig config = config(80, 2, 4, 20.0, 60.0, true, mode, 2.0);

    ConcatenationPlan first = build(catalog, config);
    ConcatenationPlan second = build(catalog, config);

    assertThat(first.records()).isEqualTo(second.records());
    assertThat(first.usage()).isEqualTo(second.usage());
  }

  @Test
  void build_shouldPairShortClipsAndSkipOverlongOne() {
    ConcatenationPlan plan =
        build(abcCatalog(), config(10, 2, 2, 20.0, 30.0, true, ReuseMode.BALANCED, 2.0));

    assertThat(plan.records()).hasSize(10);
    for (ConcatenationRecord record : plan.records()) {
      assertThat(record.memberVideoIds()).containsExactlyInAnyOrder("A", "B");
      assertThat(record.totalDuration()).isCloseTo(25.0, within(1e-9));
    }
    assertThat(plan.usage()).doesNotContainKey("C");
  }

  @ParameterizedTest
  @EnumSource(ReuseMode.class)
  void build_shouldNeverSelectVideoLongerThanMaximum(ReuseMode mode) {
    List<SourceVideo> videos = new ArrayList<>();
    videos.add(video("huge", 500.0));
    videos.addAll(randomCatalog(30, 29L).videos());

    ConcatenationPlan plan =
        build(new VideoCatalog(videos), config(60, 1, 4, 10.0, 60.0, true, mode, 0.0));

    assertThat(plan.usage()).doesNotContainKey("huge");
  }

  @Test
  void build_shouldNameRecordsAfterAttemptIndex() {
    // single-use catalog: only the first attempt can succeed
    ConcatenationPlan plan =
        build(abcCatalog(), config(3, 2, 2, 20.0, 30.0, false, ReuseMode.BALANCED, 2.0));

    assertThat(plan.records()).hasSize(1);
    assertThat(plan.records().get(0).recordId()).isZero();
    assertThat(plan.records().get(0).name()).isEqualTo("concat_00000.mp4");
    assertThat(plan.produced()).isEqualTo(1);
    assertThat(plan.discarded()).isEqualTo(2);
    assertThat(plan.requested()).isEqualTo(3);
  }

  @Test
  void assembleRecord_shouldKeepIncrementsOfAbandonedRecord() {
    VideoCatalog catalog = new VideoCatalog(List.of(video("A", 10.0)));
    ConcatenationBuilder builder =
        builder(catalog, config(1, 2, 2, 20.0, 30.0, false, ReuseMode.BALANCED, 2.0));

    AssemblyOutcome outcome = builder.assembleRecord(0);

    assertThat(outcome.isSatisfied()).isFalse();
    assertThat(outcome.reason()).isEqualTo(AbandonReason.NO_CANDIDATES);
    assertThat(outcome.record()).isNull();
    assertThat(builder.ledger().count("A")).isEqualTo(1);
  }

  @Test
  void assembleRecord_shouldDiscardRecordWithTooFewVideos() {
    VideoCatalog catalog = new VideoCatalog(List.of(video("A", 25.0)));
    ConcatenationBuilder builder =
        builder(catalog, config(1, 2, 2, 20.0, 30.0, true, ReuseMode.BALANCED, 2.0));

    AssemblyOutcome outcome = builder.assembleRecord(0);

    assertThat(outcome.state()).isEqualTo(AssemblyOutcome.State.ABANDONED);
    assertThat(outcome.reason()).isEqualTo(AbandonReason.TOO_FEW_VIDEOS);
    assertThat(outcome.selectedCount()).isEqualTo(1);
  }

  @Test
  void assembleRecord_shouldStopWhenRoundBudgetIsSpent() {
    PlanningConfig config =
        new PlanningConfig(
            1, 2, 2, 20.0, 30.0, true, ReuseMode.BALANCED, 2.0, 42L, 1, 0.5, 100);
    ConcatenationBuilder builder = builder(abcCatalog(), config);

    AssemblyOutcome outcome = builder.assembleRecord(0);

    assertThat(outcome.reason()).isEqualTo(AbandonReason.ATTEMPTS_EXHAUSTED);
    assertThat(outcome.rounds()).isEqualTo(1);
  }

  @Test
  void assembleRecord_shouldHandleHugeGroupSizeWithinRoundBudget() {
    VideoCatalog catalog = new VideoCatalog(List.of(video("A", 10.0), video("B", 15.0)));
    ConcatenationBuilder builder =
        builder(
            catalog,
            config(
                1,
                Integer.MAX_VALUE - 10,
                Integer.MAX_VALUE,
                20.0,
                30.0,
                true,
                ReuseMode.BALANCED,
                2.0));

    AssemblyOutcome outcome = builder.assembleRecord(0);

    assertThat(outcome.isSatisfied()).isFalse();
    assertThat(outcome.record()).isNull();
    assertThat(outcome.rounds())
        .isLessThanOrEqualTo(PlanningConfig.DEFAULT_MAX_ATTEMPTS_PER_RECORD);
  }

  @Test
  void build_shouldTallyDiscardReasons() {
    ConcatenationPlan plan =
        build(
            new VideoCatalog(List.of(video("A", 25.0))),
            config(4, 2, 2, 20.0, 30.0, true, ReuseMode.BALANCED, 2.0));

    assertThat(plan.records()).isEmpty();
    assertThat(plan.discardReasons()).isEqualTo(Map.of(AbandonReason.TOO_FEW_VIDEOS, 4));
  }

  @Test
  void build_shouldNotifyListenerAfterEveryAttempt() {
    List<Integer> attempts = new ArrayList<>();
    PlanningConfig config = config(7, 2, 3, 20.0, 60.0, true, ReuseMode.RANDOM, 2.0);

    builder(randomCatalog(20, 31L), config)
        .build((attempted, produced, total) -> {
          assertThat(total).isEqualTo(7);
          assertThat(produced).isLessThanOrEqualTo(attempted);
          attempts.add(attempted);
        });

    assertThat(attempts).containsExactly(1, 2, 3, 4, 5, 6, 7);
  }

  @Test
  void build_shouldReturnEmptyPlanForZeroTotal() {
    ConcatenationPlan plan =
        build(abcCatalog(), config(0, 2, 2, 20.0, 30.0, true, ReuseMode.BALANCED, 2.0));

    assertThat(plan.records()).isEmpty();
    assertThat(plan.discarded()).isZero();
    assertThat(plan.usage()).isEmpty();
  }
}
