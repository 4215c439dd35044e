package com.scholary.videoconcat.planning;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.Test;

class UsageLedgerTest {

  private final UsageLedger ledger = new UsageLedger();

  @Test
  void count_shouldBeZeroForUnseenVideo() {
    assertThat(ledger.count("never")).isZero();
  }

  @Test
  void increment_shouldAccumulatePerVideo() {
    ledger.increment("a");
    ledger.increment("a");
    ledger.increment("b");

    assertThat(ledger.count("a")).isEqualTo(2);
    assertThat(ledger.count("b")).isEqualTo(1);
    assertThat(ledger.distinctVideosUsed()).isEqualTo(2);
    assertThat(ledger.totalCommits()).isEqualTo(3);
  }

  @Test
  void maxAllowed_shouldNotRound() {
    assertThat(ledger.maxAllowed(5, 0.5)).isEqualTo(2.5);
    assertThat(ledger.maxAllowed(500, 2.0)).isEqualTo(1000.0);
  }

  @Test
  void isExhausted_shouldCompareAgainstRealCeiling() {
    ledger.increment("a");
    ledger.increment("a");
    assertThat(ledger.isExhausted("a", 2.5)).isFalse();

    ledger.increment("a");
    assertThat(ledger.isExhausted("a", 2.5)).isTrue();
  }

  @Test
  void isExhausted_shouldTreatNonPositiveCeilingAsUncapped() {
    for (int i = 0; i < 10; i++) {
      ledger.increment("a");
    }
    assertThat(ledger.isExhausted("a", 0.0)).isFalse();
    assertThat(ledger.isExhausted("a", -1.0)).isFalse();
  }

  @Test
  void snapshot_shouldBeImmutableCopy() {
    ledger.increment("b");
    ledger.increment("a");
    Map<String, Integer> snapshot = ledger.snapshot();

    ledger.increment("a");

    assertThat(snapshot).containsExactly(Map.entry("a", 1), Map.entry("b", 1));
    assertThatThrownBy(() -> snapshot.put("c", 1))
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
