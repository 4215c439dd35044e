package com.scholary.videoconcat.planning;

/**
 * Result of assembling one record.
 *
 * <p>Exactly one of {@code record} and {@code reason} is set, depending on the state.
 */
public record AssemblyOutcome(
    int index,
    State state,
    ConcatenationRecord record,
    AbandonReason reason,
    int selectedCount,
    double duration,
    int rounds) {

  /** Terminal states; a record is accumulating until it reaches one of these. */
  public enum State {
    SATISFIED,
    ABANDONED
  }

  static AssemblyOutcome satisfied(ConcatenationRecord record, int rounds) {
    return new AssemblyOutcome(
        record.recordId(),
        State.SATISFIED,
        record,
        null,
        record.size(),
        record.totalDuration(),
        rounds);
  }

  static AssemblyOutcome abandoned(
      int index, AbandonReason reason, int selectedCount, double duration, int rounds) {
    return new AssemblyOutcome(
        index, State.ABANDONED, null, reason, selectedCount, duration, rounds);
  }

  public boolean isSatisfied() {
    return state == State.SATISFIED;
  }
}
