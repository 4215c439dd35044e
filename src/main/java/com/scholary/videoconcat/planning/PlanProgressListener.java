package com.scholary.videoconcat.planning;

/** Receives progress updates while a batch is being planned. */
@FunctionalInterface
public interface PlanProgressListener {

  PlanProgressListener NONE = (attempted, produced, total) -> {};

  /**
   * Called after each record attempt.
   *
   * @param attempted attempts finished so far
   * @param produced records emitted so far
   * @param total attempts the run will make
   */
  void onProgress(int attempted, int produced, int total);
}
