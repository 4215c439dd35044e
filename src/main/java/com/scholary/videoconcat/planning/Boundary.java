package com.scholary.videoconcat.planning;

/**
 * Where one source clip sits inside a concatenation, in seconds from the start of the record.
 */
public record Boundary(String videoId, double startTime, double endTime) {

  public Boundary {
    if (startTime < 0) {
      throw new IllegalArgumentException("Start time cannot be negative");
    }
    if (endTime < startTime) {
      throw new IllegalArgumentException("End time must be >= start time");
    }
  }

  public double duration() {
    return endTime - startTime;
  }
}
