package com.scholary.videoconcat.planning;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** How the next video is chosen among the eligible ones. */
public enum ReuseMode {
  /**
   * Least-used video first.
   *
   * <p>Ties go to the video that comes first in catalog order.
   */
  BALANCED("balanced"),

  /** Uniformly random pick from the seeded stream. */
  RANDOM("random");

  private final String value;

  ReuseMode(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static ReuseMode fromValue(String value) {
    if (value == null) {
      return null;
    }
    for (ReuseMode mode : values()) {
      if (mode.value.equals(value.toLowerCase(Locale.ROOT))) {
        return mode;
      }
    }
    throw new IllegalArgumentException("Unknown reuse mode: " + value);
  }
}
