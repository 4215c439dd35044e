package com.scholary.videoconcat.catalog;

/**
 * A source clip that can be placed into a concatenation.
 *
 * <p>The planner only reasons over the id and the duration. The path is carried through untouched
 * so downstream tooling can locate the file.
 */
public record SourceVideo(String id, double duration, String path) {

  public SourceVideo {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Video id cannot be blank");
    }
    if (!(duration > 0)) {
      throw new IllegalArgumentException("Video duration must be positive: " + id);
    }
    if (path == null) {
      throw new IllegalArgumentException("Video path cannot be null: " + id);
    }
  }
}
