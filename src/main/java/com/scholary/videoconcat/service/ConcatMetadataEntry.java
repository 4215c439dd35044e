package com.scholary.videoconcat.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.videoconcat.planning.Boundary;
import com.scholary.videoconcat.planning.ConcatenationRecord;
import java.util.List;

/**
 * One entry of {@code concat_metadata.json}, the document consumed by the video concatenation and
 * annotation steps downstream.
 *
 * <pre>
 * {
 *   "concat_video": "concat_00000.mp4",
 *   "total_duration": 25.0,
 *   "boundaries": [{"video_id": "A", "start_time": 0.0, "end_time": 10.0}, ...],
 *   "videos": ["A", "B"]
 * }
 * </pre>
 */
public record ConcatMetadataEntry(
    @JsonProperty("concat_video") String concatVideo,
    @JsonProperty("total_duration") double totalDuration,
    @JsonProperty("boundaries") List<BoundaryEntry> boundaries,
    @JsonProperty("videos") List<String> videos) {

  public record BoundaryEntry(
      @JsonProperty("video_id") String videoId,
      @JsonProperty("start_time") double startTime,
      @JsonProperty("end_time") double endTime) {}

  public static ConcatMetadataEntry from(ConcatenationRecord record) {
    List<BoundaryEntry> boundaries =
        record.boundaries().stream().map(ConcatMetadataEntry::toEntry).toList();
    return new ConcatMetadataEntry(
        record.name(), record.totalDuration(), boundaries, record.memberVideoIds());
  }

  private static BoundaryEntry toEntry(Boundary boundary) {
    return new BoundaryEntry(boundary.videoId(), boundary.startTime(), boundary.endTime());
  }
}
