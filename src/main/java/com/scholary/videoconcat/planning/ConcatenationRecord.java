package com.scholary.videoconcat.planning;

import com.scholary.videoconcat.catalog.SourceVideo;
import java.util.ArrayList;
import java.util.List;

/**
 * One planned concatenation: the chosen clips laid end to end.
 *
 * <p>{@code recordId} is the index of the batch attempt that produced the record. Attempts that
 * were discarded leave gaps, so ids are increasing but not necessarily dense.
 */
public record ConcatenationRecord(
    int recordId,
    String name,
    double totalDuration,
    List<Boundary> boundaries,
    List<String> memberVideoIds) {

  public ConcatenationRecord {
    boundaries = List.copyOf(boundaries);
    memberVideoIds = List.copyOf(memberVideoIds);
  }

  /**
   * Build a record from selected clips, deriving contiguous boundaries.
   *
   * <p>Boundary {@code i} starts where boundary {@code i-1} ends and the first one starts at 0.
   * The total equals the last end.
   */
  public static ConcatenationRecord fromSelection(int recordId, List<SourceVideo> selected) {
    List<Boundary> boundaries = new ArrayList<>(selected.size());
    List<String> memberIds = new ArrayList<>(selected.size());
    double currentTime = 0.0;

    for (SourceVideo video : selected) {
      double end = currentTime + video.duration();
      boundaries.add(new Boundary(video.id(), currentTime, end));
      memberIds.add(video.id());
      currentTime = end;
    }

    return new ConcatenationRecord(
        recordId, nameFor(recordId), currentTime, boundaries, memberIds);
  }

  /** Output file name for a record index, e.g. {@code concat_00042.mp4}. */
  public static String nameFor(int recordId) {
    return String.format("concat_%05d.mp4", recordId);
  }

  public int size() {
    return boundaries.size();
  }
}
