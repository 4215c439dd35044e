package com.scholary.videoconcat.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log planning events with structured fields that can be queried in the log
 * index.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log an emitted record. */
  public void logRecordPlanned(int recordIndex, int videoCount, double totalDuration, int rounds) {
    try {
      MDC.put("event_type", "record_planned");
      MDC.put("record_index", String.valueOf(recordIndex));
      MDC.put("videoCount", String.valueOf(videoCount));
      MDC.put("totalDuration", String.valueOf(totalDuration));
      MDC.put("rounds", String.valueOf(rounds));

      logger.debug(
          "Record planned: index={}, videos={}, duration={}s, rounds={}",
          recordIndex,
          videoCount,
          totalDuration,
          rounds);
    } finally {
      clearEventFields();
    }
  }

  /** Log a discarded record attempt. */
  public void logRecordDiscarded(
      int recordIndex, String reason, int videoCount, double totalDuration) {
    try {
      MDC.put("event_type", "record_discarded");
      MDC.put("record_index", String.valueOf(recordIndex));
      MDC.put("reason", reason);
      MDC.put("videoCount", String.valueOf(videoCount));
      MDC.put("totalDuration", String.valueOf(totalDuration));

      logger.warn(
          "No videos selected for concat {}, skipping: reason={}, videos={}, duration={}s",
          recordIndex,
          reason,
          videoCount,
          totalDuration);
    } finally {
      clearEventFields();
    }
  }

  /** Log batch progress. */
  public void logPlanProgress(int attempted, int produced, int total) {
    try {
      MDC.put("event_type", "plan_progress");
      MDC.put("attempted", String.valueOf(attempted));
      MDC.put("produced", String.valueOf(produced));
      MDC.put("total", String.valueOf(total));

      logger.info("Generated {}/{} concatenations ({} emitted)", attempted, total, produced);
    } finally {
      clearEventFields();
    }
  }

  /** Log the final outcome of a planning run. */
  public void logPlanSummary(
      String strategy,
      int produced,
      int requested,
      int discarded,
      int distinctVideos,
      int placements) {
    try {
      MDC.put("event_type", "plan_summary");
      MDC.put("strategy", strategy);
      MDC.put("produced", String.valueOf(produced));
      MDC.put("total", String.valueOf(requested));
      MDC.put("discarded", String.valueOf(discarded));
      MDC.put("distinctVideos", String.valueOf(distinctVideos));
      MDC.put("placements", String.valueOf(placements));

      logger.info(
          "Generated {} of {} requested concatenations ({} discarded, strategy={}, "
              + "{} distinct videos over {} placements)",
          produced,
          requested,
          discarded,
          strategy,
          distinctVideos,
          placements);
    } finally {
      clearEventFields();
    }
  }

  /** Log a transition generation failure that fell back to the plain description. */
  public void logTransitionFailed(String concatVideo, int segmentIndex, String message) {
    try {
      MDC.put("event_type", "transition_failed");
      MDC.put("concatVideo", concatVideo);
      MDC.put("segment_index", String.valueOf(segmentIndex));

      logger.warn(
          "Transition failed, keeping description: video={}, segment={}, error={}",
          concatVideo,
          segmentIndex,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a concatenation left out of the annotations because of blank summaries. */
  public void logIncompleteDropped(String concatVideo, int blankSegments) {
    try {
      MDC.put("event_type", "annotation_dropped");
      MDC.put("concatVideo", concatVideo);
      MDC.put("blankSegments", String.valueOf(blankSegments));

      logger.info(
          "Dropping concatenation with empty summaries: video={}, blankSegments={}",
          concatVideo,
          blankSegments);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String bucket, String key) {
    MDC.put("jobId", jobId);
    MDC.put("bucket", bucket);
    MDC.put("key", key);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("bucket");
    MDC.remove("key");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("record_index");
    MDC.remove("reason");
    MDC.remove("videoCount");
    MDC.remove("totalDuration");
    MDC.remove("rounds");
    MDC.remove("attempted");
    MDC.remove("produced");
    MDC.remove("total");
    MDC.remove("strategy");
    MDC.remove("discarded");
    MDC.remove("distinctVideos");
    MDC.remove("placements");
    MDC.remove("concatVideo");
    MDC.remove("segment_index");
    MDC.remove("blankSegments");
  }
}
