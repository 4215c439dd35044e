package com.scholary.videoconcat.api;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of an async planning job and includes the result if completed.
 */
public record JobStatusResponse(
    String jobId, Status status, Integer progress, PlanResponse result, String error) {

  public enum Status {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
  }
}
