package com.scholary.videoconcat.job;

import com.scholary.videoconcat.api.JobStatusResponse.Status;
import com.scholary.videoconcat.api.PlanRequest;
import com.scholary.videoconcat.api.PlanResponse;

/**
 * Represents an async planning job.
 *
 * <p>Tracks the job's state, progress, and result.
 */
public class PlanningJob {

  private final String jobId;
  private final PlanRequest request;

  private volatile Status status;
  private volatile Integer progress; // 0-100
  private volatile PlanResponse result;
  private volatile String error;

  public PlanningJob(String jobId, PlanRequest request) {
    this.jobId = jobId;
    this.request = request;
    this.status = Status.PENDING;
    this.progress = 0;
  }

  public String getJobId() {
    return jobId;
  }

  public PlanRequest getRequest() {
    return request;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public Integer getProgress() {
    return progress;
  }

  public void setProgress(Integer progress) {
    this.progress = progress;
  }

  public PlanResponse getResult() {
    return result;
  }

  public void setResult(PlanResponse result) {
    this.result = result;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }
}
