package com.scholary.videoconcat.job;

import com.scholary.videoconcat.api.JobStatusResponse.Status;
import com.scholary.videoconcat.api.PlanResponse;
import com.scholary.videoconcat.logging.StructuredLogger;
import com.scholary.videoconcat.planning.PlanProgressListener;
import com.scholary.videoconcat.service.PlanningService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Executes planning jobs on the task executor.
 *
 * <p>Lives in its own bean so that calls from the controller go through the async proxy. Progress
 * moves from 10 to 90 while records are attempted, then to 100 once the plan is saved.
 */
@Component
public class PlanningJobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(PlanningJobRunner.class);

  static final int STARTED_PROGRESS = 10;
  static final int PLANNED_PROGRESS = 90;

  private final PlanningService planningService;
  private final JobRepository jobRepository;

  public PlanningJobRunner(PlanningService planningService, JobRepository jobRepository) {
    this.planningService = planningService;
    this.jobRepository = jobRepository;
  }

  @Async("taskExecutor")
  public void run(PlanningJob job) {
    StructuredLogger.setJobContext(
        job.getJobId(), job.getRequest().bucket(), job.getRequest().catalogKey());
    LOGGER.info("Starting async processing for job: {}", job.getJobId());

    try {
      job.setStatus(Status.PROCESSING);
      job.setProgress(STARTED_PROGRESS);
      jobRepository.save(job);

      PlanResponse result = planningService.plan(job.getRequest(), progressListener(job));

      job.setResult(result);
      job.setProgress(100);
      job.setStatus(Status.COMPLETED);
      jobRepository.save(job);

      LOGGER.info("Completed async processing for job: {}", job.getJobId());

    } catch (Exception e) {
      LOGGER.error("Async processing failed for job: {}", job.getJobId(), e);
      job.setStatus(Status.FAILED);
      job.setError(e.getMessage());
      jobRepository.save(job);
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  static PlanProgressListener progressListener(PlanningJob job) {
    return (attempted, produced, total) -> {
      if (total > 0) {
        int span = PLANNED_PROGRESS - STARTED_PROGRESS;
        job.setProgress(STARTED_PROGRESS + (int) ((long) span * attempted / total));
      }
    };
  }
}
