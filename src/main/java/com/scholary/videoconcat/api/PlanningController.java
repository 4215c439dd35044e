package com.scholary.videoconcat.api;

import com.scholary.videoconcat.job.JobRepository;
import com.scholary.videoconcat.job.PlanningJob;
import com.scholary.videoconcat.job.PlanningJobRunner;
import com.scholary.videoconcat.service.PlanningService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for concatenation planning.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Previewing a plan synchronously (nothing is saved)
 *   <li>Asynchronous planning (returns job ID immediately)
 *   <li>Job status polling
 * </ul>
 */
@RestController
@Tag(name = "Planning", description = "Video concatenation planning API")
public class PlanningController {

  private static final Logger LOGGER = LoggerFactory.getLogger(PlanningController.class);

  private final PlanningService planningService;
  private final PlanningJobRunner jobRunner;
  private final JobRepository jobRepository;

  public PlanningController(
      PlanningService planningService, PlanningJobRunner jobRunner, JobRepository jobRepository) {
    this.planningService = planningService;
    this.jobRunner = jobRunner;
    this.jobRepository = jobRepository;
  }

  @PostMapping("/api/plans/preview")
  @Operation(
      summary = "Preview a plan",
      description = "Plan a corpus synchronously and return records and statistics without saving")
  public ResponseEntity<PlanResponse> preview(@Valid @RequestBody PlanRequest request) {
    try {
      LOGGER.info(
          "Preview request: bucket={}, catalogKey={}", request.bucket(), request.catalogKey());
      return ResponseEntity.ok(planningService.preview(request));
    } catch (Exception e) {
      LOGGER.error("Preview failed: {}", e.getMessage());
      throw ErrorStatus.from(e);
    }
  }

  /** Start an asynchronous planning job. Settings are validated before the job is created. */
  @PostMapping("/api/plans")
  @Operation(
      summary = "Start planning",
      description = "Start an asynchronous planning job and return a job ID for status polling")
  public ResponseEntity<AsyncJobResponse> plan(@Valid @RequestBody PlanRequest request) {
    try {
      planningService.resolveConfig(request);
    } catch (IllegalArgumentException e) {
      LOGGER.warn("Rejected planning request: {}", e.getMessage());
      throw ErrorStatus.from(e);
    }

    String jobId = UUID.randomUUID().toString();
    LOGGER.info(
        "Planning request: bucket={}, catalogKey={}, jobId={}",
        request.bucket(),
        request.catalogKey(),
        jobId);

    PlanningJob job = new PlanningJob(jobId, request);
    jobRepository.save(job);
    jobRunner.run(job);

    return ResponseEntity.accepted().body(new AsyncJobResponse(jobId, "/api/jobs/" + jobId));
  }

  /**
   * Get job status.
   *
   * <p>Returns the current state of an async job. If the job is completed, includes the full plan.
   */
  @GetMapping("/api/jobs/{id}")
  @Operation(summary = "Get job status", description = "Check the status of an async planning job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(
            job ->
                ResponseEntity.ok(
                    new JobStatusResponse(
                        job.getJobId(),
                        job.getStatus(),
                        job.getProgress(),
                        job.getResult(),
                        job.getError())))
        .orElse(ResponseEntity.notFound().build());
  }
}
