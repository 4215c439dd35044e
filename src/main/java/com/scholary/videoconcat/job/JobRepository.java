package com.scholary.videoconcat.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for planning jobs.
 *
 * <p>Uses a Caffeine cache so finished jobs are evicted after {@code jobstore.expire-after-minutes}
 * and the number of tracked jobs stays under {@code jobstore.max-size}. Jobs do not survive a
 * restart.
 */
@Repository
public class JobRepository {

  private final Cache<String, PlanningJob> cache;

  public JobRepository(
      @Value("${jobstore.max-size}") int maxSize,
      @Value("${jobstore.expire-after-minutes}") int expireAfterMinutes) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .build();
  }

  public void save(PlanningJob job) {
    cache.put(job.getJobId(), job);
  }

  public Optional<PlanningJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }
}
