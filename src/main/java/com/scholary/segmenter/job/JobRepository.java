package com.scholary.segmenter.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.segmenter.config.SegmentationProperties;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for segmentation jobs.
 *
 * <p>Uses a Caffeine cache so that finished jobs are evicted by size and age.
 */
@Repository
public class JobRepository {

  private final Cache<String, SegmentationJob> cache;

  public JobRepository(
      @Value("${jobstore.maxSize}") int maxSize,
      @Value("${jobstore.expireAfterMinutes}") int expireAfterMinutes) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .build();
  }

  /** Create and store a pending job under a fresh id. */
  public SegmentationJob create(String input, String output, SegmentationProperties settings) {
    SegmentationJob job =
        new SegmentationJob(UUID.randomUUID().toString(), input, output, settings);
    save(job);
    return job;
  }

  public void save(SegmentationJob job) {
    cache.put(job.getJobId(), job);
  }

  public Optional<SegmentationJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }
}
