package com.scholary.subtitles.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for pipeline runs.
 *
 * <p>Uses a Caffeine cache so finished runs are evicted by size and age. Run status is only a view
 * of progress: the durable state is the project record.
 */
@Repository
public class RunRepository {

  private final Cache<String, PipelineRun> cache;

  public RunRepository(
      @Value("${jobstore.maxSize}") int maxSize,
      @Value("${jobstore.expireAfterMinutes}") int expireAfterMinutes) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .build();
  }

  public void save(PipelineRun run) {
    cache.put(run.getRunId(), run);
  }

  public Optional<PipelineRun> findById(String runId) {
    return Optional.ofNullable(cache.getIfPresent(runId));
  }

  public void delete(String runId) {
    cache.invalidate(runId);
  }
}
