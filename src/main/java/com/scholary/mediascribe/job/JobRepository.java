package com.scholary.mediascribe.job;

import com.scholary.mediascribe.config.PipelineProperties;
import com.scholary.mediascribe.store.CaffeineKeyValueStore;
import com.scholary.mediascribe.store.KeyValueStore;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for transcription jobs.
 *
 * <p>Bounded by size and age, so finished jobs disappear on their own.
 */
@Repository
public class JobRepository {

  private final KeyValueStore<String, TranscriptionJob> store;

  @Autowired
  public JobRepository(PipelineProperties properties) {
    this(
        new CaffeineKeyValueStore<>(
            "jobs",
            properties.jobStore().maxSize(),
            Duration.ofMinutes(properties.jobStore().ttlMinutes())));
  }

  JobRepository(KeyValueStore<String, TranscriptionJob> store) {
    this.store = store;
  }

  public void save(TranscriptionJob job) {
    store.put(job.getJobId(), job);
  }

  public Optional<TranscriptionJob> findById(String jobId) {
    return store.get(jobId);
  }
}
