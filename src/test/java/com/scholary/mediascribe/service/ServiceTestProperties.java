package com.scholary.mediascribe.service;

import com.scholary.mediascribe.config.PipelineProperties;
import com.scholary.mediascribe.config.PipelineProperties.JobStoreProperties;
import com.scholary.mediascribe.config.PipelineProperties.StoreProperties;
import java.nio.file.Path;

final class ServiceTestProperties {

  private ServiceTestProperties() {}

  static PipelineProperties pipeline(Path tempDir) {
    return new PipelineProperties(
        tempDir.resolve("work").toString(),
        tempDir.resolve("out").toString(),
        600,
        30,
        35,
        15_000,
        false,
        10,
        2,
        10,
        new StoreProperties(100, 1),
        new JobStoreProperties(100, 60));
  }
}
