package com.scholary.subtitles.config;

import com.scholary.subtitles.pipeline.PipelineProperties;
import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async task execution.
 *
 * <p>Sets up a bounded thread pool for pipeline runs. The pool size and queue capacity are
 * configurable to control how many videos are processed at once.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "taskExecutor")
  public Executor taskExecutor(PipelineProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.asyncExecutorThreads());
    executor.setMaxPoolSize(properties.asyncExecutorThreads());
    executor.setQueueCapacity(properties.asyncExecutorQueueSize());
    executor.setThreadNamePrefix("pipeline-");
    executor.initialize();
    return executor;
  }
}
