package com.scholary.subtitles.pipeline;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the pipeline.
 *
 * @param projectsDir root directory holding one directory per project
 * @param archiveDir where completed projects are moved; archiving is off when unset
 * @param asyncExecutorThreads worker threads for submitted runs
 * @param asyncExecutorQueueSize runs that may wait for a worker
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public record PipelineProperties(
    @NotNull Path projectsDir,
    Path archiveDir,
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize) {}
