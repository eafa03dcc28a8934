package com.scholary.subtitles.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.subtitles.pipeline.PipelineProperties;
import com.scholary.subtitles.project.FileProjectStore;
import com.scholary.subtitles.project.ProjectStore;
import com.scholary.subtitles.segmentation.SegmentationProperties;
import com.scholary.subtitles.subtitle.SubtitleProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the pipeline core: project storage, segmentation and subtitle output.
 *
 * <p>Project records are stored as files under {@code pipeline.projectsDir}.
 */
@Configuration
@EnableConfigurationProperties({
  PipelineProperties.class,
  SegmentationProperties.class,
  SubtitleProperties.class
})
public class PipelineConfig {

  @Bean
  public ProjectStore projectStore(PipelineProperties properties, ObjectMapper objectMapper) {
    return new FileProjectStore(properties.projectsDir(), objectMapper);
  }
}
