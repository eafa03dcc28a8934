package com.scholary.subtitles;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class SubtitlePipelineApplication {

  public static void main(String[] args) {
    SpringApplication.run(SubtitlePipelineApplication.class, args);
  }
}
