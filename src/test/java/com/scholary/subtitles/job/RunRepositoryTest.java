package com.scholary.subtitles.job;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class RunRepositoryTest {

  private final RunRepository repository = new RunRepository(100, 60);

  @Test
  void findById_shouldReturnSavedRun() {
    PipelineRun run = new PipelineRun("run-1", "ep12345abc");

    repository.save(run);

    assertThat(repository.findById("run-1")).containsSame(run);
    assertThat(repository.findById("run-2")).isEmpty();
  }

  @Test
  void delete_shouldRemoveRun() {
    repository.save(new PipelineRun("run-1", "ep12345abc"));

    repository.delete("run-1");

    assertThat(repository.findById("run-1")).isEmpty();
  }
}
