package com.scholary.subtitles.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.subtitles.api.RunStatusResponse.Status;
import com.scholary.subtitles.pipeline.PipelineService;
import com.scholary.subtitles.pipeline.StageExecutionException;
import com.scholary.subtitles.pipeline.StageListener;
import com.scholary.subtitles.project.ProjectNotFoundException;
import com.scholary.subtitles.project.Stage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PipelineRunLauncherTest {

  @Mock private PipelineService pipelineService;
  @Mock private RunRepository runRepository;

  private PipelineRunLauncher launcher;
  private PipelineRun run;

  @BeforeEach
  void setUp() {
    launcher = new PipelineRunLauncher(pipelineService, runRepository);
    run = new PipelineRun("run-1", "BV1xx411c7mD");
  }

  @Test
  void execute_shouldMarkRunCompletedAndTrackProgress() {
    List<Integer> progress = new ArrayList<>();
    when(pipelineService.processWithContext(eq("BV1xx411c7mD"), eq("run-1"), any()))
        .thenAnswer(
            invocation -> {
              StageListener listener = invocation.getArgument(2);
              listener.onStageSkipped(Stage.METADATA_FETCHED, 1, 4);
              progress.add(run.getProgress());
              listener.onStageStarted(Stage.DOWNLOADED, 2, 4);
              assertThat(run.getCurrentStage()).isEqualTo("DOWNLOADED");
              progress.add(run.getProgress());
              listener.onStageCompleted(Stage.DOWNLOADED, 2, 4);
              progress.add(run.getProgress());
              return null;
            });

    launcher.execute(run);

    assertThat(progress).containsExactly(25, 25, 50);
    assertThat(run.getStatus()).isEqualTo(Status.COMPLETED);
    assertThat(run.getProgress()).isEqualTo(100);
    assertThat(run.getCurrentStage()).isNull();
    verify(runRepository, times(2)).save(run);
  }

  @Test
  void execute_shouldRecordFailedStageAndCause() {
    when(pipelineService.processWithContext(eq("BV1xx411c7mD"), eq("run-1"), any()))
        .thenThrow(new StageExecutionException(Stage.DOWNLOADED, new IOException("network down")));

    launcher.execute(run);

    assertThat(run.getStatus()).isEqualTo(Status.FAILED);
    assertThat(run.getFailedStage()).isEqualTo("DOWNLOADED");
    assertThat(run.getError()).isEqualTo("IOException: network down");
    assertThat(run.toResponse().failedStage()).isEqualTo("DOWNLOADED");
  }

  @Test
  void execute_shouldRecordFailureOutsideStages() {
    when(pipelineService.processWithContext(eq("BV1xx411c7mD"), eq("run-1"), any()))
        .thenThrow(new ProjectNotFoundException("BV1xx411c7mD"));

    launcher.execute(run);

    assertThat(run.getStatus()).isEqualTo(Status.FAILED);
    assertThat(run.getFailedStage()).isNull();
    assertThat(run.getError()).contains("Project not found");
    verify(runRepository, times(2)).save(run);
  }
}
