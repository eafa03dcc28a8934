package com.scholary.subtitles.job;

import com.scholary.subtitles.api.RunStatusResponse.Status;
import com.scholary.subtitles.pipeline.PipelineService;
import com.scholary.subtitles.pipeline.StageExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Executes pipeline runs on the task executor and records their outcome.
 *
 * <p>Lives in its own bean so that {@link Async} goes through the Spring proxy.
 */
@Service
public class PipelineRunLauncher {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineRunLauncher.class);

  private final PipelineService pipelineService;
  private final RunRepository runRepository;

  public PipelineRunLauncher(PipelineService pipelineService, RunRepository runRepository) {
    this.pipelineService = pipelineService;
    this.runRepository = runRepository;
  }

  @Async
  public void launch(PipelineRun run) {
    execute(run);
  }

  void execute(PipelineRun run) {
    run.setStatus(Status.RUNNING);
    runRepository.save(run);
    try {
      pipelineService.processWithContext(
          run.getProjectId(), run.getRunId(), new RunProgressListener(run));
      run.setProgress(100);
      run.setCurrentStage(null);
      run.setStatus(Status.COMPLETED);
      LOGGER.info("Run {} completed for project {}", run.getRunId(), run.getProjectId());

    } catch (StageExecutionException e) {
      Throwable cause = e.getCause();
      run.fail(e.getStage().name(), cause.getClass().getSimpleName() + ": " + cause.getMessage());
      LOGGER.error("Run {} failed at stage {}", run.getRunId(), e.getStage(), cause);

    } catch (RuntimeException e) {
      run.fail(run.getCurrentStage(), e.getClass().getSimpleName() + ": " + e.getMessage());
      LOGGER.error("Run {} failed", run.getRunId(), e);

    } finally {
      runRepository.save(run);
    }
  }
}
