package com.scholary.subtitles.api;

import com.scholary.subtitles.job.PipelineRun;
import com.scholary.subtitles.job.PipelineRunLauncher;
import com.scholary.subtitles.job.RunRepository;
import com.scholary.subtitles.pipeline.PipelineService;
import com.scholary.subtitles.pipeline.ProjectBusyException;
import com.scholary.subtitles.project.ProjectNotFoundException;
import com.scholary.subtitles.project.ProjectRecord;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for submitting videos and following their runs.
 *
 * <p>Submitting returns immediately with a run id; the run itself executes on the task executor.
 */
@RestController
@RequestMapping("/api")
@Tag(name = "Projects", description = "Video to subtitle pipeline")
public class ProjectController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProjectController.class);

  private final PipelineService pipelineService;
  private final PipelineRunLauncher launcher;
  private final RunRepository runRepository;

  public ProjectController(
      PipelineService pipelineService, PipelineRunLauncher launcher, RunRepository runRepository) {
    this.pipelineService = pipelineService;
    this.launcher = launcher;
    this.runRepository = runRepository;
  }

  @PostMapping("/projects")
  @Operation(
      summary = "Process a video",
      description =
          "Create the project for a video URL or id if needed and run every incomplete stage. "
              + "Returns a run id to poll.")
  public ResponseEntity<RunAcceptedResponse> submit(
      @Valid @RequestBody ProjectSubmitRequest request) {
    ProjectRecord record = pipelineService.open(request.source(), request.translationHint());
    if (pipelineService.isActive(record.getId())) {
      throw new ProjectBusyException(record.getId());
    }

    PipelineRun run = new PipelineRun(UUID.randomUUID().toString(), record.getId());
    runRepository.save(run);
    launcher.launch(run);

    LOGGER.info("Run {} submitted for project {}", run.getRunId(), record.getId());
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(
            new RunAcceptedResponse(
                run.getRunId(), record.getId(), "/api/runs/" + run.getRunId()));
  }

  @GetMapping("/runs/{runId}")
  @Operation(summary = "Get run status")
  public ResponseEntity<RunStatusResponse> getRun(@PathVariable String runId) {
    return runRepository
        .findById(runId)
        .map(run -> ResponseEntity.ok(run.toResponse()))
        .orElse(ResponseEntity.notFound().build());
  }

  @GetMapping("/projects/{projectId}")
  @Operation(summary = "Get the persisted project record")
  public ProjectRecord getProject(@PathVariable String projectId) {
    return pipelineService
        .find(projectId)
        .orElseThrow(() -> new ProjectNotFoundException(projectId));
  }
}
