package com.scholary.subtitles.api;

import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.subtitles.job.PipelineRun;
import com.scholary.subtitles.job.PipelineRunLauncher;
import com.scholary.subtitles.job.RunRepository;
import com.scholary.subtitles.pipeline.PipelineService;
import com.scholary.subtitles.project.InvalidSourceException;
import com.scholary.subtitles.project.ProjectRecord;
import com.scholary.subtitles.project.ProjectRecordValidationException;
import com.scholary.subtitles.project.VideoPlatform;
import com.scholary.subtitles.project.VideoSource;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = ProjectController.class)
class ProjectControllerTest {

  private static final String SOURCE = "https://www.bilibili.com/video/BV1xx411c7mD";

  @Autowired private MockMvc mockMvc;

  @MockBean private PipelineService pipelineService;
  @MockBean private PipelineRunLauncher launcher;
  @MockBean private RunRepository runRepository;

  @Test
  void submit_shouldAcceptAndLaunchRun() throws Exception {
    when(pipelineService.open(SOURCE, "variety")).thenReturn(record());

    mockMvc
        .perform(
            post("/api/projects")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"source\": \"" + SOURCE + "\", \"translationHint\": \"variety\"}"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.projectId").value("BV1xx411c7mD"))
        .andExpect(jsonPath("$.runId").isNotEmpty())
        .andExpect(jsonPath("$.statusUrl").value(startsWith("/api/runs/")));

    verify(runRepository).save(any(PipelineRun.class));
    verify(launcher).launch(any(PipelineRun.class));
  }

  @Test
  void submit_shouldRejectBlankSource() throws Exception {
    mockMvc
        .perform(
            post("/api/projects")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"source\": \" \"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("MethodArgumentNotValidException"));

    verify(launcher, never()).launch(any());
  }

  @Test
  void submit_shouldRejectUnrecognizedSource() throws Exception {
    when(pipelineService.open("hello world", null))
        .thenThrow(new InvalidSourceException("hello world"));

    mockMvc
        .perform(
            post("/api/projects")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"source\": \"hello world\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.details").value("Invalid video source: hello world"));
  }

  @Test
  void submit_shouldRejectProjectWithActiveRun() throws Exception {
    when(pipelineService.open(SOURCE, null)).thenReturn(record());
    when(pipelineService.isActive("BV1xx411c7mD")).thenReturn(true);

    mockMvc
        .perform(
            post("/api/projects")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"source\": \"" + SOURCE + "\"}"))
        .andExpect(status().isConflict());

    verify(launcher, never()).launch(any());
  }

  @Test
  void submit_shouldReportCorruptRecord() throws Exception {
    when(pipelineService.open(SOURCE, null))
        .thenThrow(new ProjectRecordValidationException("Malformed project record"));

    mockMvc
        .perform(
            post("/api/projects")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"source\": \"" + SOURCE + "\"}"))
        .andExpect(status().isUnprocessableEntity());
  }

  @Test
  void getRun_shouldReturnStatus() throws Exception {
    PipelineRun run = new PipelineRun("run-1", "BV1xx411c7mD");
    when(runRepository.findById("run-1")).thenReturn(Optional.of(run));

    mockMvc
        .perform(get("/api/runs/run-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("PENDING"))
        .andExpect(jsonPath("$.projectId").value("BV1xx411c7mD"));
  }

  @Test
  void getRun_shouldReturnNotFoundForUnknownRun() throws Exception {
    when(runRepository.findById("missing")).thenReturn(Optional.empty());

    mockMvc.perform(get("/api/runs/missing")).andExpect(status().isNotFound());
  }

  @Test
  void getProject_shouldReturnPersistedRecord() throws Exception {
    when(pipelineService.find("BV1xx411c7mD")).thenReturn(Optional.of(record()));

    mockMvc
        .perform(get("/api/projects/BV1xx411c7mD"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.name").value("video"))
        .andExpect(jsonPath("$.platform").value("BILIBILI"))
        .andExpect(jsonPath("$.is_downloaded").value(false));
  }

  @Test
  void getProject_shouldReturnNotFoundForUnknownProject() throws Exception {
    when(pipelineService.find("ep12345abc")).thenReturn(Optional.empty());

    mockMvc
        .perform(get("/api/projects/ep12345abc"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.details").value("Project not found: ep12345abc"));
  }

  private static ProjectRecord record() {
    return ProjectRecord.create(new VideoSource(VideoPlatform.BILIBILI, "BV1xx411c7mD"), null);
  }
}
