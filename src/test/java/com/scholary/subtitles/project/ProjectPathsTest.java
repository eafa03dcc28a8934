package com.scholary.subtitles.project;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProjectPathsTest {

  @TempDir Path projectsDir;

  @Test
  void downloadedParts_shouldListNumberedPartsInPlaylistOrder() throws IOException {
    ProjectPaths paths = ProjectPaths.of(projectsDir, "BV1xx411c7mD");
    Files.createDirectories(paths.directory());
    for (String name : new String[] {"10.mp4", "2.mp4", "1.mp4", "video.mp4", "notes.txt"}) {
      Files.writeString(paths.directory().resolve(name), "x");
    }

    assertThat(paths.downloadedParts())
        .extracting(p -> p.getFileName().toString())
        .containsExactly("1.mp4", "2.mp4", "10.mp4");
  }

  @Test
  void downloadedParts_shouldBeEmptyWithoutDirectory() throws IOException {
    assertThat(ProjectPaths.of(projectsDir, "missing").downloadedParts()).isEmpty();
  }

  @Test
  void paths_shouldResolveInsideProjectDirectory() {
    ProjectPaths paths = ProjectPaths.of(projectsDir, "abc123");

    assertThat(paths.record()).isEqualTo(projectsDir.resolve("abc123/project.json"));
    assertThat(paths.sourceSrt().getFileName().toString()).isEqualTo("asr.srt");
    assertThat(paths.translatedVtt().getFileName().toString()).isEqualTo("video.vtt");
  }
}
