package com.scholary.subtitles.project;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** File layout of one project directory. */
public record ProjectPaths(Path directory) {

  public static final String RECORD_FILE = "project.json";
  public static final String VIDEO_FILE = "video.mp4";
  public static final String AUDIO_FILE = "audio.opus";
  public static final String ASR_FILE = "asr.json";
  public static final String SOURCE_SRT_FILE = "asr.srt";
  public static final String TRANSLATED_SRT_FILE = "video.srt";
  public static final String TRANSLATED_VTT_FILE = "video.vtt";

  /** Downloaded parts are named by playlist index, e.g. {@code 0.mp4}, {@code 3.mp4}. */
  private static final Pattern PART_FILE = Pattern.compile("\\d+\\.mp4");

  public static ProjectPaths of(Path projectsDir, String projectId) {
    return new ProjectPaths(projectsDir.resolve(projectId));
  }

  public Path record() {
    return directory.resolve(RECORD_FILE);
  }

  public Path video() {
    return directory.resolve(VIDEO_FILE);
  }

  public Path audio() {
    return directory.resolve(AUDIO_FILE);
  }

  public Path asrJson() {
    return directory.resolve(ASR_FILE);
  }

  public Path sourceSrt() {
    return directory.resolve(SOURCE_SRT_FILE);
  }

  public Path translatedSrt() {
    return directory.resolve(TRANSLATED_SRT_FILE);
  }

  public Path translatedVtt() {
    return directory.resolve(TRANSLATED_VTT_FILE);
  }

  /** Downloaded video parts in playlist order. */
  public List<Path> downloadedParts() throws IOException {
    if (!Files.isDirectory(directory)) {
      return List.of();
    }
    try (Stream<Path> files = Files.list(directory)) {
      return files
          .filter(Files::isRegularFile)
          .filter(p -> PART_FILE.matcher(p.getFileName().toString()).matches())
          .sorted(Comparator.comparingLong(ProjectPaths::partIndex))
          .collect(Collectors.toList());
    }
  }

  private static long partIndex(Path part) {
    String name = part.getFileName().toString();
    return Long.parseLong(name.substring(0, name.indexOf('.')));
  }
}
