package com.scholary.subtitles.media;

import com.scholary.subtitles.media.ProcessRunner.ProcessResult;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** ffmpeg operations: joining downloaded parts and extracting the recognizer's audio track. */
@Component
public class MediaProcessor {

  private static final Logger LOGGER = LoggerFactory.getLogger(MediaProcessor.class);

  private final ProcessRunner processRunner;
  private final MediaProperties properties;

  public MediaProcessor(ProcessRunner processRunner, MediaProperties properties) {
    this.processRunner = processRunner;
    this.properties = properties;
  }

  /**
   * Join video parts into one file.
   *
   * <p>A single part is renamed. Several parts are concatenated in the given order with the concat
   * demuxer without re-encoding; the parts are deleted afterwards.
   */
  public void combineVideos(List<Path> parts, Path output) throws IOException {
    if (parts.isEmpty()) {
      throw new MediaToolException("No downloaded video parts to combine");
    }
    LOGGER.info("Combining {} video part(s) into {}", parts.size(), output);

    if (parts.size() == 1) {
      Files.move(parts.get(0), output, StandardCopyOption.REPLACE_EXISTING);
      return;
    }

    Path listFile = Files.createTempFile(output.toAbsolutePath().getParent(), "concat-", ".txt");
    try {
      StringBuilder list = new StringBuilder();
      for (Path part : parts) {
        list.append("file '").append(part.toAbsolutePath()).append("'\n");
      }
      Files.writeString(listFile, list.toString(), StandardCharsets.UTF_8);

      runFfmpeg(
          List.of(
              properties.ffmpegBin(),
              "-y",
              "-f",
              "concat",
              "-safe",
              "0",
              "-i",
              listFile.toAbsolutePath().toString(),
              "-map",
              "0",
              "-c",
              "copy",
              "-movflags",
              "faststart",
              output.toAbsolutePath().toString()));
    } finally {
      Files.deleteIfExists(listFile);
    }

    for (Path part : parts) {
      Files.deleteIfExists(part);
    }
    LOGGER.info("Combined video written: {}", output);
  }

  /** Extract a mono 16 kHz audio track at 24 kbit/s. */
  public void extractAudio(Path video, Path audio) throws IOException {
    LOGGER.info("Extracting audio: {} -> {}", video, audio);
    runFfmpeg(
        List.of(
            properties.ffmpegBin(),
            "-y",
            "-i",
            video.toAbsolutePath().toString(),
            "-vn",
            "-ac",
            "1",
            "-ar",
            "16000",
            "-b:a",
            "24k",
            audio.toAbsolutePath().toString()));
  }

  private void runFfmpeg(List<String> command) throws IOException {
    ProcessResult result =
        processRunner.run(command, Duration.ofMinutes(properties.processTimeoutMinutes()));
    if (result.timedOut()) {
      throw new MediaToolException(
          String.format("ffmpeg timeout after %d minutes", properties.processTimeoutMinutes()));
    }
    if (!result.succeeded()) {
      throw new MediaToolException(
          String.format("ffmpeg failed (exit=%d): %s", result.exitCode(), result.errorTail()));
    }
  }
}
