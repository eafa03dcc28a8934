package com.scholary.subtitles.media;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.subtitles.media.ProcessRunner.ProcessResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link VideoSourceClient} backed by the yt-dlp command line tool.
 *
 * <p>Downloads pick the best video and audio streams and merge them into mp4. A cookies file, when
 * configured, is passed through for sites that need a signed-in session.
 */
@Component
public class YtDlpClient implements VideoSourceClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(YtDlpClient.class);

  private final ProcessRunner processRunner;
  private final MediaProperties properties;
  private final ObjectMapper objectMapper;

  public YtDlpClient(
      ProcessRunner processRunner, MediaProperties properties, ObjectMapper objectMapper) {
    this.processRunner = processRunner;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public VideoMetadata fetchMetadata(String sourceUrl) throws IOException {
    LOGGER.info("Fetching video metadata: {}", sourceUrl);

    List<String> command = baseCommand();
    command.add("--dump-single-json");
    command.add("--skip-download");
    command.add(sourceUrl);

    ProcessResult result = execute(command);
    VideoMetadata metadata = objectMapper.readValue(result.stdout(), VideoMetadata.class);
    LOGGER.info("Fetched metadata: id={}, title={}", metadata.id(), metadata.title());
    return metadata;
  }

  @Override
  public void download(String sourceUrl, Path directory) throws IOException {
    LOGGER.info("Downloading video: url={}, dir={}", sourceUrl, directory);
    Files.createDirectories(directory);

    List<String> command = baseCommand();
    command.addAll(
        List.of(
            "-f",
            "bestvideo+bestaudio/best",
            "--merge-output-format",
            "mp4",
            "--ffmpeg-location",
            properties.ffmpegBin(),
            "-o",
            directory.toAbsolutePath() + "/%(playlist_index|0)s.%(ext)s",
            sourceUrl));

    execute(command);
    LOGGER.info("Download finished: {}", sourceUrl);
  }

  List<String> baseCommand() {
    List<String> command = new ArrayList<>();
    command.add(properties.ytDlpBin());
    command.add("--no-progress");
    if (properties.cookiesFile() != null && Files.exists(properties.cookiesFile())) {
      command.add("--cookies");
      command.add(properties.cookiesFile().toAbsolutePath().toString());
    }
    return command;
  }

  private ProcessResult execute(List<String> command) throws IOException {
    ProcessResult result =
        processRunner.run(command, Duration.ofMinutes(properties.processTimeoutMinutes()));
    if (result.timedOut()) {
      throw new MediaToolException(
          String.format(
              "yt-dlp timeout after %d minutes", properties.processTimeoutMinutes()));
    }
    if (!result.succeeded()) {
      throw new MediaToolException(
          String.format("yt-dlp failed (exit=%d): %s", result.exitCode(), result.errorTail()));
    }
    return result;
  }
}
