package com.scholary.subtitles.media;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs an external command to completion with a timeout.
 *
 * <p>stdout and stderr are drained on separate threads so a chatty tool cannot block on a full
 * pipe. A process that outlives the timeout is killed.
 */
@Component
public class ProcessRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessRunner.class);

  public ProcessResult run(List<String> command, Duration timeout) throws IOException {
    LOGGER.debug("Running: {}", String.join(" ", command));
    Process process = new ProcessBuilder(command).start();

    ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    ByteArrayOutputStream stderr = new ByteArrayOutputStream();
    Thread outReader = drain(process.getInputStream(), stdout);
    Thread errReader = drain(process.getErrorStream(), stderr);

    try {
      boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (!finished) {
        process.destroyForcibly();
        process.waitFor(5, TimeUnit.SECONDS);
      }
      outReader.join();
      errReader.join();
      int exitCode = finished ? process.exitValue() : -1;
      return new ProcessResult(
          exitCode,
          stdout.toString(StandardCharsets.UTF_8),
          stderr.toString(StandardCharsets.UTF_8),
          !finished);
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new IOException("Interrupted while running " + command.get(0), e);
    }
  }

  private static Thread drain(InputStream in, ByteArrayOutputStream sink) {
    Thread reader =
        new Thread(
            () -> {
              try (InputStream stream = in) {
                stream.transferTo(sink);
              } catch (IOException e) {
                LOGGER.debug("Process stream closed early: {}", e.getMessage());
              }
            });
    reader.setDaemon(true);
    reader.start();
    return reader;
  }

  /** Outcome of one command. {@code exitCode} is -1 when the process timed out. */
  public record ProcessResult(int exitCode, String stdout, String stderr, boolean timedOut) {

    public boolean succeeded() {
      return !timedOut && exitCode == 0;
    }

    /** Last lines of stderr, for error messages. */
    public String errorTail() {
      String text = stderr.isBlank() ? stdout : stderr;
      if (text.isBlank()) {
        return "<no output>";
      }
      String[] lines = text.strip().split("\\R");
      int from = Math.max(0, lines.length - 10);
      return String.join("\n", List.of(lines).subList(from, lines.length));
    }
  }
}
