package com.scholary.subtitles.pipeline;

import com.scholary.subtitles.project.ProjectPaths;
import com.scholary.subtitles.project.ProjectRecord;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves a finished project directory to {@code <archiveDir>/<name>}.
 *
 * <p>An existing archive entry with the same name is replaced.
 */
public class ProjectArchiver {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProjectArchiver.class);

  private final Path archiveDir;

  public ProjectArchiver(Path archiveDir) {
    this.archiveDir = archiveDir;
  }

  public Path archive(ProjectRecord record, ProjectPaths paths) throws IOException {
    Path source = paths.directory();
    if (!Files.isDirectory(source)) {
      throw new IOException("Project directory not found: " + source);
    }

    Files.createDirectories(archiveDir);
    Path target = archiveDir.resolve(record.getName());
    if (Files.exists(target)) {
      LOGGER.warn("Archived project already exists, replacing: {}", target);
      deleteRecursively(target);
    }

    LOGGER.info("Archiving project {} to {}", record.getId(), target);
    try {
      Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      LOGGER.debug("Archive is on another file store, copying {}", source);
      copyRecursively(source, target);
      deleteRecursively(source);
    }
    return target;
  }

  private static void copyRecursively(Path source, Path target) throws IOException {
    Files.walkFileTree(
        source,
        new SimpleFileVisitor<>() {
          @Override
          public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs)
              throws IOException {
            Files.createDirectories(target.resolve(source.relativize(dir)));
            return FileVisitResult.CONTINUE;
          }

          @Override
          public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
              throws IOException {
            Files.copy(file, target.resolve(source.relativize(file)));
            return FileVisitResult.CONTINUE;
          }
        });
  }

  private static void deleteRecursively(Path root) throws IOException {
    Files.walkFileTree(
        root,
        new SimpleFileVisitor<>() {
          @Override
          public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
              throws IOException {
            Files.delete(file);
            return FileVisitResult.CONTINUE;
          }

          @Override
          public FileVisitResult postVisitDirectory(Path dir, IOException exc)
              throws IOException {
            if (exc != null) {
              throw exc;
            }
            Files.delete(dir);
            return FileVisitResult.CONTINUE;
          }
        });
  }
}
