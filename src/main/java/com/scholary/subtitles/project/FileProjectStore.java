package com.scholary.subtitles.project;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores each project record as pretty-printed JSON at {@code <projectsDir>/<id>/project.json}.
 *
 * <p>Writes go to a temporary file in the same directory which is then moved over the record, so
 * a crash mid-write leaves the previous record intact.
 */
public class FileProjectStore implements ProjectStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileProjectStore.class);

  private final Path projectsDir;
  private final ObjectReader reader;
  private final ObjectWriter writer;

  public FileProjectStore(Path projectsDir, ObjectMapper objectMapper) {
    this.projectsDir = projectsDir;
    this.reader =
        objectMapper
            .readerFor(ProjectRecord.class)
            .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .with(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    this.writer = objectMapper.writerWithDefaultPrettyPrinter();
  }

  @Override
  public Optional<ProjectRecord> load(String projectId) {
    Path file = pathsFor(projectId).record();
    if (!Files.exists(file)) {
      LOGGER.debug("No record for project {}", projectId);
      return Optional.empty();
    }

    ProjectRecord record;
    try {
      record = reader.readValue(Files.readString(file, StandardCharsets.UTF_8));
    } catch (JsonProcessingException e) {
      throw new ProjectRecordValidationException(
          String.format("Malformed project record: %s", file), e);
    } catch (IOException e) {
      throw new ProjectStoreException(String.format("Failed to read project record: %s", file), e);
    }

    if (record.getSchemaVersion() != ProjectRecord.SCHEMA_VERSION) {
      throw new ProjectRecordValidationException(
          String.format(
              "Unsupported schema version %d in %s, expected %d",
              record.getSchemaVersion(), file, ProjectRecord.SCHEMA_VERSION));
    }
    if (!projectId.equals(record.getId())) {
      throw new ProjectRecordValidationException(
          String.format("Record %s belongs to project %s", file, record.getId()));
    }

    LOGGER.info("Loaded project {} (name: {})", record.getId(), record.getName());
    return Optional.of(record);
  }

  @Override
  public void save(ProjectRecord record) {
    Path file = pathsFor(record.getId()).record();
    Path temp = file.resolveSibling(ProjectPaths.RECORD_FILE + ".tmp");
    try {
      Files.createDirectories(file.getParent());
      Files.writeString(temp, writer.writeValueAsString(record), StandardCharsets.UTF_8);
      Files.move(
          temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      LOGGER.debug("Saved project {}", record.getId());
    } catch (IOException e) {
      throw new ProjectStoreException(
          String.format("Failed to save project record: %s", file), e);
    }
  }

  @Override
  public ProjectPaths pathsFor(String projectId) {
    return ProjectPaths.of(projectsDir, projectId);
  }
}
