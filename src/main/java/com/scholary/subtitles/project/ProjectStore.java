package com.scholary.subtitles.project;

import java.util.Optional;

/**
 * Durable storage for project records.
 *
 * <p>{@link #save} replaces the whole record and must be durable before it returns: the stage
 * runner relies on it to checkpoint progress between stages.
 */
public interface ProjectStore {

  /**
   * Load a record.
   *
   * @return the record, or empty when no record exists for the id
   * @throws ProjectRecordValidationException if a record exists but cannot be read
   * @throws ProjectStoreException if the storage cannot be accessed
   */
  Optional<ProjectRecord> load(String projectId);

  /**
   * Persist the full record.
   *
   * @throws ProjectStoreException if the write fails
   */
  void save(ProjectRecord record);

  ProjectPaths pathsFor(String projectId);
}
