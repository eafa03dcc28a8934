package com.scholary.subtitles.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log pipeline events with structured fields that can be queried in the log
 * backend alongside the project and run context.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log stage started event. */
  public void logStageStarted(String projectId, String stage, int stageIndex, int totalStages) {
    try {
      MDC.put("event_type", "stage_started");
      MDC.put("stage", stage);
      MDC.put("stage_index", String.valueOf(stageIndex));
      MDC.put("totalStages", String.valueOf(totalStages));

      logger.info(
          "Stage started: project={}, stage={} ({}/{})",
          projectId,
          stage,
          stageIndex,
          totalStages);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage skipped event (already completed in an earlier run). */
  public void logStageSkipped(String projectId, String stage) {
    try {
      MDC.put("event_type", "stage_skipped");
      MDC.put("stage", stage);

      logger.debug("Stage skipped, already completed: project={}, stage={}", projectId, stage);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage completed event. */
  public void logStageCompleted(String projectId, String stage, long elapsedMs) {
    try {
      MDC.put("event_type", "stage_completed");
      MDC.put("stage", stage);
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info(
          "Stage completed: project={}, stage={}, elapsed={}ms", projectId, stage, elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage failed event. */
  public void logStageFailed(String projectId, String stage, String errorType, String message) {
    try {
      MDC.put("event_type", "stage_failed");
      MDC.put("stage", stage);
      MDC.put("errorType", errorType);

      logger.error(
          "Stage failed: project={}, stage={}, error={}, message={}",
          projectId,
          stage,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log segmentation summary for one channel. */
  public void logSegmentationSummary(
      int channelId, int sentences, int mergeCount, int splitCount, int cues) {
    try {
      MDC.put("event_type", "segmentation_summary");
      MDC.put("channelId", String.valueOf(channelId));
      MDC.put("mergeCount", String.valueOf(mergeCount));
      MDC.put("splitCount", String.valueOf(splitCount));

      logger.info(
          "Segmentation summary: channel={}, sentences={}, merged={}, split={}, cues={}",
          channelId,
          sentences,
          mergeCount,
          splitCount,
          cues);
    } finally {
      clearEventFields();
    }
  }

  /** Log a retried external call. */
  public void logExternalRetry(
      String operation, int attempt, int maxRetries, String errorType, String message) {
    try {
      MDC.put("event_type", "external_retry");
      MDC.put("operation", operation);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxRetries", String.valueOf(maxRetries));
      MDC.put("errorType", errorType);

      logger.warn(
          "External call retry: operation={}, attempt={}/{}, error={}, message={}",
          operation,
          attempt,
          maxRetries,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Set project context in MDC. */
  public static void setProjectContext(String projectId, String runId) {
    MDC.put("projectId", projectId);
    if (runId != null) {
      MDC.put("runId", runId);
    }
  }

  /** Clear project context from MDC. */
  public static void clearProjectContext() {
    MDC.remove("projectId");
    MDC.remove("runId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("stage");
    MDC.remove("stage_index");
    MDC.remove("totalStages");
    MDC.remove("elapsedMs");
    MDC.remove("errorType");
    MDC.remove("channelId");
    MDC.remove("mergeCount");
    MDC.remove("splitCount");
    MDC.remove("operation");
    MDC.remove("attempt");
    MDC.remove("maxRetries");
  }
}
