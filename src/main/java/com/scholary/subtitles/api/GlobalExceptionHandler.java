package com.scholary.subtitles.api;

import com.scholary.subtitles.pipeline.ProjectBusyException;
import com.scholary.subtitles.project.InvalidSourceException;
import com.scholary.subtitles.project.ProjectNotFoundException;
import com.scholary.subtitles.project.ProjectRecordValidationException;
import com.scholary.subtitles.project.ProjectStoreException;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 *
 * <p>Stage failures never reach this handler: runs are asynchronous and report failures through
 * the run status.
 */
@ControllerAdvice
class GlobalExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(InvalidSourceException.class)
  ResponseEntity<ApiError> handleInvalidSource(InvalidSourceException ex) {
    LOGGER.warn("Rejected source: {}", ex.getMessage());
    return error(HttpStatus.BAD_REQUEST, ex, "Unrecognized video source", ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
    String details =
        ex.getBindingResult().getFieldErrors().stream()
            .map(e -> e.getField() + " " + e.getDefaultMessage())
            .reduce((a, b) -> a + "; " + b)
            .orElse(ex.getMessage());
    return error(HttpStatus.BAD_REQUEST, ex, "Invalid request", details);
  }

  @ExceptionHandler(ProjectNotFoundException.class)
  ResponseEntity<ApiError> handleNotFound(ProjectNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ex, "Not found", ex.getMessage());
  }

  @ExceptionHandler(ProjectBusyException.class)
  ResponseEntity<ApiError> handleBusy(ProjectBusyException ex) {
    LOGGER.info("Rejected concurrent run: {}", ex.getMessage());
    return error(HttpStatus.CONFLICT, ex, "Project busy", ex.getMessage());
  }

  @ExceptionHandler(ProjectRecordValidationException.class)
  ResponseEntity<ApiError> handleInvalidRecord(ProjectRecordValidationException ex) {
    LOGGER.error("Unreadable project record", ex);
    return error(
        HttpStatus.UNPROCESSABLE_ENTITY, ex, "Project record is invalid", ex.getMessage());
  }

  @ExceptionHandler(TaskRejectedException.class)
  ResponseEntity<ApiError> handleRejected(TaskRejectedException ex) {
    LOGGER.warn("Run queue full: {}", ex.getMessage());
    return error(
        HttpStatus.SERVICE_UNAVAILABLE, ex, "Too many runs queued", "Please retry later");
  }

  @ExceptionHandler(ProjectStoreException.class)
  ResponseEntity<ApiError> handleStore(ProjectStoreException ex) {
    LOGGER.error("Project storage failure", ex);
    return error(
        HttpStatus.INTERNAL_SERVER_ERROR, ex, "Project storage unavailable", ex.getMessage());
  }

  private static ResponseEntity<ApiError> error(
      HttpStatus status, Exception ex, String message, String details) {
    return ResponseEntity.status(status)
        .body(new ApiError(ex.getClass().getSimpleName(), message, details, Instant.now()));
  }
}
