package com.flamingo.ai.askdocs.exception;

import com.flamingo.ai.askdocs.domain.enums.IngestionStep;

/**
 * Exception thrown when an ingestion step fails.
 *
 * <p>Steps that completed before the failure are not rolled back.
 */
public class IngestionException extends RuntimeException {

  private final String fileName;
  private final IngestionStep step;
  private final String userMessage;

  public IngestionException(
      String fileName, IngestionStep step, String message, Throwable cause, String userMessage) {
    super(message, cause);
    this.fileName = fileName;
    this.step = step;
    this.userMessage = userMessage;
  }

  public IngestionException(String fileName, IngestionStep step, String message, Throwable cause) {
    this(fileName, step, message, cause, "Failed to ingest " + fileName + " at step " + step);
  }

  public String getFileName() {
    return fileName;
  }

  public IngestionStep getStep() {
    return step;
  }

  public String getUserMessage() {
    return userMessage;
  }

  /** True when the step failed because a service timed out. */
  public boolean isTimeout() {
    return getCause() != null && ExternalServiceException.isTimeout(getCause());
  }
}
