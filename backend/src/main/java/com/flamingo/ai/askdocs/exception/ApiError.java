package com.flamingo.ai.askdocs.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String DOCUMENT_NOT_FOUND = "DOCUMENT_001";
  public static final String STAGED_FILE_NOT_FOUND = "DOCUMENT_002";
  public static final String INGESTION_IN_PROGRESS = "DOCUMENT_003";
  public static final String INGESTION_FAILED_PREFIX = "INGEST_";
  public static final String SERVICE_TIMEOUT = "SERVICE_001";
  public static final String SERVICE_UNAVAILABLE = "SERVICE_002";
  public static final String ADMIN_ACCESS_DENIED = "ADMIN_001";
  public static final String LAST_ADMIN = "ADMIN_002";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Technical details, such as the failed ingestion step. */
  private final String details;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
