package com.flamingo.ai.askdocs.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(DocumentNotFoundException.class)
  public ResponseEntity<ApiError> handleDocumentNotFound(
      DocumentNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("document_not_found");
    String errorId = generateErrorId();
    log.warn("Document not found [{}]: {}", errorId, ex.getFileName());

    return build(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.DOCUMENT_NOT_FOUND,
        "Document not found",
        null,
        request);
  }

  @ExceptionHandler(StagedFileNotFoundException.class)
  public ResponseEntity<ApiError> handleStagedFileNotFound(
      StagedFileNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("staged_file_not_found");
    String errorId = generateErrorId();
    log.warn("Staged file not found [{}]: {}", errorId, ex.getFileName());

    return build(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.STAGED_FILE_NOT_FOUND,
        ex.getUserMessage(),
        null,
        request);
  }

  @ExceptionHandler(ConcurrentIngestionException.class)
  public ResponseEntity<ApiError> handleConcurrentIngestion(
      ConcurrentIngestionException ex, HttpServletRequest request) {

    incrementErrorCounter("ingestion_in_progress");
    String errorId = generateErrorId();
    log.warn("Rejected concurrent ingestion [{}]: {}", errorId, ex.getFileName());

    return build(
        HttpStatus.CONFLICT,
        errorId,
        ApiError.INGESTION_IN_PROGRESS,
        "This file is already being processed. Try again when it has finished.",
        null,
        request);
  }

  @ExceptionHandler(IngestionException.class)
  public ResponseEntity<ApiError> handleIngestion(
      IngestionException ex, HttpServletRequest request) {

    incrementErrorCounter("ingestion_" + ex.getStep().name().toLowerCase());
    String errorId = generateErrorId();
    log.error(
        "Ingestion failed [{}] file={} step={}: {}",
        errorId,
        ex.getFileName(),
        ex.getStep(),
        ex.getMessage(),
        ex);

    HttpStatus status =
        ex.isTimeout() ? HttpStatus.GATEWAY_TIMEOUT : HttpStatus.UNPROCESSABLE_ENTITY;
    return build(
        status,
        errorId,
        ApiError.INGESTION_FAILED_PREFIX + ex.getStep().name(),
        ex.getUserMessage(),
        "step=" + ex.getStep(),
        request);
  }

  @ExceptionHandler(ExternalServiceException.class)
  public ResponseEntity<ApiError> handleExternalService(
      ExternalServiceException ex, HttpServletRequest request) {

    incrementErrorCounter(ex.isTimedOut() ? "service_timeout" : "service_error");
    String errorId = generateErrorId();
    log.error("{} error [{}]: {}", ex.getService(), errorId, ex.getMessage(), ex);

    if (ex.isTimedOut()) {
      return build(
          HttpStatus.GATEWAY_TIMEOUT,
          errorId,
          ApiError.SERVICE_TIMEOUT,
          ex.getUserMessage(),
          ex.getService(),
          request);
    }
    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.SERVICE_UNAVAILABLE,
        ex.getUserMessage(),
        ex.getService(),
        request);
  }

  @ExceptionHandler(AdminAccessDeniedException.class)
  public ResponseEntity<ApiError> handleAdminAccessDenied(
      AdminAccessDeniedException ex, HttpServletRequest request) {

    incrementErrorCounter("admin_access_denied");
    String errorId = generateErrorId();
    log.warn("Admin access denied [{}]: {}", errorId, ex.getUsername());

    return build(
        HttpStatus.FORBIDDEN,
        errorId,
        ApiError.ADMIN_ACCESS_DENIED,
        "Admin access required",
        null,
        request);
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ApiError> handleMissingHeader(
      MissingRequestHeaderException ex, HttpServletRequest request) {

    incrementErrorCounter("admin_access_denied");
    String errorId = generateErrorId();
    log.warn("Request without {} header [{}]", ex.getHeaderName(), errorId);

    return build(
        HttpStatus.FORBIDDEN,
        errorId,
        ApiError.ADMIN_ACCESS_DENIED,
        "Admin access required",
        null,
        request);
  }

  @ExceptionHandler(LastAdminRemovalException.class)
  public ResponseEntity<ApiError> handleLastAdmin(
      LastAdminRemovalException ex, HttpServletRequest request) {

    incrementErrorCounter("last_admin");
    String errorId = generateErrorId();
    log.warn("Last admin removal rejected [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.LAST_ADMIN,
        ex.getMessage(),
        null,
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.VALIDATION_ERROR,
        message,
        null,
        request);
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ApiError> handleMissingParameter(
      MissingServletRequestParameterException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Missing parameter [{}]: {}", errorId, ex.getParameterName());

    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.VALIDATION_ERROR,
        ex.getParameterName() + " is required",
        null,
        request);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiError> handleIllegalArgument(
      IllegalArgumentException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Invalid request [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.VALIDATION_ERROR,
        ex.getMessage(),
        null,
        request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        null,
        request);
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      String details,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .details(details)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
