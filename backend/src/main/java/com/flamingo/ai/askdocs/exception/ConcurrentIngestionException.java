package com.flamingo.ai.askdocs.exception;

/** Exception thrown when another ingestion or removal of the same file is already running. */
public class ConcurrentIngestionException extends RuntimeException {

  private final String fileName;

  public ConcurrentIngestionException(String fileName) {
    super("Ingestion already in progress for " + fileName);
    this.fileName = fileName;
  }

  public String getFileName() {
    return fileName;
  }
}
