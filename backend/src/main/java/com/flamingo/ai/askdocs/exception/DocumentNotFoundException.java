package com.flamingo.ai.askdocs.exception;

/** Exception thrown when no document record exists for a file name. */
public class DocumentNotFoundException extends RuntimeException {

  private final String fileName;

  public DocumentNotFoundException(String fileName) {
    super("Document not found: " + fileName);
    this.fileName = fileName;
  }

  public String getFileName() {
    return fileName;
  }
}
