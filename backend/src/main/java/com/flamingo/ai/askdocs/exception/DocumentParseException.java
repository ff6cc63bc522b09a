package com.flamingo.ai.askdocs.exception;

/** Exception thrown when text cannot be extracted from a staged file. */
public class DocumentParseException extends ExternalServiceException {

  public DocumentParseException(String message, Throwable cause) {
    super("Parse service", message, cause, "The document could not be read");
  }
}
