package com.flamingo.ai.askdocs.exception;

/** Exception thrown when the embedding service fails or returns an unusable vector. */
public class EmbeddingServiceException extends ExternalServiceException {

  public EmbeddingServiceException(String message) {
    super("Embedding service", message, null, "Embedding service is temporarily unavailable");
  }

  public EmbeddingServiceException(String message, Throwable cause) {
    super("Embedding service", message, cause, "Embedding service is temporarily unavailable");
  }
}
