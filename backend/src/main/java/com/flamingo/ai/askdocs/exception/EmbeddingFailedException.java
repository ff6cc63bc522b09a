package com.flamingo.ai.askdocs.exception;

import com.flamingo.ai.askdocs.domain.enums.IngestionStep;

/** Embedding the document chunks failed. */
public class EmbeddingFailedException extends IngestionException {

  public EmbeddingFailedException(String fileName, String message, Throwable cause) {
    super(fileName, IngestionStep.EMBED, message, cause);
  }
}
