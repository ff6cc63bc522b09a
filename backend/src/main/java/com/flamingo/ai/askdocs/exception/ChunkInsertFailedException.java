package com.flamingo.ai.askdocs.exception;

import com.flamingo.ai.askdocs.domain.enums.IngestionStep;

/** Storing the document chunks failed. */
public class ChunkInsertFailedException extends IngestionException {

  public ChunkInsertFailedException(String fileName, String message, Throwable cause) {
    super(fileName, IngestionStep.CHUNK, message, cause);
  }
}
