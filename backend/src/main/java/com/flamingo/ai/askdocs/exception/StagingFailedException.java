package com.flamingo.ai.askdocs.exception;

import com.flamingo.ai.askdocs.domain.enums.IngestionStep;

/** Transferring the file to the staging area failed. */
public class StagingFailedException extends IngestionException {

  public StagingFailedException(String fileName, String message, Throwable cause) {
    super(fileName, IngestionStep.STAGE, message, cause);
  }
}
