package com.flamingo.ai.askdocs.exception;

import com.flamingo.ai.askdocs.domain.enums.IngestionStep;

/** Exception thrown when re-ingestion is requested for a file that is not in the staging area. */
public class StagedFileNotFoundException extends IngestionException {

  public StagedFileNotFoundException(String fileName) {
    super(
        fileName,
        IngestionStep.STAGE,
        "No staged file found for " + fileName,
        null,
        "File " + fileName + " was not found in the staging area");
  }
}
