package com.flamingo.ai.askdocs.exception;

import com.flamingo.ai.askdocs.domain.enums.IngestionStep;

/** Parsing the staged file failed. */
public class ParseFailedException extends IngestionException {

  public ParseFailedException(String fileName, String message, Throwable cause) {
    super(fileName, IngestionStep.PARSE, message, cause);
  }
}
