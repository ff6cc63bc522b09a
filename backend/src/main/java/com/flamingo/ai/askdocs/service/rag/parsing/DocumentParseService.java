package com.flamingo.ai.askdocs.service.rag.parsing;

import com.flamingo.ai.askdocs.domain.enums.ParseMode;
import com.flamingo.ai.askdocs.service.staging.StagedFile;

/** Extracts the text content of a staged file. */
public interface DocumentParseService {

  /**
   * Parses a staged file.
   *
   * @param stagedFile the staged blob
   * @param mode the extraction mode
   * @return the document text, lines separated by {@code \n}
   * @throws com.flamingo.ai.askdocs.exception.DocumentParseException if extraction fails or times
   *     out
   */
  String parse(StagedFile stagedFile, ParseMode mode);
}
