package com.flamingo.ai.askdocs.service.ingestion;

import java.nio.file.Path;

/** Where the bytes for an ingestion run come from. */
public interface IngestionSource {

  /** A local file that still has to be transferred into the staging area. */
  record NewUpload(Path localFile) implements IngestionSource {}

  /** A file already in the staging area from an earlier upload. */
  record ExistingStaged() implements IngestionSource {}

  static IngestionSource newUpload(Path localFile) {
    return new NewUpload(localFile);
  }

  static IngestionSource existingStaged() {
    return new ExistingStaged();
  }
}
