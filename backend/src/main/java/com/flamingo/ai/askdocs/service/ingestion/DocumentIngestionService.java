package com.flamingo.ai.askdocs.service.ingestion;

import java.nio.file.Path;
import org.springframework.web.multipart.MultipartFile;

/**
 * Keeps the corpus in sync with source files.
 *
 * <p>Every run for a file name first removes what an earlier run stored for it, so repeated runs
 * over the same content leave the same state behind. Runs for the same file name never overlap.
 */
public interface DocumentIngestionService {

  /**
   * Runs the pipeline for a file name: dedup, stage, parse, chunk, embed.
   *
   * @param fileName logical name of the file, unique within the corpus
   * @param source where the content comes from
   * @return the run outcome
   * @throws com.flamingo.ai.askdocs.exception.IngestionException subtype naming the failed step
   * @throws com.flamingo.ai.askdocs.exception.ConcurrentIngestionException if a run for the same
   *     file name is in progress
   */
  IngestionResult ingest(String fileName, IngestionSource source);

  /** Ingests a local file under the given name. */
  default IngestionResult ingestNew(String fileName, Path localFile) {
    return ingest(fileName, IngestionSource.newUpload(localFile));
  }

  /** Re-ingests a file that is already in the staging area. */
  default IngestionResult ingestExisting(String fileName) {
    return ingest(fileName, IngestionSource.existingStaged());
  }

  /** Validates an uploaded file, ingests it under its base name, and deletes the upload. */
  IngestionResult ingestUpload(MultipartFile file);

  /**
   * Embeds the chunks of a file that have no embedding yet, then marks the document ready.
   *
   * @throws com.flamingo.ai.askdocs.exception.DocumentNotFoundException if no record exists
   */
  IngestionResult embedPending(String fileName);

  /**
   * Deletes every chunk and the document record for a file, then removes its staged blob. Failing
   * to remove the blob does not fail the removal.
   */
  RemovalResult remove(String fileName);
}
