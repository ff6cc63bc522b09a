package com.flamingo.ai.askdocs.service.ingestion;

import com.flamingo.ai.askdocs.domain.enums.IngestionStatus;

/**
 * Outcome of a successful ingestion run.
 *
 * @param fileName the ingested file
 * @param stagedName the staged blob that was parsed
 * @param ingestionId generation tag of the stored records
 * @param chunkCount chunks stored for the file
 * @param embeddedCount chunks embedded by this run
 * @param status final document status
 */
public record IngestionResult(
    String fileName,
    String stagedName,
    String ingestionId,
    int chunkCount,
    int embeddedCount,
    IngestionStatus status) {}
