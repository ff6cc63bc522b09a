package com.flamingo.ai.askdocs.domain.enums;

/** Progress of a document through the ingestion pipeline. */
public enum IngestionStatus {
  /** Parsed content stored, no chunks yet. */
  PARSED,
  /** Chunks stored, some or all without embeddings. */
  CHUNKED,
  /** Every chunk has an embedding. */
  READY,
  /** A step failed; see the failed step and error on the record. */
  FAILED
}
