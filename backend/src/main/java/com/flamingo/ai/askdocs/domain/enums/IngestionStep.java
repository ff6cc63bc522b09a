package com.flamingo.ai.askdocs.domain.enums;

/** Ingestion pipeline steps, in execution order. */
public enum IngestionStep {
  DEDUP,
  STAGE,
  PARSE,
  CHUNK,
  EMBED
}
