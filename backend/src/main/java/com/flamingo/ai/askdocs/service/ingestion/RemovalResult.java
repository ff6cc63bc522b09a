package com.flamingo.ai.askdocs.service.ingestion;

/**
 * Outcome of removing a file from the corpus.
 *
 * @param fileName the removed file
 * @param chunksRemoved chunks deleted
 * @param documentRemoved whether a document record existed and was deleted
 * @param stagedFileRemoved whether a staged blob was deleted
 */
public record RemovalResult(
    String fileName, long chunksRemoved, boolean documentRemoved, boolean stagedFileRemoved) {}
