package com.flamingo.ai.askdocs.service.rag.retrieval;

/**
 * A chunk selected for the answer context.
 *
 * @param fileName source file
 * @param chunkId position within the file
 * @param text chunk text
 * @param similarity cosine similarity to the question; a neighbor without its own vector reports
 *     its anchor's
 * @param anchor true when the chunk was ranked into the top k itself
 */
public record RetrievedChunk(
    String fileName, int chunkId, String text, double similarity, boolean anchor) {}
