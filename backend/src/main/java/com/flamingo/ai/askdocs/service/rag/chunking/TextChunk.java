package com.flamingo.ai.askdocs.service.rag.chunking;

/**
 * A retained line window.
 *
 * @param chunkId 1-based position among the retained windows of the document
 * @param text the window's lines joined with {@code \n}
 */
public record TextChunk(int chunkId, String text) {}
