package com.flamingo.ai.askdocs.domain.repository;

import com.flamingo.ai.askdocs.elasticsearch.DocumentChunk;
import java.util.List;
import java.util.Map;

/**
 * The chunk relation.
 *
 * <p>Reads issued after a write returns observe that write.
 */
public interface ChunkStore {

  /** Deletes every chunk of a file. Returns the number of chunks removed. */
  long deleteByFileName(String fileName);

  /** Stores new chunks. Embeddings, if set, are ignored. */
  void insertChunks(List<DocumentChunk> chunks);

  /** All chunks of a file, ordered by chunk id. */
  List<DocumentChunk> findByFileName(String fileName);

  /** Chunks of a file that have no embedding yet, ordered by chunk id. */
  List<DocumentChunk> findWithoutEmbedding(String fileName);

  /**
   * Sets embeddings on existing chunks.
   *
   * @param embeddingsById embedding vectors keyed by {@link DocumentChunk#getId()}
   */
  void updateEmbeddings(Map<String, List<Float>> embeddingsById);

  /**
   * Candidate chunks most similar to the query vector across all files. Only embedded chunks are
   * returned. Each result carries its cosine similarity in {@code relevanceScore} and its embedding
   * when the store returns vectors.
   */
  List<DocumentChunk> findNearest(List<Float> queryEmbedding, int k);

  /** Chunks of a file with {@code fromChunkId <= chunkId <= toChunkId}, ordered by chunk id. */
  List<DocumentChunk> findRange(String fileName, int fromChunkId, int toChunkId);

  long countChunks();

  long countEmbeddedChunks();
}
