package com.flamingo.ai.askdocs.support;

import com.flamingo.ai.askdocs.domain.repository.ChunkStore;
import com.flamingo.ai.askdocs.elasticsearch.DocumentChunk;
import com.flamingo.ai.askdocs.service.rag.retrieval.VectorMath;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Chunk store kept in memory, computing exact cosine similarity for nearest-neighbour queries. */
public class InMemoryChunkStore implements ChunkStore {

  private final Map<String, DocumentChunk> chunks = new LinkedHashMap<>();
  private boolean failInserts;

  public void failInserts(boolean fail) {
    this.failInserts = fail;
  }

  @Override
  public synchronized long deleteByFileName(String fileName) {
    List<String> ids =
        chunks.values().stream()
            .filter(c -> c.getFileName().equals(fileName))
            .map(DocumentChunk::getId)
            .toList();
    ids.forEach(chunks::remove);
    return ids.size();
  }

  @Override
  public synchronized void insertChunks(List<DocumentChunk> newChunks) {
    if (failInserts) {
      throw new IllegalStateException("chunk store unavailable");
    }
    for (DocumentChunk chunk : newChunks) {
      chunks.put(chunk.getId(), chunk.toBuilder().embedding(null).relevanceScore(null).build());
    }
  }

  @Override
  public synchronized List<DocumentChunk> findByFileName(String fileName) {
    return chunks.values().stream()
        .filter(c -> c.getFileName().equals(fileName))
        .sorted(Comparator.comparingInt(DocumentChunk::getChunkId))
        .map(c -> c.toBuilder().build())
        .toList();
  }

  @Override
  public synchronized List<DocumentChunk> findWithoutEmbedding(String fileName) {
    return findByFileName(fileName).stream().filter(c -> !c.hasEmbedding()).toList();
  }

  @Override
  public synchronized void updateEmbeddings(Map<String, List<Float>> embeddingsById) {
    embeddingsById.forEach(
        (id, vector) -> {
          DocumentChunk chunk = chunks.get(id);
          if (chunk != null) {
            chunk.setEmbedding(List.copyOf(vector));
          }
        });
  }

  @Override
  public synchronized List<DocumentChunk> findNearest(List<Float> queryEmbedding, int k) {
    List<DocumentChunk> scored = new ArrayList<>();
    for (DocumentChunk chunk : chunks.values()) {
      if (chunk.hasEmbedding()) {
        double score = VectorMath.cosine(queryEmbedding, chunk.getEmbedding());
        scored.add(chunk.toBuilder().relevanceScore(score).build());
      }
    }
    scored.sort(Comparator.comparingDouble(DocumentChunk::getRelevanceScore).reversed());
    return scored.subList(0, Math.min(k, scored.size()));
  }

  @Override
  public synchronized List<DocumentChunk> findRange(
      String fileName, int fromChunkId, int toChunkId) {
    return findByFileName(fileName).stream()
        .filter(c -> c.getChunkId() >= fromChunkId && c.getChunkId() <= toChunkId)
        .toList();
  }

  @Override
  public synchronized long countChunks() {
    return chunks.size();
  }

  @Override
  public synchronized long countEmbeddedChunks() {
    return chunks.values().stream().filter(DocumentChunk::hasEmbedding).count();
  }
}
