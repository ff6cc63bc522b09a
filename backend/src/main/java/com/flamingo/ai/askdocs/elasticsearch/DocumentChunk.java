package com.flamingo.ai.askdocs.elasticsearch;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of the chunk relation: a window of consecutive lines of a parsed document.
 *
 * <p>{@code chunkId} is 1-based and contiguous within a file name. The embedding is null until the
 * Embed step has run for the chunk.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DocumentChunk implements AbstractElasticsearchIndexService.ScoredDocument {

  private String id;
  private String fileName;
  private int chunkId;
  private String chunkText;
  private String ingestionId;
  private List<Float> embedding;

  // Relevance score from vector search (set by search methods)
  private Double relevanceScore;

  /** Builds the index ID for a chunk of one ingestion run. */
  public static String idFor(String ingestionId, int chunkId) {
    return ingestionId + ":" + chunkId;
  }

  public boolean hasEmbedding() {
    return embedding != null && !embedding.isEmpty();
  }
}
