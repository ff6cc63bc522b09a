package com.flamingo.ai.askdocs.service.rag.retrieval;

import com.flamingo.ai.askdocs.config.RagConfig;
import com.flamingo.ai.askdocs.domain.repository.ChunkStore;
import com.flamingo.ai.askdocs.elasticsearch.DocumentChunk;
import com.flamingo.ai.askdocs.service.rag.embedding.EmbeddingService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Finds the chunks most similar to a question and widens each with its neighbors.
 *
 * <p>Candidates come from the store's approximate nearest-neighbour search and are re-ranked here
 * by exact cosine similarity (ties: file name, then chunk id), so the top k is deterministic. Each
 * anchor contributes the chunks within {@code neighborRadius} positions of it in the same file.
 * Anchor groups follow rank order, chunks inside a group follow chunk id, and a chunk claimed by a
 * higher-ranked group is not repeated.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetrievalService {

  private static final int MAX_CANDIDATES = 10_000;

  private static final Comparator<ScoredChunk> RANKING =
      Comparator.comparingDouble(ScoredChunk::similarity)
          .reversed()
          .thenComparing(s -> s.chunk().getFileName())
          .thenComparingInt(s -> s.chunk().getChunkId());

  private final EmbeddingService embeddingService;
  private final ChunkStore chunkStore;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /** Retrieves with the configured top k and neighbor radius. */
  public ContextBundle retrieve(String question) {
    return retrieve(
        question,
        ragConfig.getRetrieval().getTopK(),
        ragConfig.getRetrieval().getNeighborRadius());
  }

  /**
   * Retrieves the context for a question.
   *
   * @param question the question text
   * @param topK number of anchors, at least 1; clamps to the number of embedded chunks
   * @param neighborRadius chunks on each side of an anchor to include, at least 0
   * @return the context, empty when nothing has been embedded yet
   */
  @Timed(value = "retrieval.retrieve", description = "Time to retrieve context for a question")
  public ContextBundle retrieve(String question, int topK, int neighborRadius) {
    if (question == null || question.isBlank()) {
      throw new IllegalArgumentException("question must not be blank");
    }
    if (topK < 1) {
      throw new IllegalArgumentException("topK must be at least 1: " + topK);
    }
    if (neighborRadius < 0) {
      throw new IllegalArgumentException("neighborRadius must not be negative: " + neighborRadius);
    }

    List<Float> queryVector = embeddingService.embedQuery(question);
    int candidateCount =
        (int)
            Math.min(
                MAX_CANDIDATES,
                (long) topK * Math.max(1, ragConfig.getRetrieval().getCandidatesMultiplier()));
    List<DocumentChunk> candidates = chunkStore.findNearest(queryVector, candidateCount);
    if (candidates.isEmpty()) {
      log.info("No embedded chunks available, returning empty context");
      meterRegistry.counter("retrieval.empty").increment();
      return ContextBundle.empty();
    }

    List<ScoredChunk> ranked = new ArrayList<>(candidates.size());
    for (DocumentChunk candidate : candidates) {
      ranked.add(new ScoredChunk(candidate, similarity(queryVector, candidate, 0)));
    }
    ranked.sort(RANKING);
    List<ScoredChunk> anchors = ranked.subList(0, Math.min(topK, ranked.size()));

    Set<ChunkKey> anchorKeys = new HashSet<>();
    for (ScoredChunk anchor : anchors) {
      anchorKeys.add(ChunkKey.of(anchor.chunk()));
    }

    Set<ChunkKey> seen = new HashSet<>();
    List<RetrievedChunk> ordered = new ArrayList<>();
    for (ScoredChunk anchor : anchors) {
      for (DocumentChunk member : window(anchor.chunk(), neighborRadius)) {
        ChunkKey key = ChunkKey.of(member);
        if (!seen.add(key)) {
          continue;
        }
        boolean isAnchor = anchorKeys.contains(key);
        double similarity =
            key.equals(ChunkKey.of(anchor.chunk()))
                ? anchor.similarity()
                : similarity(queryVector, member, anchor.similarity());
        ordered.add(
            new RetrievedChunk(
                member.getFileName(),
                member.getChunkId(),
                member.getChunkText(),
                similarity,
                isAnchor));
      }
    }

    ContextBundle bundle = ContextBundle.of(ordered);
    log.info(
        "Retrieved {} anchors and {} chunks from {} file(s) (topK={}, radius={}, candidates={})",
        anchors.size(),
        ordered.size(),
        bundle.sources().size(),
        topK,
        neighborRadius,
        candidates.size());
    meterRegistry.counter("retrieval.chunks").increment(ordered.size());
    return bundle;
  }

  /** The anchor plus its neighbors in the same file, ordered by chunk id. */
  private List<DocumentChunk> window(DocumentChunk anchor, int radius) {
    if (radius == 0) {
      return List.of(anchor);
    }
    int from = Math.max(1, anchor.getChunkId() - radius);
    int to = anchor.getChunkId() + radius;
    List<DocumentChunk> window =
        new ArrayList<>(chunkStore.findRange(anchor.getFileName(), from, to));
    boolean containsAnchor = window.stream().anyMatch(c -> c.getChunkId() == anchor.getChunkId());
    if (!containsAnchor) {
      window.add(anchor);
    }
    window.sort(Comparator.comparingInt(DocumentChunk::getChunkId));
    return window;
  }

  private static double similarity(List<Float> queryVector, DocumentChunk chunk, double fallback) {
    if (chunk.hasEmbedding()) {
      return VectorMath.cosine(queryVector, chunk.getEmbedding());
    }
    if (chunk.getRelevanceScore() != null) {
      return chunk.getRelevanceScore();
    }
    return fallback;
  }

  private record ScoredChunk(DocumentChunk chunk, double similarity) {}

  private record ChunkKey(String fileName, int chunkId) {
    static ChunkKey of(DocumentChunk chunk) {
      return new ChunkKey(chunk.getFileName(), chunk.getChunkId());
    }
  }
}
