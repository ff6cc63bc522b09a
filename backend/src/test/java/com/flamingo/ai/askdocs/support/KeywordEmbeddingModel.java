package com.flamingo.ai.askdocs.support;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic embedding model: one dimension per keyword, valued by how often the keyword occurs
 * in the text.
 */
public class KeywordEmbeddingModel implements EmbeddingModel {

  public static final List<String> KEYWORDS =
      List.of("apple", "banana", "cherry", "engine", "rocket", "ocean", "forest", "music");

  private final List<Integer> batchSizes = new ArrayList<>();
  private RuntimeException failure;

  /** Makes every following call throw. Pass null to recover. */
  public void failWith(RuntimeException failure) {
    this.failure = failure;
  }

  public List<Integer> batchSizes() {
    return batchSizes;
  }

  public static float[] vectorFor(String text) {
    String lower = text.toLowerCase(Locale.ROOT);
    float[] vector = new float[KEYWORDS.size()];
    for (int i = 0; i < KEYWORDS.size(); i++) {
      String keyword = KEYWORDS.get(i);
      int from = 0;
      int count = 0;
      while ((from = lower.indexOf(keyword, from)) >= 0) {
        count++;
        from += keyword.length();
      }
      vector[i] = count;
    }
    return vector;
  }

  @Override
  public Response<List<Embedding>> embedAll(List<TextSegment> textSegments) {
    if (failure != null) {
      throw failure;
    }
    batchSizes.add(textSegments.size());
    List<Embedding> embeddings = new ArrayList<>(textSegments.size());
    for (TextSegment segment : textSegments) {
      embeddings.add(Embedding.from(vectorFor(segment.text())));
    }
    return Response.from(embeddings);
  }

  @Override
  public int dimension() {
    return KEYWORDS.size();
  }
}
