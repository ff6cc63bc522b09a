package com.flamingo.ai.askdocs.service.rag.embedding;

import com.flamingo.ai.askdocs.config.RagConfig;
import com.flamingo.ai.askdocs.exception.EmbeddingServiceException;
import com.flamingo.ai.askdocs.service.rag.model.LanguageModelProvider;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns text into vectors with the configured embedding model.
 *
 * <p>Passages and questions go through the same model, resolved by name on every call, so stored
 * vectors and query vectors are always comparable.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  private static final int BATCH_SIZE = 64;

  private final LanguageModelProvider languageModelProvider;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /** Name of the model every vector in the store was produced with. */
  public String modelName() {
    return ragConfig.getEmbedding().getModelName();
  }

  /**
   * Embeds a question.
   *
   * @param query the question text
   * @return embedding vector
   */
  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedQueryFallback")
  public List<Float> embedQuery(String query) {
    List<Float> vector = embedAll(List.of(query)).get(0);
    meterRegistry.counter("embedding.requests.success", "type", "query").increment();
    return vector;
  }

  /**
   * Embeds document passages in batches, preserving order.
   *
   * @param passages the chunk texts
   * @return one vector per passage
   */
  @Timed(value = "embedding.embedPassages", description = "Time to embed passages")
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedPassagesFallback")
  public List<List<Float>> embedPassages(List<String> passages) {
    List<List<Float>> results = new ArrayList<>(passages.size());
    for (int start = 0; start < passages.size(); start += BATCH_SIZE) {
      List<String> batch = passages.subList(start, Math.min(start + BATCH_SIZE, passages.size()));
      results.addAll(embedAll(batch));
    }
    meterRegistry.counter("embedding.requests.success", "type", "passage").increment();
    return results;
  }

  private List<List<Float>> embedAll(List<String> texts) {
    EmbeddingModel model = languageModelProvider.embeddingModel(modelName());
    int maxChars = ragConfig.getEmbedding().getMaxInputChars();
    List<TextSegment> segments = new ArrayList<>(texts.size());
    for (String text : texts) {
      if (text.length() > maxChars) {
        log.warn(
            "Text too long for embedding, truncating from {} to {} chars",
            text.length(),
            maxChars);
        text = text.substring(0, maxChars);
      }
      segments.add(TextSegment.from(text));
    }

    Response<List<Embedding>> response;
    try {
      response = model.embedAll(segments);
    } catch (RuntimeException e) {
      throw new EmbeddingServiceException(
          "Embedding model " + modelName() + " failed: " + e.getMessage(), e);
    }

    List<Embedding> embeddings = response == null ? null : response.content();
    if (embeddings == null || embeddings.size() != texts.size()) {
      throw new EmbeddingServiceException(
          "Embedding model "
              + modelName()
              + " returned "
              + (embeddings == null ? 0 : embeddings.size())
              + " vectors for "
              + texts.size()
              + " inputs");
    }
    List<List<Float>> vectors = new ArrayList<>(embeddings.size());
    for (Embedding embedding : embeddings) {
      if (embedding == null || embedding.vector() == null || embedding.vector().length == 0) {
        throw new EmbeddingServiceException(
            "Embedding model " + modelName() + " returned an empty vector");
      }
      vectors.add(toFloatList(embedding.vector()));
    }
    return vectors;
  }

  /** Converts float array to Float list. */
  private static List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }

  @SuppressWarnings("unused")
  private List<Float> embedQueryFallback(String query, Throwable t) {
    meterRegistry.counter("embedding.requests.failure", "type", "query").increment();
    throw translate(t);
  }

  @SuppressWarnings("unused")
  private List<List<Float>> embedPassagesFallback(List<String> passages, Throwable t) {
    meterRegistry.counter("embedding.requests.failure", "type", "passage").increment();
    throw translate(t);
  }

  private EmbeddingServiceException translate(Throwable t) {
    log.error("Embedding failed: {}", t.getMessage());
    if (t instanceof EmbeddingServiceException e) {
      return e;
    }
    return new EmbeddingServiceException("Embedding service unavailable: " + t.getMessage(), t);
  }
}
