package com.flamingo.ai.askdocs.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.flamingo.ai.askdocs.domain.repository.ChunkStore;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.reflect.Method;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;

@ExtendWith(MockitoExtension.class)
@DisplayName("DocumentChunkIndexService Tests")
class DocumentChunkIndexServiceTest {

  private static final String INDEX = "askdocs-chunks-test";

  @Mock private ElasticsearchClient elasticsearchClient;

  private SimpleMeterRegistry meterRegistry;
  private DocumentChunkIndexService service;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    service = new DocumentChunkIndexService(elasticsearchClient, meterRegistry, INDEX, 3);
  }

  @Nested
  @DisplayName("Nearest-chunk search")
  class NearestSearch {

    @Test
    @DisplayName("Should score every embedded chunk with an exact cosine script")
    void shouldUseExactCosineScript() {
      SearchRequest request = service.buildVectorSearchRequest(Map.of(), List.of(1f, 0f, 0f), 7);

      assertThat(request.knn()).isEmpty();
      assertThat(request.query().isScriptScore()).isTrue();
      assertThat(request.query().scriptScore().query().isExists()).isTrue();
      assertThat(request.query().scriptScore().script().source().scriptString())
          .contains("cosineSimilarity(params.query_vector, 'embedding')");
      assertThat(request.query().scriptScore().script().params()).containsKey("query_vector");
      assertThat(request.size()).isEqualTo(7);
      assertThat(request.sort()).hasSize(3);
    }

    @Test
    @DisplayName("Should report plain cosine similarity as the relevance score")
    void shouldShiftScriptScoreBack() throws IOException {
      Map<String, Object> source = new HashMap<>();
      source.put(DocumentChunkIndexService.FILE_NAME, "a.pdf");
      source.put(DocumentChunkIndexService.CHUNK_ID, 2);
      source.put(DocumentChunkIndexService.CHUNK_TEXT, "text");
      source.put(DocumentChunkIndexService.INGESTION_ID, "run");
      source.put(DocumentChunkIndexService.EMBEDDING, List.of(1.0, 0.0, 0.0));
      SearchResponse<Map> response =
          SearchResponse.of(
              r ->
                  r.took(1)
                      .timedOut(false)
                      .shards(sh -> sh.total(1).successful(1).failed(0))
                      .hits(
                          h ->
                              h.hits(
                                  List.of(
                                      Hit.<Map>of(
                                          hit ->
                                              hit.index(INDEX)
                                                  .id("run:2")
                                                  .score(1.75)
                                                  .source(source))))));
      when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class)))
          .thenReturn(response);

      List<DocumentChunk> nearest = service.findNearest(List.of(1f, 0f, 0f), 5);

      assertThat(nearest).hasSize(1);
      assertThat(nearest.get(0).getId()).isEqualTo("run:2");
      assertThat(nearest.get(0).getRelevanceScore()).isEqualTo(0.75);
      assertThat(nearest.get(0).getEmbedding()).containsExactly(1f, 0f, 0f);
      ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);
      verify(elasticsearchClient).search(captor.capture(), eq(Map.class));
      assertThat(captor.getValue().index()).containsExactly(INDEX);
    }
  }

  @Nested
  @DisplayName("Advice on chunk store operations")
  class Advice {

    @Test
    @DisplayName("Every chunk store operation should be guarded by the elasticsearch breaker")
    void shouldGuardEveryChunkStoreOperation() throws NoSuchMethodException {
      for (Method method : ChunkStore.class.getMethods()) {
        Method implementation =
            DocumentChunkIndexService.class.getMethod(
                method.getName(), method.getParameterTypes());
        CircuitBreaker breaker = implementation.getAnnotation(CircuitBreaker.class);
        assertThat(breaker).as(method.getName()).isNotNull();
        assertThat(breaker.name()).isEqualTo("elasticsearch");
      }
    }

    @Test
    @DisplayName("Should time calls made through the chunk store proxy")
    void shouldTimeCallsThroughProxy() throws IOException {
      when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class)))
          .thenThrow(new IOException("connection refused"));
      AspectJProxyFactory factory = new AspectJProxyFactory(service);
      factory.addAspect(new TimedAspect(meterRegistry));
      ChunkStore chunkStore = factory.getProxy();

      assertThatThrownBy(() -> chunkStore.findRange("a.pdf", 1, 3))
          .isInstanceOf(UncheckedIOException.class);

      assertThat(meterRegistry.find("chunks.find_range").timer()).isNotNull();
      assertThat(meterRegistry.find("chunks.find_range").timer().count()).isEqualTo(1);
    }
  }
}
